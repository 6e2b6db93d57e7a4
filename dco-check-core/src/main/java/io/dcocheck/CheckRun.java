package io.dcocheck;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Completed check run to be reported to GitHub.
 *
 * <p>
 * Fields exceeding the lengths accepted by GitHub are truncated on creation. Truncation is
 * logged, never reported as an error.
 *
 * @param name check name displayed in GitHub
 * @param headSha SHA of the commit the check run belongs to
 * @param conclusion check conclusion
 * @param title output title
 * @param summary output summary (Markdown)
 * @param actions actions offered to maintainers
 * @param startedAt when the check started
 * @param completedAt when the check completed
 */
public record CheckRun(String name, String headSha, CheckRunConclusion conclusion, String title, String summary,
		List<CheckRunAction> actions, Instant startedAt, Instant completedAt) {

	private static final Logger logger = LoggerFactory.getLogger(CheckRun.class);

	static final int MAX_SUMMARY_LENGTH = 65535;

	static final int MAX_ACTION_LABEL_LENGTH = 20;

	static final int MAX_ACTION_DESCRIPTION_LENGTH = 40;

	static final int MAX_ACTION_IDENTIFIER_LENGTH = 20;

	/**
	 * Status of every check run reported: results are only submitted once computed.
	 */
	public static final String STATUS_COMPLETED = "completed";

	public CheckRun {
		summary = truncate(summary, MAX_SUMMARY_LENGTH, "summary");

		List<CheckRunAction> truncatedActions = new ArrayList<>(actions.size());
		for (CheckRunAction action : actions) {
			truncatedActions.add(new CheckRunAction(truncate(action.label(), MAX_ACTION_LABEL_LENGTH, "action label"),
					truncate(action.description(), MAX_ACTION_DESCRIPTION_LENGTH, "action description"),
					truncate(action.identifier(), MAX_ACTION_IDENTIFIER_LENGTH, "action identifier")));
		}
		actions = List.copyOf(truncatedActions);
	}

	private static String truncate(String value, int maxLength, String field) {
		if (value.length() <= maxLength) {
			return value;
		}
		int end = maxLength;
		if (Character.isHighSurrogate(value.charAt(end - 1))) {
			end--;
		}
		logger.warn("check run {} truncated ({} > {} characters)", field, value.length(), maxLength);
		return value.substring(0, end);
	}

}
