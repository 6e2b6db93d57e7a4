package io.dcocheck;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the remediation statements declared in the messages of the pull request
 * commits.
 *
 * <p>
 * Two forms are recognized, each on its own line:
 *
 * <pre>
 * I, Name &lt;email&gt;, hereby add my Signed-off-by to this commit: SHA
 * On behalf of Name &lt;email&gt;, I, Name &lt;email&gt;, hereby add my Signed-off-by to this commit: SHA
 * </pre>
 *
 * <p>
 * A statement is only kept when the person making it (the declarant for the individual
 * form, the representative for the third-party form) is the author or the committer of the
 * commit that contains it. Statements failing that validation are dropped without being
 * reported: they have no effect on the result.
 */
public class RemediationCollector {

	private static final Logger logger = LoggerFactory.getLogger(RemediationCollector.class);

	// Names and emails cannot contain brackets or line breaks, which keeps every split
	// point unique. Groups are trimmed after matching.
	private static final String PERSON = "([^<>\\r\\n]*)<([^<>\\r\\n]*)>";

	private static final String TARGET = ",[ \\t]*hereby add my Signed-off-by to this commit:[ \\t]*(\\S+)[ \\t\\r]*$";

	private static final Pattern INDIVIDUAL = Pattern.compile("^I," + PERSON + TARGET,
			Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

	private static final Pattern THIRD_PARTY = Pattern.compile("^On behalf of" + PERSON + ",[ \\t]*I," + PERSON + TARGET,
			Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

	/**
	 * Collect the valid remediations declared in any of the commits provided.
	 * @param commits all commits in the pull request
	 * @param config effective repository configuration
	 * @return remediations found (empty when individual remediations are not allowed)
	 */
	public List<Remediation> collect(List<Commit> commits, EffectiveConfig config) {
		List<Remediation> remediations = new ArrayList<>();

		// Third-party remediations are only honored when individual ones are allowed too
		if (!config.individualRemediationAllowed()) {
			return remediations;
		}

		for (Commit commit : commits) {
			collectIndividual(commit, remediations);
			if (config.thirdPartyRemediationAllowed()) {
				collectThirdParty(commit, remediations);
			}
		}

		return remediations;
	}

	private void collectIndividual(Commit commit, List<Remediation> remediations) {
		Matcher matcher = INDIVIDUAL.matcher(commit.message());
		while (matcher.find()) {
			String name = matcher.group(1).trim();
			String email = matcher.group(2).trim();
			String targetSha = matcher.group(3);

			if (!commit.isAuthoredOrCommittedBy(name, email)) {
				logger.debug("remediation in commit {} ignored: declarant {} <{}> is not the author or committer",
						commit.sha(), name, email);
				continue;
			}
			remediations.add(new Remediation(GitUser.of(name, email), targetSha));
		}
	}

	private void collectThirdParty(Commit commit, List<Remediation> remediations) {
		Matcher matcher = THIRD_PARTY.matcher(commit.message());
		while (matcher.find()) {
			String declarantName = matcher.group(1).trim();
			String declarantEmail = matcher.group(2).trim();
			String representativeName = matcher.group(3).trim();
			String representativeEmail = matcher.group(4).trim();
			String targetSha = matcher.group(5);

			if (!commit.isAuthoredOrCommittedBy(representativeName, representativeEmail)) {
				logger.debug(
						"third-party remediation in commit {} ignored: representative {} <{}> is not the author or committer",
						commit.sha(), representativeName, representativeEmail);
				continue;
			}
			remediations.add(new Remediation(GitUser.of(declarantName, declarantEmail), targetSha));
		}
	}

}
