package io.dcocheck;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CheckRun Tests")
class CheckRunTest {

	private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

	private static CheckRun checkRun(String summary, List<CheckRunAction> actions) {
		return new CheckRun("DCO", "sha1", CheckRunConclusion.ACTION_REQUIRED, "Check failed", summary, actions, NOW,
				NOW);
	}

	@Test
	@DisplayName("Should keep fields within limits unchanged")
	void shouldKeepShortFields() {
		CheckRunAction action = new CheckRunAction("Set DCO to pass", "Manually set DCO check result to passed",
				"override");

		CheckRun checkRun = checkRun("summary", List.of(action));

		assertThat(checkRun.summary()).isEqualTo("summary");
		assertThat(checkRun.actions()).containsExactly(action);
	}

	@Test
	@DisplayName("Should truncate the summary")
	void shouldTruncateSummary() {
		CheckRun checkRun = checkRun("x".repeat(CheckRun.MAX_SUMMARY_LENGTH + 100), List.of());

		assertThat(checkRun.summary()).hasSize(CheckRun.MAX_SUMMARY_LENGTH);
	}

	@Test
	@DisplayName("Should truncate action fields")
	void shouldTruncateActions() {
		CheckRun checkRun = checkRun("summary",
				List.of(new CheckRunAction("l".repeat(30), "d".repeat(50), "i".repeat(25))));

		CheckRunAction action = checkRun.actions().get(0);
		assertThat(action.label()).hasSize(CheckRun.MAX_ACTION_LABEL_LENGTH);
		assertThat(action.description()).hasSize(CheckRun.MAX_ACTION_DESCRIPTION_LENGTH);
		assertThat(action.identifier()).hasSize(CheckRun.MAX_ACTION_IDENTIFIER_LENGTH);
	}

	@Test
	@DisplayName("Should not split a surrogate pair when truncating")
	void shouldNotSplitSurrogatePair() {
		String label = "a".repeat(CheckRun.MAX_ACTION_LABEL_LENGTH - 1) + "😀";

		CheckRun checkRun = checkRun("summary", List.of(new CheckRunAction(label, "description", "override")));

		assertThat(checkRun.actions().get(0).label()).isEqualTo("a".repeat(CheckRun.MAX_ACTION_LABEL_LENGTH - 1));
	}

}
