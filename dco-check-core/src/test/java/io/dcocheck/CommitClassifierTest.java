package io.dcocheck;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.dcocheck.TestCommits.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("CommitClassifier Tests")
class CommitClassifierTest {

	private final CommitClassifier classifier = new CommitClassifier();

	private static final EffectiveConfig MEMBERS_EXEMPT = new EffectiveConfig(false, false, false);

	@Test
	@DisplayName("Merge takes precedence over bot authorship")
	void mergeBeforeBot() {
		Commit commit = new Commit("sha1", bot("bot", "bot@email.test", "bot"), null, "Merge", true, null, "");

		assertThat(classifier.classify(commit, EffectiveConfig.defaults(), List.of()))
			.contains(CommitSuccessReason.IS_MERGE);
	}

	@Test
	@DisplayName("Bot committer alone does not exempt the commit")
	void botCommitterNotExempt() {
		Commit commit = commit("sha1", USER1, bot("bot", "bot@email.test", "bot"), "Test");

		assertThat(classifier.classify(commit, EffectiveConfig.defaults(), List.of())).isEmpty();
	}

	@Test
	@DisplayName("Verified commit committed by a member is exempt")
	void memberCommitter() {
		Commit commit = new Commit("sha1", USER1, withLogin(USER2, "user2"), "Test", false, true, "");

		assertThat(classifier.classify(commit, MEMBERS_EXEMPT, List.of("user2")))
			.contains(CommitSuccessReason.FROM_MEMBER);
	}

	@Test
	@DisplayName("Verified commit from a non-member is checked")
	void nonMember() {
		Commit commit = verifiedCommit("sha1", withLogin(USER1, "user1"), "Test");

		assertThat(classifier.classify(commit, MEMBERS_EXEMPT, List.of("user2"))).isEmpty();
	}

	@Test
	@DisplayName("Commit with unknown verification status is checked")
	void unknownVerification() {
		Commit commit = commit("sha1", withLogin(USER1, "user1"), "Test");

		assertThat(classifier.classify(commit, MEMBERS_EXEMPT, List.of("user1"))).isEmpty();
	}

	@Test
	@DisplayName("Regular commit is checked")
	void regularCommit() {
		assertThat(classifier.classify(commit("sha1", USER1, "Test"), EffectiveConfig.defaults(), List.of()))
			.isEmpty();
	}

}
