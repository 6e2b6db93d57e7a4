package io.dcocheck;

import java.util.Collection;
import java.util.Optional;

/**
 * Decides whether a commit is exempt from signing off.
 */
public class CommitClassifier {

	/**
	 * Classify the commit provided. Rules are evaluated in order and the first one that
	 * applies wins: merge commits, commits authored by bots and, when members are not
	 * required to sign off, verified commits from trusted members.
	 * @param commit commit to classify
	 * @param config effective repository configuration
	 * @param members logins of the trusted members
	 * @return the reason the commit is skipped, or empty if it must be checked
	 */
	public Optional<CommitSuccessReason> classify(Commit commit, EffectiveConfig config, Collection<String> members) {
		if (commit.merge()) {
			return Optional.of(CommitSuccessReason.IS_MERGE);
		}

		if (commit.author() != null && commit.author().bot()) {
			return Optional.of(CommitSuccessReason.FROM_BOT);
		}

		if (!config.membersSignOffRequired() && commit.isVerified() && isFromMember(commit, members)) {
			return Optional.of(CommitSuccessReason.FROM_MEMBER);
		}

		return Optional.empty();
	}

	private boolean isFromMember(Commit commit, Collection<String> members) {
		return (commit.author() != null && commit.author().login() != null
				&& members.contains(commit.author().login()))
				|| (commit.committer() != null && commit.committer().login() != null
						&& members.contains(commit.committer().login()));
	}

}
