package io.dcocheck;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the Markdown summary of a check run from the check output.
 */
public class CheckSummaryRenderer {

	private static final int SHORT_SHA_LENGTH = 7;

	public String render(CheckOutput output) {
		StringBuilder md = new StringBuilder();

		if (output.passed()) {
			md.append("## All commits are signed off!\n\n");
			appendCommitsTable(md, output.commits());
			return md.toString();
		}

		int failed = output.numCommitsWithErrors();
		md.append("## Check failed\n\n");
		if (failed == 1) {
			md.append("There is one commit incorrectly signed off.");
		}
		else {
			md.append("There are ").append(failed).append(" commits incorrectly signed off.");
		}
		md.append(" This means that the author(s) of these commits failed to include a Signed-off-by line in")
			.append(" their commit message, or that the sign-off does not match the commit author or committer.\n\n");

		appendCommitsWithErrors(md, output.commits());

		if (output.containsAnyError(CommitError.INVALID_AUTHOR_EMAIL, CommitError.INVALID_COMMITTER_EMAIL)) {
			md.append("Some commits were made with an invalid email address. Please configure a valid email in")
				.append(" git (`git config user.email`) and amend those commits.\n\n");
		}

		if (output.containsAnyError(CommitError.SIGN_OFF_NOT_FOUND, CommitError.SIGN_OFF_MISMATCH)) {
			appendSignOffInstructions(md, output);
		}

		md.append("### Summary\n\n");
		appendCommitsTable(md, output.commits());

		md.append("\nIf the sign-off issues cannot be fixed, a maintainer can use the **Set DCO to pass** button")
			.append(" in the checks tab to override this check.\n");
		return md.toString();
	}

	private void appendCommitsWithErrors(StringBuilder md, List<CommitCheckOutput> commits) {
		md.append("### Commits with errors\n\n");
		for (CommitCheckOutput c : commits) {
			if (!c.hasErrors()) {
				continue;
			}
			String errors = c.errors().stream().map(CommitError::getDescription).collect(Collectors.joining(", "));
			md.append("- ").append(commitLink(c.commit())).append(": ").append(errors).append('\n');
		}
		md.append('\n');
	}

	private void appendSignOffInstructions(StringBuilder md, CheckOutput output) {
		md.append("### How to fix it\n\n");
		md.append("To avoid having pull requests blocked in the future, always include")
			.append(" `Signed-off-by: Author Name <authoremail@example.com>` in every commit message.")
			.append(" You can do this automatically by using the `-s` flag (i.e. `git commit -s`).\n\n");

		if (output.onlyLastCommitContainsErrors()) {
			md.append("To sign off the last commit, run:\n\n```\ngit commit --amend --signoff\n");
		}
		else {
			md.append("To sign off all the commits in this branch, run:\n\n```\ngit rebase HEAD~")
				.append(commitsToRebase(output.commits()))
				.append(" --signoff\n");
		}
		md.append("git push --force-with-lease origin ").append(output.headRef()).append("\n```\n\n");

		EffectiveConfig config = output.config();
		if (config.individualRemediationAllowed()) {
			md.append("Alternatively, this repository allows remediation commits. Add a commit including a line")
				.append(" like the following for each commit to fix, using the name and email of its author:\n\n")
				.append("```\nI, Name <email>, hereby add my Signed-off-by to this commit: SHA\n```\n\n");
			if (config.thirdPartyRemediationAllowed()) {
				md.append("Sign-offs on behalf of another person can be added with:\n\n")
					.append("```\nOn behalf of Name <email>, I, Name <email>, hereby add my Signed-off-by")
					.append(" to this commit: SHA\n```\n\n");
			}
		}
	}

	private void appendCommitsTable(StringBuilder md, List<CommitCheckOutput> commits) {
		md.append("| Commit | Author | Result |\n");
		md.append("|---|---|---|\n");
		for (CommitCheckOutput c : commits) {
			String author = c.commit().author() != null ? escape(c.commit().author().name()) : "-";
			md.append("| ").append(commitLink(c.commit())).append(" | ").append(author).append(" | ");
			if (c.hasErrors()) {
				md.append("failed");
			}
			else if (c.successReason() != null) {
				md.append("passed (").append(c.successReason().getDescription()).append(')');
			}
			else {
				md.append("passed");
			}
			md.append(" |\n");
		}
	}

	/**
	 * Number of commits from the first commit with errors up to the head of the branch.
	 */
	static int commitsToRebase(List<CommitCheckOutput> commits) {
		for (int i = 0; i < commits.size(); i++) {
			if (commits.get(i).hasErrors()) {
				return commits.size() - i;
			}
		}
		return 0;
	}

	private static String commitLink(Commit commit) {
		String sha = commit.sha();
		String shortSha = sha.length() > SHORT_SHA_LENGTH ? sha.substring(0, SHORT_SHA_LENGTH) : sha;
		if (commit.htmlUrl().isEmpty()) {
			return "`" + shortSha + "`";
		}
		return "[`" + shortSha + "`](" + commit.htmlUrl() + ")";
	}

	private static String escape(String text) {
		return text.replace("|", "\\|");
	}

}
