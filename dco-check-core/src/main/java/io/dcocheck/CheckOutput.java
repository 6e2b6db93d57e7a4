package io.dcocheck;

import java.util.List;

/**
 * Result of a DCO check over all the commits of a pull request.
 *
 * @param commits per-commit results, in input order
 * @param config effective configuration the check ran with
 * @param headRef name of the pull request head branch
 * @param numCommitsWithErrors number of commits with at least one error
 * @param onlyLastCommitContainsErrors true if exactly one commit has errors and it is the
 * last one
 */
public record CheckOutput(List<CommitCheckOutput> commits, EffectiveConfig config, String headRef,
		int numCommitsWithErrors, boolean onlyLastCommitContainsErrors) {

	public CheckOutput {
		commits = List.copyOf(commits);
	}

	/**
	 * Create a check output computing the aggregate fields from the commit results.
	 */
	public static CheckOutput of(List<CommitCheckOutput> commits, EffectiveConfig config, String headRef) {
		int withErrors = (int) commits.stream().filter(CommitCheckOutput::hasErrors).count();
		boolean onlyLast = withErrors == 1 && commits.get(commits.size() - 1).hasErrors();
		return new CheckOutput(commits, config, headRef, withErrors, onlyLast);
	}

	public boolean passed() {
		return numCommitsWithErrors == 0;
	}

	/**
	 * Returns true if any commit contains any of the given errors.
	 */
	public boolean containsAnyError(CommitError... errors) {
		List<CommitError> wanted = List.of(errors);
		return commits.stream().flatMap(c -> c.errors().stream()).anyMatch(wanted::contains);
	}

}
