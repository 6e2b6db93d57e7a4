package io.dcocheck;

import org.jspecify.annotations.Nullable;

/**
 * Commit included in a pull request, as returned by the GitHub compare API.
 *
 * @param sha the commit SHA
 * @param author the git author (null if not recorded)
 * @param committer the git committer (null if not recorded)
 * @param message the full commit message
 * @param merge whether the commit has more than one parent
 * @param verified whether GitHub verified the commit signature (null if unknown)
 * @param htmlUrl the web URL of the commit
 */
public record Commit(String sha, @Nullable GitUser author, @Nullable GitUser committer, String message,
		boolean merge, @Nullable Boolean verified, String htmlUrl) {

	/**
	 * Returns true if the given name and email match the author or the committer of this
	 * commit.
	 */
	public boolean isAuthoredOrCommittedBy(String name, String email) {
		return (author != null && author.hasIdentity(name, email))
				|| (committer != null && committer.hasIdentity(name, email));
	}

	/**
	 * Returns true only when GitHub reported the commit as verified.
	 */
	public boolean isVerified() {
		return Boolean.TRUE.equals(verified);
	}

}
