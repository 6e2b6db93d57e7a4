package io.dcocheck;

/**
 * Statement in a commit message that retroactively signs off an earlier commit.
 *
 * @param declarant the identity adding its sign-off to the target commit
 * @param targetSha SHA of the commit being signed off
 */
public record Remediation(GitUser declarant, String targetSha) {
}
