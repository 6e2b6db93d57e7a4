package io.dcocheck;

/**
 * Errors that may be found on a commit during the check.
 */
public enum CommitError {

	INVALID_AUTHOR_EMAIL("invalid author email"),

	INVALID_COMMITTER_EMAIL("invalid committer email"),

	SIGN_OFF_MISMATCH("no sign-off matches the author or committer"),

	SIGN_OFF_NOT_FOUND("sign-off not found");

	private final String description;

	CommitError(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}

}
