package io.dcocheck;

/**
 * Reasons why a commit passed the check.
 */
public enum CommitSuccessReason {

	IS_MERGE("merge commit"),

	FROM_BOT("author is a bot"),

	FROM_MEMBER("author is a member of the organization"),

	VALID_SIGN_OFF("valid sign-off found"),

	VALID_SIGN_OFF_IN_REMEDIATION_COMMIT("valid sign-off found in remediation commit");

	private final String description;

	CommitSuccessReason(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}

}
