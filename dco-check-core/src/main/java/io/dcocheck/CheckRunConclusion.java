package io.dcocheck;

/**
 * Conclusion reported for a completed check run.
 */
public enum CheckRunConclusion {

	SUCCESS("success"),

	ACTION_REQUIRED("action_required");

	private final String apiValue;

	CheckRunConclusion(String apiValue) {
		this.apiValue = apiValue;
	}

	/**
	 * Value expected by the GitHub checks API.
	 */
	public String getApiValue() {
		return apiValue;
	}

}
