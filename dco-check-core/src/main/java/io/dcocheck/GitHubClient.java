package io.dcocheck;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Callers provide the value of the {@code Authorization} header on each request, since a
 * GitHub App authenticates as the app itself (JWT) or as one of its installations
 * (installation token) depending on the endpoint. Implementations can be decorated
 * (retrying, logging) or mocked in tests.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @param authorization value of the Authorization header
	 * @return response body (empty for responses without content)
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path, String authorization);

	/**
	 * Execute a POST request with a JSON body.
	 * @param path API path or full URL
	 * @param body JSON request body
	 * @param authorization value of the Authorization header
	 * @return response body
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String post(String path, String body, String authorization);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
