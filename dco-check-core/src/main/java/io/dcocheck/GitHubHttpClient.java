package io.dcocheck;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * HTTP client for the GitHub REST API built on the JDK {@link HttpClient}.
 *
 * <p>
 * Extracts rate limit headers from all responses and makes them available via
 * {@link #getLastRateLimitInfo()}. Non-2xx responses are turned into
 * {@link GitHubApiException}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	/**
	 * Base URL of the public GitHub API.
	 */
	public static final String DEFAULT_API_BASE = "https://api.github.com";

	private static final String API_VERSION = "2022-11-28";

	private static final String USER_AGENT = "dco-check";

	private final HttpClient httpClient;

	private final String apiBase;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient() {
		this(DEFAULT_API_BASE);
	}

	/**
	 * Create a client for the API host provided (GitHub Enterprise Server).
	 * @param apiBase base URL of the API, without trailing slash
	 */
	public GitHubHttpClient(String apiBase) {
		this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String get(String path, String authorization) {
		HttpRequest request = newRequest(path, authorization).GET().build();
		return send("GET", request);
	}

	@Override
	public String post(String path, String body, String authorization) {
		HttpRequest request = newRequest(path, authorization).header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
		return send("POST", request);
	}

	private HttpRequest.Builder newRequest(String path, String authorization) {
		String url = path.startsWith("http") ? path : apiBase + path;
		return HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(Duration.ofSeconds(30))
			.header("Authorization", authorization)
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", API_VERSION)
			.header("User-Agent", USER_AGENT);
	}

	private String send(String method, HttpRequest request) {
		logger.debug("{} {}", method, request.uri());
		long start = System.currentTimeMillis();
		try {
			String response = executeRequest(request);
			logger.debug("{} {} completed in {}ms ({} bytes)", method, request.uri(),
					System.currentTimeMillis() - start, response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("{} {} failed after {}ms: {}", method, request.uri(), System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request) {
		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}

		RateLimitInfo rateLimit = new RateLimitInfo((int) longHeader(response, "X-RateLimit-Limit"),
				(int) longHeader(response, "X-RateLimit-Remaining"), longHeader(response, "X-RateLimit-Reset"));
		if (rateLimit.remaining() >= 0) {
			this.lastRateLimitInfo = rateLimit;
			if (rateLimit.remaining() < 100) {
				logger.info("Rate limit low: {}/{} remaining, resets at {}", rateLimit.remaining(), rateLimit.limit(),
						rateLimit.getResetTime());
			}
		}

		int status = response.statusCode();
		String body = response.body() != null ? response.body() : "";
		if (status / 100 == 2) {
			return body;
		}
		throw new GitHubApiException(errorMessage(status, request, rateLimit), status, body, rateLimit.remaining(),
				rateLimit.reset());
	}

	private static String errorMessage(int status, HttpRequest request, RateLimitInfo rateLimit) {
		switch (status) {
			case 401:
				return "Unauthorized: bad credentials";
			case 404:
				return "Not found: " + request.uri();
			case 403:
			case 429:
				if (status == 429 || rateLimit.remaining() == 0) {
					return "Rate limit exceeded (" + status + "), resets at epoch " + rateLimit.reset();
				}
				return "Forbidden: " + request.uri();
			default:
				return "GitHub API error: " + status;
		}
	}

	/**
	 * Numeric response header value, or -1 when absent or malformed.
	 */
	private static long longHeader(HttpResponse<?> response, String name) {
		Optional<String> value = response.headers().firstValue(name);
		if (value.isEmpty()) {
			return -1;
		}
		try {
			return Long.parseLong(value.get().trim());
		}
		catch (NumberFormatException e) {
			logger.debug("Ignoring malformed {} header: {}", name, value.get());
			return -1;
		}
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 *
	 * <p>
	 * Carries the status code and rate limit information when available, enabling retry
	 * decisions in {@link RetryingGitHubClient}. The status code is -1 for network
	 * failures.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, String responseBody, int rateLimitRemaining,
				long resetEpochSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		public boolean isNotFound() {
			return statusCode == 404;
		}

		/**
		 * Returns true if this exception represents a rate limit error (either 403 with
		 * remaining=0 or 429).
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

		/**
		 * Returns true if retrying the request may succeed: network failures, server
		 * errors and rate limit errors.
		 */
		public boolean isRetryable() {
			return statusCode < 0 || statusCode >= 500 || isRateLimitError();
		}

	}

}
