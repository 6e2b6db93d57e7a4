package io.dcocheck;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * {@link GitHubClient} decorator retrying transient failures.
 *
 * <p>
 * A request is attempted again when {@link GitHubHttpClient.GitHubApiException#isRetryable()}
 * holds: network failures, 5xx responses and rate limit errors. Between attempts the
 * client sleeps for a delay that doubles every time, except for rate limit errors whose
 * reset is less than a minute away, where it sleeps until the reset instead. Other
 * failures reach the caller on the first attempt.
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient())
 *     .maxRetries(3)
 *     .initialDelay(Duration.ofMillis(500))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	// Longest wait for a rate limit reset, beyond it the regular backoff applies
	private static final Duration MAX_RESET_WAIT = Duration.ofSeconds(60);

	private final GitHubClient delegate;

	private final int maxRetries;

	private final Duration initialDelay;

	private RetryingGitHubClient(GitHubClient delegate, int maxRetries, Duration initialDelay) {
		this.delegate = delegate;
		this.maxRetries = maxRetries;
		this.initialDelay = initialDelay;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path, String authorization) {
		return withRetries("GET " + path, () -> delegate.get(path, authorization));
	}

	@Override
	public String post(String path, String body, String authorization) {
		return withRetries("POST " + path, () -> delegate.post(path, body, authorization));
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private String withRetries(String request, Supplier<String> call) {
		Duration backoff = initialDelay;
		int attempt = 1;
		while (true) {
			try {
				return call.get();
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				if (!e.isRetryable() || attempt > maxRetries) {
					if (e.isRetryable()) {
						logger.error("{} still failing after {} attempts: {}", request, attempt, e.getMessage());
					}
					throw e;
				}
				Duration wait = waitBeforeRetry(e, backoff);
				logger.warn("{} failed ({}), retry {}/{} in {}ms", request, e.getMessage(), attempt, maxRetries,
						wait.toMillis());
				pause(wait);
				backoff = backoff.multipliedBy(2);
				attempt++;
			}
		}
	}

	private static Duration waitBeforeRetry(GitHubHttpClient.GitHubApiException e, Duration backoff) {
		if (!e.isRateLimitError() || e.getResetEpochSeconds() <= 0) {
			return backoff;
		}
		Duration untilReset = Duration.between(Instant.now(), Instant.ofEpochSecond(e.getResetEpochSeconds()))
			.plusSeconds(1);
		if (untilReset.isNegative() || untilReset.isZero() || untilReset.compareTo(MAX_RESET_WAIT) > 0) {
			return backoff;
		}
		return untilReset;
	}

	private static void pause(Duration wait) {
		try {
			Thread.sleep(wait.toMillis());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("interrupted while waiting to retry", e);
		}
	}

	/**
	 * Builder for {@link RetryingGitHubClient}. Without settings, a failed request is tried
	 * 3 more times, waiting 500ms before the first retry.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 3;

		private Duration initialDelay = Duration.ofMillis(500);

		private Builder() {
		}

		/**
		 * Client the requests are sent with (required).
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder initialDelay(Duration delay) {
			this.initialDelay = delay;
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			return initialDelay(Duration.ofMillis(delayMs));
		}

		/**
		 * Build the client.
		 * @throws IllegalStateException if no client to wrap was set or a setting is out of
		 * range
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("No GitHubClient to wrap, call wrapping() first");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries cannot be negative: " + maxRetries);
			}
			if (initialDelay.isNegative() || initialDelay.isZero()) {
				throw new IllegalStateException("initialDelay must be positive: " + initialDelay);
			}
			return new RetryingGitHubClient(delegate, maxRetries, initialDelay);
		}

	}

}
