package io.dcocheck;

import java.time.Instant;

/**
 * Rate limit information from the GitHub API response headers.
 *
 * @param limit the maximum number of requests allowed per hour
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 */
public record RateLimitInfo(int limit, int remaining, long reset) {

	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	public boolean isExceeded() {
		return remaining <= 0;
	}

}
