package io.dcocheck;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingGitHubClient}.
 */
@DisplayName("RetryingGitHubClient Tests")
@ExtendWith(MockitoExtension.class)
class RetryingGitHubClientTest {

	private static final String AUTH = "Bearer ghs_token";

	private static final String PATH = "/repos/owner/repo/compare/a...b";

	@Mock
	private GitHubClient delegate;

	private GitHubClient client;

	@BeforeEach
	void setUp() {
		client = RetryingGitHubClient.builder().wrapping(delegate).maxRetries(2).initialDelayMs(1).build();
	}

	private static GitHubHttpClient.GitHubApiException apiError(int status) {
		return new GitHubHttpClient.GitHubApiException("GitHub API error: " + status, status, "");
	}

	@Test
	@DisplayName("Should return the first successful response")
	void shouldPassThroughSuccess() {
		when(delegate.post("/repos/owner/repo/check-runs", "{}", AUTH)).thenReturn("{\"id\":1}");

		assertThat(client.post("/repos/owner/repo/check-runs", "{}", AUTH)).isEqualTo("{\"id\":1}");
		verify(delegate).post("/repos/owner/repo/check-runs", "{}", AUTH);
	}

	@Test
	@DisplayName("Should expose the rate limit seen by the wrapped client")
	void shouldExposeRateLimitInfo() {
		RateLimitInfo info = new RateLimitInfo(5000, 12, 1700000000L);
		when(delegate.getLastRateLimitInfo()).thenReturn(info);

		assertThat(client.getLastRateLimitInfo()).isSameAs(info);
	}

	@Nested
	@DisplayName("Transient failures")
	class TransientFailureTest {

		@ParameterizedTest
		@ValueSource(ints = { 500, 502, 503, 429 })
		@DisplayName("Should retry server errors and throttling")
		void shouldRetryStatus(int status) {
			when(delegate.get(PATH, AUTH)).thenThrow(apiError(status)).thenReturn("ok");

			assertThat(client.get(PATH, AUTH)).isEqualTo("ok");
			verify(delegate, times(2)).get(PATH, AUTH);
		}

		@Test
		@DisplayName("Should retry network failures")
		void shouldRetryNetworkFailure() {
			when(delegate.get(PATH, AUTH))
				.thenThrow(new GitHubHttpClient.GitHubApiException("HTTP request failed", new IOException("reset")))
				.thenReturn("ok");

			assertThat(client.get(PATH, AUTH)).isEqualTo("ok");
		}

		@Test
		@DisplayName("Should retry once the rate limit was reset")
		void shouldRetryExhaustedRateLimit() {
			long reset = Instant.now().getEpochSecond() - 1;
			when(delegate.get(PATH, AUTH))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Rate limit exceeded", 403, "", 0, reset))
				.thenReturn("ok");

			assertThat(client.get(PATH, AUTH)).isEqualTo("ok");
		}

		@Test
		@DisplayName("Should rethrow the last failure when retries run out")
		void shouldGiveUp() {
			GitHubHttpClient.GitHubApiException failure = apiError(503);
			when(delegate.get(PATH, AUTH)).thenThrow(failure);

			assertThatThrownBy(() -> client.get(PATH, AUTH)).isSameAs(failure);
			verify(delegate, times(3)).get(PATH, AUTH);
		}

	}

	@Nested
	@DisplayName("Permanent failures")
	class PermanentFailureTest {

		@ParameterizedTest
		@ValueSource(ints = { 400, 401, 404, 422 })
		@DisplayName("Should not retry client errors")
		void shouldNotRetryStatus(int status) {
			when(delegate.get(PATH, AUTH)).thenThrow(apiError(status));

			assertThatThrownBy(() -> client.get(PATH, AUTH)).isInstanceOf(GitHubHttpClient.GitHubApiException.class);
			verify(delegate, times(1)).get(PATH, AUTH);
		}

		@Test
		@DisplayName("Should not retry forbidden requests with rate limit left")
		void shouldNotRetryForbidden() {
			when(delegate.get(PATH, AUTH))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Forbidden", 403, "", 4000, -1));

			assertThatThrownBy(() -> client.get(PATH, AUTH)).isInstanceOf(GitHubHttpClient.GitHubApiException.class);
			verify(delegate, times(1)).get(PATH, AUTH);
		}

		@Test
		@DisplayName("Should not retry other runtime exceptions")
		void shouldNotRetryOtherExceptions() {
			when(delegate.get(PATH, AUTH)).thenThrow(new IllegalStateException("bug"));

			assertThatThrownBy(() -> client.get(PATH, AUTH)).isInstanceOf(IllegalStateException.class);
			verify(delegate, times(1)).get(PATH, AUTH);
		}

	}

	@Nested
	@DisplayName("Builder")
	class BuilderTest {

		@Test
		@DisplayName("Should require a client to wrap")
		void shouldRequireDelegate() {
			assertThatThrownBy(() -> RetryingGitHubClient.builder().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("wrapping()");
		}

		@Test
		@DisplayName("Should reject out of range settings")
		void shouldRejectInvalidSettings() {
			assertThatThrownBy(() -> RetryingGitHubClient.builder().wrapping(delegate).maxRetries(-1).build())
				.isInstanceOf(IllegalStateException.class);
			assertThatThrownBy(
					() -> RetryingGitHubClient.builder().wrapping(delegate).initialDelay(Duration.ZERO).build())
				.isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should allow disabling retries")
		void shouldAllowZeroRetries() {
			GitHubClient noRetries = RetryingGitHubClient.builder().wrapping(delegate).maxRetries(0).build();
			when(delegate.get(PATH, AUTH)).thenThrow(apiError(500));

			assertThatThrownBy(() -> noRetries.get(PATH, AUTH)).isInstanceOf(GitHubHttpClient.GitHubApiException.class);
			verify(delegate, times(1)).get(PATH, AUTH);
		}

	}

}
