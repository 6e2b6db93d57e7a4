package io.dcocheck;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.security.PrivateKey;

/**
 * Builder wiring the DCO check services without a dependency injection container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * EventProcessor processor = DcoCheckBuilder.create()
 *     .appId(12345)
 *     .privateKeyPem(pem)
 *     .buildEventProcessor();
 *
 * // For testing with a mock client
 * DcoClient mockClient = mock(DcoClient.class);
 * EventProcessor testProcessor = DcoCheckBuilder.create()
 *     .dcoClient(mockClient)
 *     .buildEventProcessor();
 * }
 * </pre>
 */
public class DcoCheckBuilder {

	private @Nullable Long appId;

	private @Nullable PrivateKey privateKey;

	private String apiBaseUrl = GitHubHttpClient.DEFAULT_API_BASE;

	private @Nullable GitHubClient httpClient;

	private @Nullable DcoClient dcoClient;

	private boolean cacheMemberships = true;

	private DcoCheckBuilder() {
	}

	/**
	 * Create a new builder instance.
	 * @return new DcoCheckBuilder
	 */
	public static DcoCheckBuilder create() {
		return new DcoCheckBuilder();
	}

	/**
	 * Set the GitHub App id.
	 * @param appId GitHub App id
	 * @return this builder
	 */
	public DcoCheckBuilder appId(long appId) {
		this.appId = appId;
		return this;
	}

	/**
	 * Set the GitHub App private key.
	 * @param pem PEM encoded RSA private key
	 * @return this builder
	 * @throws IllegalArgumentException if the key cannot be read
	 */
	public DcoCheckBuilder privateKeyPem(String pem) {
		this.privateKey = PrivateKeys.parsePem(pem);
		return this;
	}

	/**
	 * Set the GitHub API host, for GitHub Enterprise Server installations.
	 * @param apiHost API base URL (null to use the public GitHub API)
	 * @return this builder
	 */
	public DcoCheckBuilder apiHost(@Nullable String apiHost) {
		this.apiBaseUrl = apiHost != null && !apiHost.isBlank() ? apiHost : GitHubHttpClient.DEFAULT_API_BASE;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. When not set, a
	 * {@link GitHubHttpClient} wrapped in a {@link RetryingGitHubClient} is used.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public DcoCheckBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom DcoClient implementation. Useful for testing with mocks.
	 *
	 * <p>
	 * When a custom client is provided, the GitHub App credentials are not required.
	 * @param dcoClient custom DcoClient implementation (null to use default)
	 * @return this builder
	 */
	public DcoCheckBuilder dcoClient(@Nullable DcoClient dcoClient) {
		this.dcoClient = dcoClient;
		return this;
	}

	/**
	 * Enable or disable the organization membership cache (enabled by default).
	 * @param cacheMemberships whether membership lookups are cached
	 * @return this builder
	 */
	public DcoCheckBuilder cacheMemberships(boolean cacheMemberships) {
		this.cacheMemberships = cacheMemberships;
		return this;
	}

	/**
	 * Build the DcoClient, decorated with the membership cache when enabled.
	 * @return configured DcoClient
	 * @throws IllegalStateException if GitHub App credentials are required but missing
	 */
	public DcoClient buildDcoClient() {
		DcoClient client = this.dcoClient != null ? this.dcoClient : createGitHubDcoClient();
		return cacheMemberships ? new CachingDcoClient(client) : client;
	}

	/**
	 * Build an EventProcessor.
	 * @return configured EventProcessor
	 * @throws IllegalStateException if GitHub App credentials are required but missing
	 */
	public EventProcessor buildEventProcessor() {
		return new EventProcessor(buildDcoClient());
	}

	private DcoClient createGitHubDcoClient() {
		if (appId == null || privateKey == null) {
			throw new IllegalStateException("GitHub App id and private key are required. Call appId() and "
					+ "privateKeyPem() first.");
		}
		ObjectMapper objectMapper = ObjectMapperFactory.create();
		GitHubClient client = this.httpClient != null ? this.httpClient
				: RetryingGitHubClient.builder().wrapping(new GitHubHttpClient(apiBaseUrl)).build();
		GitHubAppTokenProvider tokenProvider = new GitHubAppTokenProvider(appId, privateKey, client, objectMapper);
		return new GitHubDcoClient(client, tokenProvider, objectMapper, ObjectMapperFactory.createYaml());
	}

}
