package io.dcocheck;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.PrivateKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Provides the credentials a GitHub App uses to call the API.
 *
 * <p>
 * The app authenticates as itself with a short-lived RS256 JWT, which is exchanged for an
 * installation access token before calling repository endpoints. Installation tokens are
 * valid for one hour; they are cached per installation and renewed ahead of expiry.
 */
public class GitHubAppTokenProvider {

	private static final Logger logger = LoggerFactory.getLogger(GitHubAppTokenProvider.class);

	// GitHub rejects JWTs whose lifetime exceeds 10 minutes
	private static final Duration JWT_LIFETIME = Duration.ofMinutes(10);

	// Allowance for clock drift between this host and GitHub
	private static final Duration JWT_CLOCK_SKEW = Duration.ofSeconds(60);

	private static final Duration TOKEN_CACHE_TTL = Duration.ofMinutes(50);

	private final long appId;

	private final PrivateKey privateKey;

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final Cache<Long, String> installationTokens;

	public GitHubAppTokenProvider(long appId, PrivateKey privateKey, GitHubClient httpClient,
			ObjectMapper objectMapper) {
		this.appId = appId;
		this.privateKey = privateKey;
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.installationTokens = Caffeine.newBuilder().expireAfterWrite(TOKEN_CACHE_TTL).maximumSize(10_000).build();
	}

	/**
	 * Create a JWT identifying the app.
	 * @return signed JWT
	 */
	public String createAppJwt() {
		Instant now = Instant.now();
		return Jwts.builder()
			.issuer(String.valueOf(appId))
			.issuedAt(Date.from(now.minus(JWT_CLOCK_SKEW)))
			.expiration(Date.from(now.plus(JWT_LIFETIME).minus(JWT_CLOCK_SKEW)))
			.signWith(privateKey, Jwts.SIG.RS256)
			.compact();
	}

	/**
	 * Get the Authorization header value for requests made on behalf of an installation.
	 * @param installationId GitHub App installation id
	 * @return Authorization header value
	 */
	public String installationAuthorization(long installationId) {
		return "Bearer " + installationTokens.get(installationId, this::requestInstallationToken);
	}

	private String requestInstallationToken(long installationId) {
		logger.debug("Requesting access token for installation {}", installationId);
		String response = httpClient.post("/app/installations/" + installationId + "/access_tokens", "{}",
				"Bearer " + createAppJwt());
		try {
			JsonNode node = objectMapper.readTree(response);
			String token = node.path("token").asText("");
			if (token.isEmpty()) {
				throw new IllegalStateException("no token found in installation access token response");
			}
			return token;
		}
		catch (IOException e) {
			throw new UncheckedIOException("error parsing installation access token response", e);
		}
	}

}
