package io.dcocheck.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dcocheck.EnvironmentSupport;
import io.dcocheck.ObjectMapperFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the {@link ServerConfig}.
 *
 * <p>
 * Sources, from lowest to highest precedence:
 * <ol>
 * <li>Defaults declared in {@link ServerConfig}</li>
 * <li>YAML configuration file, when provided</li>
 * <li>Environment variables prefixed with {@code DCO_CHECK_}, using {@code __} to
 * separate nested keys (e.g. {@code DCO_CHECK_GITHUB_APP__APP_ID})</li>
 * </ol>
 * Keys use snake case in both the file and the environment variables.
 */
public class ServerConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(ServerConfigLoader.class);

	public static final String ENV_PREFIX = "DCO_CHECK_";

	private static final String ENV_NESTING_SEPARATOR = "__";

	private final ObjectMapper mapper;

	public ServerConfigLoader() {
		this.mapper = ObjectMapperFactory.createYaml().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
	}

	/**
	 * Load the configuration from the file provided and the process environment.
	 * @param configFile YAML configuration file (null if none)
	 * @return validated configuration
	 * @throws IllegalStateException if the configuration is invalid or incomplete
	 */
	public ServerConfig load(@Nullable Path configFile) {
		return load(configFile, EnvironmentSupport.getAllWithPrefix(ENV_PREFIX));
	}

	ServerConfig load(@Nullable Path configFile, Map<String, String> environment) {
		ObjectNode tree = configFile != null ? readFile(configFile) : mapper.createObjectNode();
		environment.forEach((name, value) -> {
			if (name.startsWith(ENV_PREFIX)) {
				setPath(tree, name.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT), value);
			}
		});

		ServerConfig config;
		try {
			config = mapper.treeToValue(tree, ServerConfig.class);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("error setting up configuration: " + e.getOriginalMessage(), e);
		}
		validate(config);
		logger.debug("Loaded configuration: {}", config);
		return config;
	}

	private ObjectNode readFile(Path configFile) {
		try {
			JsonNode node = mapper.readTree(Files.readString(configFile));
			if (node == null || node.isMissingNode() || node.isNull()) {
				return mapper.createObjectNode();
			}
			if (!node.isObject()) {
				throw new IllegalStateException("configuration file " + configFile + " must contain a mapping");
			}
			return (ObjectNode) node;
		}
		catch (IOException e) {
			throw new UncheckedIOException("error reading configuration file " + configFile, e);
		}
	}

	private static void setPath(ObjectNode tree, String key, String value) {
		String[] parts = key.split(ENV_NESTING_SEPARATOR);
		ObjectNode node = tree;
		for (int i = 0; i < parts.length - 1; i++) {
			JsonNode child = node.get(parts[i]);
			if (child instanceof ObjectNode objectNode) {
				node = objectNode;
			}
			else {
				node = node.putObject(parts[i]);
			}
		}
		node.put(parts[parts.length - 1], value);
	}

	private static void validate(ServerConfig config) {
		GitHubAppConfig app = config.getGithubApp();
		if (app == null) {
			throw new IllegalStateException("missing configuration: github_app");
		}
		if (app.getAppId() == null) {
			throw new IllegalStateException("missing configuration: github_app.app_id");
		}
		if (isBlank(app.getPrivateKey())) {
			throw new IllegalStateException("missing configuration: github_app.private_key");
		}
		if (isBlank(app.getWebhookSecret())) {
			throw new IllegalStateException("missing configuration: github_app.webhook_secret");
		}
		if (config.getWorkerThreads() <= 0) {
			throw new IllegalStateException("worker_threads must be positive: " + config.getWorkerThreads());
		}
		HostAndPort.parse(config.getServerAddr());
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

}
