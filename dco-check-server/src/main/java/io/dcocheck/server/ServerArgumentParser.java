package io.dcocheck.server;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Command-line argument parser for the DCO check server.
 */
public class ServerArgumentParser {

	/**
	 * Parsed command-line arguments.
	 *
	 * @param configFile YAML configuration file (null if not provided)
	 * @param helpRequested whether the usage should be printed
	 */
	public record Arguments(@Nullable Path configFile, boolean helpRequested) {
	}

	/**
	 * Parse command-line arguments.
	 * @param args Command-line arguments
	 * @return Parsed arguments
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public Arguments parse(String[] args) {
		Path configFile = null;
		boolean helpRequested = false;

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-c", "--config-file":
					configFile = Path.of(getRequiredValue(args, i, "config-file"));
					i++;
					break;

				case "-h", "--help":
					helpRequested = true;
					break;

				default:
					if (arg.startsWith("--config-file=")) {
						configFile = Path.of(arg.substring("--config-file=".length()));
					}
					else {
						throw new IllegalArgumentException("Unknown argument: " + arg);
					}
					break;
			}
		}

		return new Arguments(configFile, helpRequested);
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: java -jar dco-check-server.jar [OPTIONS]\n");
		help.append("\n");
		help.append("Receive GitHub webhook deliveries and run the DCO check on pull requests.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    -c, --config-file FILE    YAML configuration file\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    Any setting can be provided with the ")
			.append(ServerConfigLoader.ENV_PREFIX)
			.append(" prefix, using __ to separate nested keys:\n");
		help.append("    DCO_CHECK_SERVER_ADDR                 Listen address (default: ")
			.append(ServerConfig.DEFAULT_SERVER_ADDR)
			.append(")\n");
		help.append("    DCO_CHECK_WORKER_THREADS              Delivery processing threads (default: ")
			.append(ServerConfig.DEFAULT_WORKER_THREADS)
			.append(")\n");
		help.append("    DCO_CHECK_GITHUB_APP__APP_ID          GitHub App id (required)\n");
		help.append("    DCO_CHECK_GITHUB_APP__PRIVATE_KEY     GitHub App PEM private key (required)\n");
		help.append("    DCO_CHECK_GITHUB_APP__WEBHOOK_SECRET  Webhook secret (required)\n");
		help.append("    DCO_CHECK_GITHUB_APP__API_HOST        GitHub API base URL (GitHub Enterprise Server)\n");
		return help.toString();
	}

	private static String getRequiredValue(String[] args, int index, String optionName) {
		if (index + 1 >= args.length || args[index + 1].startsWith("-")) {
			throw new IllegalArgumentException("Option --" + optionName + " requires a value");
		}
		return args[index + 1];
	}

}
