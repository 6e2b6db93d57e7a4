package io.dcocheck.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Map;

/**
 * DCO check server.
 *
 * <p>
 * Spring Boot web application receiving GitHub webhook deliveries on
 * {@code /webhook/github} and exposing {@code /health-check}. The {@link ServerConfig} is
 * loaded before the application starts and provides the listen address, the request
 * thread count and the GitHub App settings.
 *
 * <p>
 * Usage: {@code java -jar dco-check-server.jar [--config-file FILE]}
 */
@SpringBootApplication
public class DcoCheckServer {

	private static final Logger logger = LoggerFactory.getLogger(DcoCheckServer.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Server failed: {}", e.getMessage(), e);
			System.exit(1);
		}
	}

	static int run(String[] args) {
		ServerArgumentParser argumentParser = new ServerArgumentParser();
		ServerArgumentParser.Arguments arguments;
		try {
			arguments = argumentParser.parse(args);
		}
		catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.err.println(argumentParser.generateHelpText());
			return 2;
		}
		if (arguments.helpRequested()) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ServerConfig config = new ServerConfigLoader().load(arguments.configFile());
		createApplication(config).run();
		logger.info("Server started, listening on {}", config.getServerAddr());
		return 0;
	}

	/**
	 * Create the Spring application serving the configuration provided. The configuration
	 * is registered as a bean, and its address and thread count become the embedded web
	 * server settings.
	 * @param config server configuration
	 * @return application ready to run
	 */
	static SpringApplication createApplication(ServerConfig config) {
		SpringApplication application = new SpringApplication(DcoCheckServer.class);
		application.setDefaultProperties(serverProperties(config));
		ApplicationContextInitializer<ConfigurableApplicationContext> registerConfig = context -> context
			.getBeanFactory()
			.registerSingleton("serverConfig", config);
		application.addInitializers(registerConfig);
		return application;
	}

	static Map<String, Object> serverProperties(ServerConfig config) {
		HostAndPort address = HostAndPort.parse(config.getServerAddr());
		return Map.of("server.address", address.host(), "server.port", address.port(), "server.tomcat.threads.max",
				config.getWorkerThreads(), "server.shutdown", "graceful", "spring.main.banner-mode", "off");
	}

}
