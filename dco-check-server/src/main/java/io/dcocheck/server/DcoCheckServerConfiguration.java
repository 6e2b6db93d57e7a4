package io.dcocheck.server;

import io.dcocheck.DcoCheckBuilder;
import io.dcocheck.EventProcessor;
import io.dcocheck.ObjectMapperFactory;
import io.dcocheck.WebhookEvents;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Objects;

/**
 * Spring configuration wiring the DCO check services from the {@link ServerConfig}.
 */
@Configuration
public class DcoCheckServerConfiguration {

	@Bean
	public EventProcessor eventProcessor(ServerConfig config) {
		GitHubAppConfig app = config.getGithubApp();
		return DcoCheckBuilder.create()
			.appId(Objects.requireNonNull(app.getAppId(), "github_app.app_id"))
			.privateKeyPem(Objects.requireNonNull(app.getPrivateKey(), "github_app.private_key"))
			.apiHost(app.getApiHost())
			.buildEventProcessor();
	}

	@Bean
	public SignatureVerifier signatureVerifier(ServerConfig config) {
		return new SignatureVerifier(
				Objects.requireNonNull(config.getGithubApp().getWebhookSecret(), "github_app.webhook_secret"));
	}

	@Bean
	public WebhookEvents webhookEvents() {
		return new WebhookEvents(ObjectMapperFactory.create());
	}

}
