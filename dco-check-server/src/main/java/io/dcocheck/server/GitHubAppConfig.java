package io.dcocheck.server;

import org.jspecify.annotations.Nullable;

/**
 * GitHub App settings.
 */
public class GitHubAppConfig {

	/**
	 * GitHub API base URL, for GitHub Enterprise Server. Defaults to the public API.
	 */
	private @Nullable String apiHost;

	private @Nullable Long appId;

	/**
	 * PEM encoded private key of the app.
	 */
	private @Nullable String privateKey;

	/**
	 * Secret used to sign webhook deliveries.
	 */
	private @Nullable String webhookSecret;

	public @Nullable String getApiHost() {
		return apiHost;
	}

	public void setApiHost(@Nullable String apiHost) {
		this.apiHost = apiHost;
	}

	public @Nullable Long getAppId() {
		return appId;
	}

	public void setAppId(@Nullable Long appId) {
		this.appId = appId;
	}

	public @Nullable String getPrivateKey() {
		return privateKey;
	}

	public void setPrivateKey(@Nullable String privateKey) {
		this.privateKey = privateKey;
	}

	public @Nullable String getWebhookSecret() {
		return webhookSecret;
	}

	public void setWebhookSecret(@Nullable String webhookSecret) {
		this.webhookSecret = webhookSecret;
	}

	@Override
	public String toString() {
		return "GitHubAppConfig{apiHost=" + apiHost + ", appId=" + appId + ", privateKey=" + mask(privateKey)
				+ ", webhookSecret=" + mask(webhookSecret) + "}";
	}

	private static String mask(@Nullable String secret) {
		return secret == null ? "null" : "****";
	}

}
