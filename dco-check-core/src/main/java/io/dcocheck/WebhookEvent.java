package io.dcocheck;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Webhook event delivered by GitHub.
 *
 * <p>
 * Payload records only map the fields needed to process the event; any other field in the
 * payload is ignored.
 */
public interface WebhookEvent {

	Installation installation();

	Repository repository();

	/**
	 * Get the context for the GitHub API requests related to this event.
	 */
	default RequestContext context() {
		return new RequestContext(installation().id(), repository().owner().login(), repository().name());
	}

	/**
	 * GitHub App installation.
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	record Installation(@JsonProperty(required = true) long id) {
	}

	/**
	 * Organization the repository belongs to.
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	record Organization(@JsonProperty(required = true) String login) {
	}

	/**
	 * Repository the event happened in.
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	record Repository(@JsonProperty(required = true) String name, @JsonProperty(required = true) Owner owner) {
	}

	/**
	 * Repository owner (user or organization).
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	record Owner(@JsonProperty(required = true) String login) {
	}

}
