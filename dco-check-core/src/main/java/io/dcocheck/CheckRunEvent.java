package io.dcocheck;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * {@code check_run} webhook event.
 *
 * @param action action that triggered the event
 * @param checkRun check run the event refers to
 * @param installation GitHub App installation
 * @param repository repository details
 * @param requestedAction action requested by a user (only for {@code requested_action})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckRunEvent(@JsonProperty(required = true) Action action,
		@JsonProperty(required = true) CheckRunDetails checkRun,
		@JsonProperty(required = true) Installation installation,
		@JsonProperty(required = true) Repository repository,
		@Nullable RequestedAction requestedAction) implements WebhookEvent {

	/**
	 * Check run event actions. Actions not listed are mapped to {@link #OTHER}.
	 */
	public enum Action {

		@JsonProperty("requested_action")
		REQUESTED_ACTION,

		@JsonProperty("rerequested")
		REREQUESTED,

		@JsonEnumDefaultValue
		OTHER

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record CheckRunDetails(@JsonProperty(required = true) String headSha) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record RequestedAction(@JsonProperty(required = true) String identifier) {
	}

}
