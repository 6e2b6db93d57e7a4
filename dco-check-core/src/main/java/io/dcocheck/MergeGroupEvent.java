package io.dcocheck;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code merge_group} webhook event, delivered when a pull request is added to a merge
 * queue.
 *
 * @param action action that triggered the event
 * @param installation GitHub App installation
 * @param mergeGroup merge group details
 * @param repository repository details
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MergeGroupEvent(@JsonProperty(required = true) Action action,
		@JsonProperty(required = true) Installation installation,
		@JsonProperty(required = true) MergeGroup mergeGroup,
		@JsonProperty(required = true) Repository repository) implements WebhookEvent {

	public enum Action {

		@JsonProperty("checks_requested")
		CHECKS_REQUESTED,

		@JsonEnumDefaultValue
		OTHER

	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record MergeGroup(@JsonProperty(required = true) HeadCommit headCommit) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record HeadCommit(@JsonProperty(required = true) String id) {
	}

}
