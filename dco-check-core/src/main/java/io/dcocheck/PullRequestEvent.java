package io.dcocheck;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * {@code pull_request} webhook event.
 *
 * @param action action that triggered the event
 * @param installation GitHub App installation
 * @param organization organization owning the repository (null for user repositories)
 * @param pullRequest pull request details
 * @param repository repository details
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestEvent(@JsonProperty(required = true) Action action,
		@JsonProperty(required = true) Installation installation, @Nullable Organization organization,
		@JsonProperty(required = true) PullRequest pullRequest,
		@JsonProperty(required = true) Repository repository) implements WebhookEvent {

	/**
	 * Pull request event actions. Actions not listed are mapped to {@link #OTHER}.
	 */
	public enum Action {

		@JsonProperty("opened")
		OPENED,

		@JsonProperty("synchronize")
		SYNCHRONIZE,

		@JsonEnumDefaultValue
		OTHER

	}

	/**
	 * Pull request details.
	 *
	 * @param base branch the changes are merged into
	 * @param head branch containing the changes
	 * @param htmlUrl web URL of the pull request
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record PullRequest(@JsonProperty(required = true) Branch base, @JsonProperty(required = true) Branch head,
			@Nullable String htmlUrl) {
	}

	/**
	 * Pull request branch.
	 *
	 * @param ref branch name
	 * @param sha SHA of the branch tip
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Branch(@JsonProperty(required = true) String ref, @JsonProperty(required = true) String sha) {
	}

}
