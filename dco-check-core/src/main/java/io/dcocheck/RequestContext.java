package io.dcocheck;

/**
 * Target of the GitHub API requests made while processing an event.
 *
 * @param installationId GitHub App installation the event was delivered for
 * @param owner repository owner login
 * @param repo repository name
 */
public record RequestContext(long installationId, String owner, String repo) {
}
