package io.dcocheck;

/**
 * Action button displayed in the GitHub UI next to a check run.
 *
 * @param label button text (at most 20 characters)
 * @param description button tooltip (at most 40 characters)
 * @param identifier value sent back in the {@code requested_action} event (at most 20
 * characters)
 */
public record CheckRunAction(String label, String description, String identifier) {
}
