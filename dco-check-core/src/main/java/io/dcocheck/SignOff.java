package io.dcocheck;

/**
 * A {@code Signed-off-by} trailer found in a commit message.
 *
 * @param name the name in the trailer, trimmed
 * @param email the email between angle brackets, trimmed
 */
public record SignOff(String name, String email) {
}
