package io.dcocheck;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Result of checking a single commit.
 *
 * @param commit the commit checked
 * @param errors errors found, in the order they were detected
 * @param successReason why the commit passed (null if it did not pass)
 */
public record CommitCheckOutput(Commit commit, List<CommitError> errors,
		@Nullable CommitSuccessReason successReason) {

	public CommitCheckOutput {
		errors = List.copyOf(errors);
		if (!errors.isEmpty() && successReason != null) {
			throw new IllegalArgumentException(
					"Commit " + commit.sha() + " cannot have errors and a success reason at the same time");
		}
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}

}
