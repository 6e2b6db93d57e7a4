package io.dcocheck;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates the syntax of the author and committer emails of a commit.
 *
 * <p>
 * Addresses are checked with the Jakarta Bean Validation {@link Email} constraint
 * (Hibernate Validator), which accepts dot-atom and quoted local parts of up to 64
 * characters, internationalized atoms and IP address literals. Blank addresses and
 * addresses longer than 254 characters are rejected as well.
 */
public class EmailValidator {

	private static final Validator VALIDATOR = createValidator();

	private static Validator createValidator() {
		// Messages are never rendered, so no expression language is needed to interpolate them
		ValidatorFactory factory = Validation.byDefaultProvider()
			.configure()
			.messageInterpolator(new ParameterMessageInterpolator())
			.buildValidatorFactory();
		return factory.getValidator();
	}

	/**
	 * Validate the emails of the commit provided.
	 * @param commit commit to validate
	 * @return errors found, committer error first (empty if both emails are valid)
	 */
	public List<CommitError> validate(Commit commit) {
		List<CommitError> errors = new ArrayList<>();

		String committerEmail = commit.committer() != null ? commit.committer().email() : null;
		if (committerEmail != null && !isValid(committerEmail)) {
			errors.add(CommitError.INVALID_COMMITTER_EMAIL);
		}

		// Same address as the committer's was already reported above
		if (commit.author() != null) {
			String authorEmail = commit.author().email();
			if (!authorEmail.equals(committerEmail) && !isValid(authorEmail)) {
				errors.add(CommitError.INVALID_AUTHOR_EMAIL);
			}
		}

		return errors;
	}

	/**
	 * Returns true if the address provided is syntactically valid.
	 */
	public boolean isValid(String email) {
		return VALIDATOR.validateValue(Address.class, "value", email).isEmpty();
	}

	/**
	 * Carrier of the constraints applied to a single address.
	 */
	static final class Address {

		@NotBlank
		@Size(max = 254)
		@Email
		@Nullable
		String value;

		private Address() {
		}

	}

}
