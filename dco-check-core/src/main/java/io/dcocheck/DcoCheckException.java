package io.dcocheck;

/**
 * Thrown when processing a webhook event fails. The message names the step that failed;
 * the cause carries the underlying error.
 */
public class DcoCheckException extends RuntimeException {

	public DcoCheckException(String message, Throwable cause) {
		super(message, cause);
	}

}
