package io.dcocheck;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.io.IOException;

/**
 * Parses GitHub webhook deliveries into {@link WebhookEvent} instances.
 */
public class WebhookEvents {

	/**
	 * Header carrying the unique identifier of the delivery.
	 */
	public static final String EVENT_ID_HEADER = "X-GitHub-Delivery";

	/**
	 * Header carrying the name of the event delivered.
	 */
	public static final String EVENT_NAME_HEADER = "X-GitHub-Event";

	/**
	 * Header carrying the HMAC signature of the payload.
	 */
	public static final String SIGNATURE_HEADER = "X-Hub-Signature-256";

	private final ObjectMapper objectMapper;

	public WebhookEvents(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Parse the event delivered.
	 * @param eventName value of the {@value #EVENT_NAME_HEADER} header (null if missing)
	 * @param body raw payload
	 * @return parsed event
	 * @throws EventException if the header is missing, the event is not supported or the
	 * payload cannot be parsed
	 */
	public WebhookEvent parse(@Nullable String eventName, byte[] body) {
		if (eventName == null) {
			throw new EventException(EventException.Kind.MISSING_HEADER);
		}

		Class<? extends WebhookEvent> type;
		switch (eventName) {
			case "check_run":
				type = CheckRunEvent.class;
				break;
			case "merge_group":
				type = MergeGroupEvent.class;
				break;
			case "pull_request":
				type = PullRequestEvent.class;
				break;
			default:
				throw new EventException(EventException.Kind.UNSUPPORTED_EVENT);
		}

		try {
			return objectMapper.readValue(body, type);
		}
		catch (IOException e) {
			throw new EventException(EventException.Kind.INVALID_PAYLOAD, e);
		}
	}

	/**
	 * Exception thrown when a webhook delivery cannot be turned into an event.
	 */
	public static class EventException extends RuntimeException {

		/**
		 * Reasons a delivery can be rejected.
		 */
		public enum Kind {

			INVALID_PAYLOAD("invalid payload"),

			MISSING_HEADER("event header missing"),

			UNSUPPORTED_EVENT("unsupported event");

			private final String message;

			Kind(String message) {
				this.message = message;
			}

		}

		private final Kind kind;

		public EventException(Kind kind) {
			super(kind.message);
			this.kind = kind;
		}

		public EventException(Kind kind, Throwable cause) {
			super(kind.message, cause);
			this.kind = kind;
		}

		public Kind getKind() {
			return kind;
		}

	}

}
