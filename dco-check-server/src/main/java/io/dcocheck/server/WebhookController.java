package io.dcocheck.server;

import io.dcocheck.EventProcessor;
import io.dcocheck.WebhookEvent;
import io.dcocheck.WebhookEvents;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives GitHub webhook deliveries.
 *
 * <p>
 * Responses:
 * <ul>
 * <li>400 when the signature is missing or invalid, the event header is missing or the
 * payload cannot be parsed</li>
 * <li>200 for unsupported events, which are ignored</li>
 * <li>500 when processing the event fails</li>
 * <li>200 when the event was processed</li>
 * </ul>
 */
@RestController
public class WebhookController {

	private static final Logger logger = LoggerFactory.getLogger(WebhookController.class);

	static final String WEBHOOK_PATH = "/webhook/github";

	static final String HEALTH_CHECK_PATH = "/health-check";

	static final String INVALID_SIGNATURE_MESSAGE = "no valid signature found";

	private static final String DELIVERY_MDC_KEY = "delivery";

	private final SignatureVerifier signatureVerifier;

	private final WebhookEvents webhookEvents;

	private final EventProcessor eventProcessor;

	public WebhookController(SignatureVerifier signatureVerifier, WebhookEvents webhookEvents,
			EventProcessor eventProcessor) {
		this.signatureVerifier = signatureVerifier;
		this.webhookEvents = webhookEvents;
		this.eventProcessor = eventProcessor;
	}

	@GetMapping(HEALTH_CHECK_PATH)
	public ResponseEntity<Void> healthCheck() {
		return ResponseEntity.ok().build();
	}

	/**
	 * Verify, parse and process a delivery.
	 * @param deliveryId value of the {@value WebhookEvents#EVENT_ID_HEADER} header
	 * @param eventName value of the {@value WebhookEvents#EVENT_NAME_HEADER} header
	 * @param signature value of the {@value WebhookEvents#SIGNATURE_HEADER} header
	 * @param body raw request body
	 * @return response to send back to GitHub
	 */
	@PostMapping(WEBHOOK_PATH)
	public ResponseEntity<String> handleDelivery(
			@RequestHeader(value = WebhookEvents.EVENT_ID_HEADER, required = false) @Nullable String deliveryId,
			@RequestHeader(value = WebhookEvents.EVENT_NAME_HEADER, required = false) @Nullable String eventName,
			@RequestHeader(value = WebhookEvents.SIGNATURE_HEADER, required = false) @Nullable String signature,
			@RequestBody(required = false) byte @Nullable [] body) {
		byte[] payload = body != null ? body : new byte[0];
		if (deliveryId != null) {
			MDC.put(DELIVERY_MDC_KEY, deliveryId);
		}
		try {
			if (!signatureVerifier.verify(signature, payload)) {
				logger.warn("Rejected delivery: {}", INVALID_SIGNATURE_MESSAGE);
				return ResponseEntity.badRequest().body(INVALID_SIGNATURE_MESSAGE);
			}

			WebhookEvent event;
			try {
				event = webhookEvents.parse(eventName, payload);
			}
			catch (WebhookEvents.EventException e) {
				if (e.getKind() == WebhookEvents.EventException.Kind.UNSUPPORTED_EVENT) {
					logger.debug("Ignoring unsupported event {}", eventName);
					return ResponseEntity.ok().build();
				}
				logger.warn("Rejected delivery: {}", e.getMessage());
				return ResponseEntity.badRequest().body(e.getMessage());
			}

			try {
				eventProcessor.process(event);
			}
			catch (RuntimeException e) {
				logger.error("Error processing event", e);
				return ResponseEntity.internalServerError().build();
			}
			logger.info("Event processed successfully");
			return ResponseEntity.ok().build();
		}
		finally {
			MDC.remove(DELIVERY_MDC_KEY);
		}
	}

}
