package io.dcocheck.server;

import io.dcocheck.EventProcessor;
import io.dcocheck.ObjectMapperFactory;
import io.dcocheck.PullRequestEvent;
import io.dcocheck.WebhookEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for {@link WebhookController}.
 */
@DisplayName("WebhookController Tests")
@ExtendWith(MockitoExtension.class)
class WebhookControllerTest {

	static final String SECRET = "secret";

	static final String PULL_REQUEST_PAYLOAD = """
			{
			  "action": "opened",
			  "installation": { "id": 1234 },
			  "pull_request": {
			    "html_url": "https://github.com/owner/repo/pull/1",
			    "base": { "ref": "main", "sha": "base-sha" },
			    "head": { "ref": "feature", "sha": "head-sha" }
			  },
			  "repository": { "name": "repo", "owner": { "login": "owner" } }
			}
			""";

	private final SignatureVerifier signatureVerifier = new SignatureVerifier(SECRET);

	@Mock
	private EventProcessor eventProcessor;

	private MockMvc mvc;

	@BeforeEach
	void setUp() {
		WebhookController controller = new WebhookController(signatureVerifier,
				new WebhookEvents(ObjectMapperFactory.create()), eventProcessor);
		mvc = MockMvcBuilders.standaloneSetup(controller).build();
	}

	@Test
	@DisplayName("Should process signed deliveries")
	void shouldProcessEvent() throws Exception {
		byte[] body = PULL_REQUEST_PAYLOAD.getBytes(StandardCharsets.UTF_8);

		mvc.perform(delivery("pull_request", body, body)).andExpect(status().isOk());

		verify(eventProcessor).process(any(PullRequestEvent.class));
	}

	@Test
	@DisplayName("Should reject deliveries without signature")
	void shouldRejectMissingSignature() throws Exception {
		mvc.perform(post(WebhookController.WEBHOOK_PATH).contentType(MediaType.APPLICATION_JSON)
			.header(WebhookEvents.EVENT_NAME_HEADER, "pull_request")
			.content(PULL_REQUEST_PAYLOAD))
			.andExpect(status().isBadRequest())
			.andExpect(content().string("no valid signature found"));

		verifyNoInteractions(eventProcessor);
	}

	@Test
	@DisplayName("Should reject deliveries with an invalid signature")
	void shouldRejectInvalidSignature() throws Exception {
		byte[] body = PULL_REQUEST_PAYLOAD.getBytes(StandardCharsets.UTF_8);

		mvc.perform(delivery("pull_request", body, "other".getBytes(StandardCharsets.UTF_8)))
			.andExpect(status().isBadRequest())
			.andExpect(content().string(WebhookController.INVALID_SIGNATURE_MESSAGE));

		verifyNoInteractions(eventProcessor);
	}

	@Test
	@DisplayName("Should reject deliveries without event header")
	void shouldRejectMissingEventHeader() throws Exception {
		byte[] body = PULL_REQUEST_PAYLOAD.getBytes(StandardCharsets.UTF_8);

		mvc.perform(post(WebhookController.WEBHOOK_PATH).contentType(MediaType.APPLICATION_JSON)
			.header(WebhookEvents.SIGNATURE_HEADER, signatureVerifier.signatureFor(body))
			.content(body))
			.andExpect(status().isBadRequest())
			.andExpect(content().string("event header missing"));

		verifyNoInteractions(eventProcessor);
	}

	@Test
	@DisplayName("Should reject invalid payloads")
	void shouldRejectInvalidPayload() throws Exception {
		byte[] body = "{not json".getBytes(StandardCharsets.UTF_8);

		mvc.perform(delivery("pull_request", body, body))
			.andExpect(status().isBadRequest())
			.andExpect(content().string("invalid payload"));

		verifyNoInteractions(eventProcessor);
	}

	@Test
	@DisplayName("Should acknowledge unsupported events without processing them")
	void shouldIgnoreUnsupportedEvent() throws Exception {
		byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

		mvc.perform(delivery("push", body, body)).andExpect(status().isOk()).andExpect(content().string(""));

		verifyNoInteractions(eventProcessor);
	}

	@Test
	@DisplayName("Should report processing errors")
	void shouldReportProcessingError() throws Exception {
		byte[] body = PULL_REQUEST_PAYLOAD.getBytes(StandardCharsets.UTF_8);
		doThrow(new IllegalStateException("boom")).when(eventProcessor).process(any());

		mvc.perform(delivery("pull_request", body, body)).andExpect(status().isInternalServerError());
	}

	@Test
	@DisplayName("Should only accept POST on the webhook endpoint")
	void shouldRejectOtherMethods() throws Exception {
		mvc.perform(get(WebhookController.WEBHOOK_PATH)).andExpect(status().isMethodNotAllowed());

		verifyNoInteractions(eventProcessor);
	}

	@Test
	@DisplayName("Should answer health checks")
	void shouldAnswerHealthCheck() throws Exception {
		mvc.perform(get(WebhookController.HEALTH_CHECK_PATH)).andExpect(status().isOk());
	}

	static MockHttpServletRequestBuilder delivery(String eventName, byte[] body, byte[] signedBody) {
		return post(WebhookController.WEBHOOK_PATH).contentType(MediaType.APPLICATION_JSON)
			.header(WebhookEvents.EVENT_ID_HEADER, "delivery-1")
			.header(WebhookEvents.EVENT_NAME_HEADER, eventName)
			.header(WebhookEvents.SIGNATURE_HEADER, new SignatureVerifier(SECRET).signatureFor(signedBody))
			.content(body);
	}

}
