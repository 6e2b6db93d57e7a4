package io.dcocheck.server;

import org.jspecify.annotations.Nullable;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Verifies the {@code X-Hub-Signature-256} header of webhook deliveries: the
 * {@code sha256=} prefixed hex HMAC-SHA256 of the raw request body, keyed with the
 * webhook secret.
 */
public class SignatureVerifier {

	private static final String ALGORITHM = "HmacSHA256";

	private static final String SIGNATURE_PREFIX = "sha256=";

	private final SecretKeySpec key;

	public SignatureVerifier(String webhookSecret) {
		this.key = new SecretKeySpec(webhookSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
	}

	/**
	 * Check the signature of a delivery.
	 * @param signatureHeader value of the signature header (null if absent)
	 * @param body raw request body
	 * @return true if the signature is present, well formed and valid
	 */
	public boolean verify(@Nullable String signatureHeader, byte[] body) {
		if (signatureHeader == null || !signatureHeader.startsWith(SIGNATURE_PREFIX)) {
			return false;
		}

		byte[] provided;
		try {
			provided = HexFormat.of().parseHex(signatureHeader.substring(SIGNATURE_PREFIX.length()));
		}
		catch (IllegalArgumentException e) {
			return false;
		}
		return MessageDigest.isEqual(sign(body), provided);
	}

	/**
	 * Compute the signature header value for the body provided.
	 */
	public String signatureFor(byte[] body) {
		return SIGNATURE_PREFIX + HexFormat.of().formatHex(sign(body));
	}

	private byte[] sign(byte[] body) {
		try {
			Mac mac = Mac.getInstance(ALGORITHM);
			mac.init(key);
			return mac.doFinal(body);
		}
		catch (GeneralSecurityException e) {
			throw new IllegalStateException("HMAC-SHA256 not available", e);
		}
	}

}
