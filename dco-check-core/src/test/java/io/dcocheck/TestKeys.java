package io.dcocheck;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Arrays;
import java.util.Base64;

/**
 * RSA key pair shared by the tests needing GitHub App credentials.
 */
final class TestKeys {

	static final KeyPair KEY_PAIR = generate();

	// SEQUENCE header (4) + version (3) + AlgorithmIdentifier (15) + OCTET STRING header (4)
	private static final int PKCS8_PREFIX_LENGTH = 26;

	private TestKeys() {
	}

	static String pkcs8Pem() {
		return pem("PRIVATE KEY", KEY_PAIR.getPrivate().getEncoded());
	}

	static String pkcs1Pem() {
		return pem("RSA PRIVATE KEY", pkcs1());
	}

	static byte[] pkcs1() {
		byte[] pkcs8 = KEY_PAIR.getPrivate().getEncoded();
		return Arrays.copyOfRange(pkcs8, PKCS8_PREFIX_LENGTH, pkcs8.length);
	}

	private static String pem(String type, byte[] der) {
		String body = Base64.getMimeEncoder(64, new byte[] { '\n' }).encodeToString(der);
		return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
	}

	private static KeyPair generate() {
		try {
			KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
			generator.initialize(2048);
			return generator.generateKeyPair();
		}
		catch (GeneralSecurityException e) {
			throw new IllegalStateException(e);
		}
	}

}
