package caseflow.coordinator.service;

import caseflow.coordinator.error.AuthenticationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SignatureVerifierTest {

    private static final byte[] BODY = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8);
    private static final String EXPECTED = "f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8";

    private final SignatureVerifier verifier = new SignatureVerifier("key");

    @Test
    void signsWithHmacSha256Hex() {
        assertEquals(EXPECTED, verifier.sign(BODY));
    }

    @Test
    void acceptsPrefixedAndUppercaseSignatures() {
        assertTrue(verifier.isValid(BODY, EXPECTED));
        assertTrue(verifier.isValid(BODY, "sha256=" + EXPECTED));
        assertTrue(verifier.isValid(BODY, EXPECTED.toUpperCase()));
    }

    @Test
    void rejectsTamperedBodyOrSignature() {
        byte[] tampered = "The quick brown fox jumps over the lazy cat".getBytes(StandardCharsets.UTF_8);
        assertFalse(verifier.isValid(tampered, EXPECTED));
        assertFalse(verifier.isValid(BODY, EXPECTED.substring(1)));
        assertFalse(new SignatureVerifier("other").isValid(BODY, EXPECTED));
    }

    @Test
    void verifyThrowsAuthenticationException() {
        AuthenticationException missing = assertThrows(AuthenticationException.class,
                () -> verifier.verify(BODY, null));
        assertEquals("Missing webhook signature", missing.getMessage());

        AuthenticationException invalid = assertThrows(AuthenticationException.class,
                () -> verifier.verify(BODY, "deadbeef"));
        assertEquals("Invalid webhook signature", invalid.getMessage());

        assertDoesNotThrow(() -> verifier.verify(BODY, EXPECTED));
    }

    @Test
    void secretIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new SignatureVerifier(""));
        assertThrows(IllegalArgumentException.class, () -> new SignatureVerifier(null));
    }
}
