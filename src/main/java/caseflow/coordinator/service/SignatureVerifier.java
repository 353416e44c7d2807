package caseflow.coordinator.service;

import caseflow.coordinator.error.AuthenticationException;
import caseflow.coordinator.util.Hmac;

/**
 * Verifies first-party webhook signatures: hex HMAC-SHA256 of the raw body,
 * optionally prefixed with {@code sha256=}.
 */
public class SignatureVerifier {

    private static final String PREFIX = "sha256=";

    private final String secret;

    public SignatureVerifier(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("webhook secret is required");
        }
        this.secret = secret;
    }

    public String sign(byte[] body) {
        return Hmac.hexSha256(secret, body);
    }

    public boolean isValid(byte[] body, String signature) {
        if (signature == null || signature.isBlank()) {
            return false;
        }
        String provided = signature.trim();
        if (provided.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            provided = provided.substring(PREFIX.length());
        }
        return Hmac.hexEquals(sign(body), provided);
    }

    /**
     * @throws AuthenticationException if the signature is missing or does not match
     */
    public void verify(byte[] body, String signature) {
        if (signature == null || signature.isBlank()) {
            throw new AuthenticationException("Missing webhook signature");
        }
        if (!isValid(body, signature)) {
            throw new AuthenticationException("Invalid webhook signature");
        }
    }
}
