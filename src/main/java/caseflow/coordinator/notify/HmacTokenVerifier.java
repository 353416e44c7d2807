package caseflow.coordinator.notify;

import caseflow.coordinator.util.Hmac;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Bearer tokens of the form {@code userId.expiryEpochSeconds.signature}, where the
 * signature is the hex HMAC-SHA256 of {@code userId.expiryEpochSeconds}.
 */
public class HmacTokenVerifier implements TokenVerifier {

    private final String secret;
    private final Clock clock;

    public HmacTokenVerifier(String secret, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("token secret is required");
        }
        this.secret = secret;
        this.clock = clock;
    }

    public String issue(String userId, Duration ttl) {
        if (userId == null || userId.isBlank() || userId.contains(".")) {
            throw new IllegalArgumentException("userId must be non-empty and must not contain '.'");
        }
        long expiry = clock.instant().plus(ttl).getEpochSecond();
        String claims = userId + "." + expiry;
        return claims + "." + Hmac.hexSha256(secret, claims);
    }

    @Override
    public Optional<String> verify(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String[] parts = token.trim().split("\\.");
        if (parts.length != 3 || parts[0].isEmpty()) {
            return Optional.empty();
        }

        long expiry;
        try {
            expiry = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        String expected = Hmac.hexSha256(secret, parts[0] + "." + parts[1]);
        if (!Hmac.hexEquals(expected, parts[2])) {
            return Optional.empty();
        }
        if (clock.instant().getEpochSecond() >= expiry) {
            return Optional.empty();
        }
        return Optional.of(parts[0]);
    }
}
