package caseflow.coordinator.notify;

import java.util.Optional;

/**
 * Checks a bearer credential and resolves the user it was issued to.
 */
public interface TokenVerifier {

    Optional<String> verify(String token);
}
