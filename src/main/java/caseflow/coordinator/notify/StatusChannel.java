package caseflow.coordinator.notify;

/**
 * Where status changes are pushed after they have been stored.
 * Implementations must not throw for delivery problems.
 */
public interface StatusChannel {

    void send(StatusEvent event);

    String name();
}
