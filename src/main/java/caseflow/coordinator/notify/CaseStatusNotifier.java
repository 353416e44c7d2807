package caseflow.coordinator.notify;

import caseflow.coordinator.model.CaseRecord;
import caseflow.coordinator.model.ProcessingStatus;
import caseflow.coordinator.repository.CaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * The only writer of a case's processing status.
 *
 * <p>
 * Every change is checked against the status state machine, stored first and
 * then pushed through the configured {@link StatusChannel}. A storage failure
 * propagates; a delivery failure is only logged.
 */
public class CaseStatusNotifier {

    private static final Logger log = LoggerFactory.getLogger(CaseStatusNotifier.class);

    private final CaseRepository cases;
    private final StatusChannel channel;
    private final Clock clock;

    public CaseStatusNotifier(CaseRepository cases, StatusChannel channel, Clock clock) {
        this.cases = cases;
        this.channel = channel;
        this.clock = clock;
    }

    /**
     * Move a case to a new status.
     *
     * @throws IllegalArgumentException if the case does not exist
     * @throws IllegalStateException    if the transition is not allowed, or another
     *                                  writer moved the case first
     */
    public StatusEvent transition(String caseId, ProcessingStatus next, String error) {
        CaseRecord current = cases.findById(caseId)
                .orElseThrow(() -> new IllegalArgumentException("Case not found: " + caseId));
        ProcessingStatus from = current.processingStatus();
        if (!from.canTransitionTo(next)) {
            throw new IllegalStateException("Case " + caseId + " cannot go from "
                    + from.wireName() + " to " + next.wireName());
        }

        Instant now = clock.instant();
        if (!cases.updateStatus(caseId, from, next, error, now)) {
            if (cases.findById(caseId).isEmpty()) {
                throw new IllegalArgumentException("Case not found: " + caseId);
            }
            throw new IllegalStateException("Case " + caseId + " left " + from.wireName()
                    + " before it could move to " + next.wireName());
        }
        log.info("Case {} {} -> {}", caseId, from.wireName(), next.wireName());

        StatusEvent event = new StatusEvent(caseId, current.userId(), next,
                next == ProcessingStatus.FAILED ? error : null, now);
        publish(event);
        return event;
    }

    /**
     * Put a case back to pending ahead of a requested re-run.
     *
     * @return false if the case is currently processing and was left alone
     */
    public boolean resetForReprocess(String caseId) {
        CaseRecord current = cases.findById(caseId)
                .orElseThrow(() -> new IllegalArgumentException("Case not found: " + caseId));
        if (current.processingStatus() == ProcessingStatus.PROCESSING) {
            return false;
        }
        Instant now = clock.instant();
        if (!cases.resetToPending(caseId, now)) {
            // Picked up by a worker since the read
            return false;
        }
        publish(new StatusEvent(caseId, current.userId(), ProcessingStatus.PENDING, null, now));
        return true;
    }

    private void publish(StatusEvent event) {
        try {
            channel.send(event);
        } catch (RuntimeException e) {
            log.warn("Status delivery over {} failed for case {}: {}", channel.name(), event.caseId(),
                    e.getMessage());
        }
    }

    public StatusChannel channel() {
        return channel;
    }
}
