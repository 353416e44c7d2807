package caseflow.coordinator.testsupport;

import caseflow.coordinator.model.ProcessingStatus;
import caseflow.coordinator.notify.StatusChannel;
import caseflow.coordinator.notify.StatusEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Status channel that keeps every event it is handed.
 */
public final class RecordingStatusChannel implements StatusChannel {

    private final List<StatusEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean broken;

    public RecordingStatusChannel breakDelivery() {
        this.broken = true;
        return this;
    }

    @Override
    public void send(StatusEvent event) {
        events.add(event);
        if (broken) {
            throw new IllegalStateException("connection reset");
        }
    }

    @Override
    public String name() {
        return "recording";
    }

    public List<StatusEvent> events() {
        return List.copyOf(events);
    }

    public List<ProcessingStatus> statuses(String caseId) {
        return events.stream()
                .filter(e -> e.caseId().equals(caseId))
                .map(StatusEvent::status)
                .toList();
    }
}
