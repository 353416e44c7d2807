package caseflow.coordinator.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * No live transport: observers poll the status endpoint, which reads the stored status.
 */
public class DurableOnlyStatusChannel implements StatusChannel {

    private static final Logger log = LoggerFactory.getLogger(DurableOnlyStatusChannel.class);

    @Override
    public void send(StatusEvent event) {
        log.debug("Case {} is now {} (poll only)", event.caseId(), event.status().wireName());
    }

    @Override
    public String name() {
        return "durable";
    }
}
