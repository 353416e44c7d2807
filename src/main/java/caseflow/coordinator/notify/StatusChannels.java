package caseflow.coordinator.notify;

import caseflow.coordinator.config.CoordinatorConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the status channel at startup.
 */
public final class StatusChannels {

    private static final Logger log = LoggerFactory.getLogger(StatusChannels.class);

    private StatusChannels() {
    }

    /**
     * Live delivery needs the WebSocket transport and a token secret to
     * authenticate it. The transport is not offered in production.
     */
    public static boolean liveSupported(CoordinatorConfig config) {
        return config.liveChannelEnabled() && !config.isProduction() && config.tokenSecret() != null;
    }

    public static StatusChannel select(CoordinatorConfig config, SubscriptionRegistry registry, ObjectMapper mapper) {
        StatusChannel channel = liveSupported(config)
                ? new LiveStatusChannel(registry, mapper)
                : new DurableOnlyStatusChannel();
        log.info("Status channel: {}", channel.name());
        return channel;
    }
}
