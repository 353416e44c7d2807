package caseflow.coordinator.notify;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open live connections, indexed by the user who opened them and by the
 * cases they subscribed to.
 */
public class SubscriptionRegistry {

    public static final AttributeKey<String> USER_ID = AttributeKey.valueOf("caseflow.userId");

    private final Map<String, Set<Channel>> byCase = new ConcurrentHashMap<>();
    private final Map<String, Set<Channel>> byUser = new ConcurrentHashMap<>();

    public void register(Channel channel, String userId) {
        channel.attr(USER_ID).set(userId);
        byUser.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(channel);
    }

    public void subscribe(Channel channel, String caseId) {
        byCase.computeIfAbsent(caseId, k -> ConcurrentHashMap.newKeySet()).add(channel);
    }

    public boolean unsubscribe(Channel channel, String caseId) {
        Set<Channel> channels = byCase.get(caseId);
        if (channels == null) {
            return false;
        }
        boolean removed = channels.remove(channel);
        if (channels.isEmpty()) {
            byCase.remove(caseId, channels);
        }
        return removed;
    }

    /**
     * Forget a closed connection everywhere.
     */
    public void remove(Channel channel) {
        byCase.values().forEach(channels -> channels.remove(channel));
        byCase.values().removeIf(Set::isEmpty);
        String userId = channel.attr(USER_ID).get();
        if (userId != null) {
            Set<Channel> channels = byUser.get(userId);
            if (channels != null) {
                channels.remove(channel);
                if (channels.isEmpty()) {
                    byUser.remove(userId, channels);
                }
            }
        }
    }

    /**
     * Connections interested in a case: its subscribers plus the owner's connections.
     */
    public Set<Channel> recipients(String caseId, String userId) {
        Set<Channel> recipients = new HashSet<>(byCase.getOrDefault(caseId, Set.of()));
        if (userId != null) {
            recipients.addAll(byUser.getOrDefault(userId, Set.of()));
        }
        return recipients;
    }

    public int subscriberCount(String caseId) {
        return byCase.getOrDefault(caseId, Set.of()).size();
    }

    public int connectionCount() {
        return byUser.values().stream().mapToInt(Set::size).sum();
    }
}
