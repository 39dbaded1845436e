package in.chathub.hub;

import in.chathub.domain.event.ChatEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory map of userId -> fan-out channel.
 *
 * Backed by a ConcurrentHashMap, so creation is atomic per key and lookups for
 * unrelated users never wait on each other. Entries live for the whole process.
 */
public final class SubscriberRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriberRegistry.class);

    public static final int DEFAULT_CAPACITY = 256;

    private final ConcurrentMap<Long, BroadcastChannel<ChatEvent>> channels = new ConcurrentHashMap<>();
    private final int capacity;

    public SubscriberRegistry() {
        this(DEFAULT_CAPACITY);
    }

    public SubscriberRegistry(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Existing channel for the user, or a new one created atomically.
     */
    public BroadcastChannel<ChatEvent> getOrCreate(long userId) {
        return channels.computeIfAbsent(userId, id -> {
            log.debug("[HUB] Creating channel for user {} (capacity={})", id, capacity);
            return new BroadcastChannel<>(capacity);
        });
    }

    /**
     * Lookup without creating.
     */
    public Optional<BroadcastChannel<ChatEvent>> tryGet(long userId) {
        return Optional.ofNullable(channels.get(userId));
    }

    /**
     * Number of users that have a channel.
     */
    public int userCount() {
        return channels.size();
    }

    /**
     * Receive handles currently open across all users.
     */
    public int receiverCount() {
        int total = 0;
        for (BroadcastChannel<ChatEvent> channel : channels.values()) {
            total += channel.receiverCount();
        }
        return total;
    }

    public int capacity() {
        return capacity;
    }
}
