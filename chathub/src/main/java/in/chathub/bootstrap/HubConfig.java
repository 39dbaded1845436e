package in.chathub.bootstrap;

import in.chathub.hub.SubscriberRegistry;
import in.chathub.util.Env;

import java.time.Duration;

/**
 * Settings for one hub process, read from the environment at startup.
 */
public record HubConfig(
    int port,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,
    String authPublicKeyPem,
    String authPublicKeyFile,
    int channelCapacity,
    boolean createOnDelivery,
    Duration keepAliveInterval,
    int listenerPollMs,
    Duration backoffInitial,
    Duration backoffMax
) {
    public static HubConfig fromEnv() {
        return new HubConfig(
            Env.getInt("PORT", 6687),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/chat"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 2),
            Env.get("AUTH_PK", null),
            Env.get("AUTH_PK_FILE", null),
            Env.getInt("HUB_CHANNEL_CAPACITY", SubscriberRegistry.DEFAULT_CAPACITY),
            Env.getBool("HUB_CREATE_ON_DELIVERY", false),
            Duration.ofMillis(Env.getLong("SSE_KEEPALIVE_MS", 1000)),
            Env.getInt("LISTENER_POLL_MS", 500),
            Duration.ofMillis(Env.getLong("LISTENER_BACKOFF_INITIAL_MS", 1000)),
            Duration.ofMillis(Env.getLong("LISTENER_BACKOFF_MAX_MS", 30000))
        );
    }
}
