package in.chathub.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects unusable settings before anything is started.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException listing every invalid setting
     */
    public static void validate(HubConfig config) {
        List<String> problems = new ArrayList<>();

        if (config.port() <= 0 || config.port() > 65535) {
            problems.add("PORT must be in 1..65535, got " + config.port());
        }
        if (config.dbUrl() == null || !config.dbUrl().startsWith("jdbc:postgresql:")) {
            problems.add("DB_URL must be a jdbc:postgresql: URL");
        }
        if (config.dbPoolSize() < 1) {
            problems.add("DB_POOL_SIZE must be at least 1 (the listener holds one connection)");
        }
        if (isBlank(config.authPublicKeyPem()) && isBlank(config.authPublicKeyFile())) {
            problems.add("AUTH_PK or AUTH_PK_FILE must supply the chat server's Ed25519 public key");
        }
        if (config.channelCapacity() <= 0) {
            problems.add("HUB_CHANNEL_CAPACITY must be positive");
        }
        if (config.keepAliveInterval().isNegative() || config.keepAliveInterval().isZero()) {
            problems.add("SSE_KEEPALIVE_MS must be positive");
        }
        if (config.listenerPollMs() <= 0) {
            problems.add("LISTENER_POLL_MS must be positive");
        }
        if (config.backoffInitial().isNegative() || config.backoffInitial().isZero()) {
            problems.add("LISTENER_BACKOFF_INITIAL_MS must be positive");
        }
        if (config.backoffInitial().compareTo(config.backoffMax()) > 0) {
            problems.add("LISTENER_BACKOFF_INITIAL_MS cannot exceed LISTENER_BACKOFF_MAX_MS");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid configuration:\n  - " + String.join("\n  - ", problems));
        }
        log.info("Startup config validation passed");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private StartupConfigValidator() {}
}
