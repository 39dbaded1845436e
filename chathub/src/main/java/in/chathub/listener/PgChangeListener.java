package in.chathub.listener;

import in.chathub.domain.event.ChatEvent;
import in.chathub.hub.BroadcastChannel;
import in.chathub.hub.SubscriberRegistry;
import in.chathub.metrics.HubMetrics;
import in.chathub.notify.ChangeChannel;
import in.chathub.notify.ChatNotification;
import in.chathub.notify.NotificationCodec;
import in.chathub.notify.NotificationDecodeException;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Long-lived LISTEN loop on the chat change channels.
 *
 * Holds one connection from the pool, polls it for notifications, decodes each one
 * and pushes the shared event into the fan-out channel of every affected user.
 * Sends never block: a slow user loses its oldest buffered events instead.
 *
 * Connection loss moves the listener to FAILED and it reconnects with backoff.
 * Notifications raised while disconnected are lost.
 */
public final class PgChangeListener {
    private static final Logger log = LoggerFactory.getLogger(PgChangeListener.class);

    private final DataSource dataSource;
    private final NotificationCodec codec;
    private final SubscriberRegistry registry;
    private final HubMetrics metrics;
    private final ReconnectionPolicy reconnectPolicy;
    private final int pollMs;
    private final boolean createOnDelivery;

    // One executor per start(); stop() shuts it down.
    private ExecutorService executor;

    private volatile ListenerState state = ListenerState.STOPPED;
    private volatile boolean running = false;

    /**
     * @param createOnDelivery when true, delivery creates channels for users that never connected;
     *                         when false, events for such users are skipped
     */
    public PgChangeListener(DataSource dataSource, NotificationCodec codec, SubscriberRegistry registry,
                            HubMetrics metrics, ReconnectionPolicy reconnectPolicy,
                            int pollMs, boolean createOnDelivery) {
        this.dataSource = dataSource;
        this.codec = codec;
        this.registry = registry;
        this.metrics = metrics;
        this.reconnectPolicy = reconnectPolicy;
        this.pollMs = pollMs;
        this.createOnDelivery = createOnDelivery;
    }

    public synchronized void start() {
        if (running) {
            log.warn("[LISTENER] Already running");
            return;
        }
        if (executor != null) {
            // left over from a run that ended on its own
            executor.shutdown();
        }
        running = true;
        state = ListenerState.CONNECTING;
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pg-change-listener");
            t.setDaemon(true);
            return t;
        });
        executor.submit(this::run);
        log.info("[LISTENER] Started (poll={}ms, createOnDelivery={})", pollMs, createOnDelivery);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("[LISTENER] Stopping");
        running = false;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[LISTENER] Listener thread did not exit within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        state = ListenerState.STOPPED;
    }

    public ListenerState getState() {
        return state;
    }

    private void run() {
        try {
            while (running) {
                state = ListenerState.CONNECTING;
                try (Connection conn = dataSource.getConnection()) {
                    PGConnection pg = conn.unwrap(PGConnection.class);
                    subscribe(conn);
                    reconnectPolicy.recordSuccess();
                    state = ListenerState.LISTENING;
                    log.info("[LISTENER] Listening on {}", channelNames());

                    listen(pg);
                } catch (SQLException e) {
                    if (!running) {
                        break;
                    }
                    state = ListenerState.FAILED;
                    Duration delay = reconnectPolicy.getNextDelay();
                    reconnectPolicy.recordFailure();
                    metrics.recordReconnect();
                    log.warn("[LISTENER] Database connection lost ({}), reconnecting in {}ms (attempt {})",
                            e.getMessage(), delay.toMillis(), reconnectPolicy.getAttemptCount());
                    Thread.sleep(delay.toMillis());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            // Only wiring bugs get here (e.g. a channel that was never LISTENed to).
            log.error("[LISTENER] Fatal error, listener stopped", e);
            running = false;
        } finally {
            state = ListenerState.STOPPED;
        }
    }

    private void subscribe(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (ChangeChannel channel : ChangeChannel.values()) {
                stmt.execute("LISTEN " + channel.channelName());
            }
        }
    }

    private void listen(PGConnection pg) throws SQLException {
        while (running) {
            PGNotification[] notifications = pg.getNotifications(pollMs);
            if (notifications == null) {
                continue;
            }
            for (PGNotification n : notifications) {
                handle(n.getName(), n.getParameter());
            }
        }
    }

    /**
     * Decode one raw notification and deliver it.
     *
     * @return number of user channels the event was sent to
     * @throws IllegalArgumentException if the channel is not one the listener subscribes to
     */
    public int handle(String channel, String payload) {
        metrics.recordNotification(channel);

        ChatNotification notification;
        try {
            notification = codec.decode(channel, payload);
        } catch (NotificationDecodeException e) {
            metrics.recordDecodeFailure(channel);
            log.warn("[LISTENER] Dropping notification: {}", e.getMessage());
            return 0;
        }

        int delivered = deliver(notification);
        metrics.setRegisteredUsers(registry.userCount());
        return delivered;
    }

    private int deliver(ChatNotification notification) {
        if (!notification.hasRecipients()) {
            log.debug("[LISTENER] {} affects nobody, skipped", notification.event().type());
            return 0;
        }

        ChatEvent event = notification.event();
        String eventName = event.type().wireName();
        int delivered = 0;

        for (Long userId : notification.userIds()) {
            Optional<BroadcastChannel<ChatEvent>> channel = createOnDelivery
                    ? Optional.of(registry.getOrCreate(userId))
                    : registry.tryGet(userId);
            if (channel.isEmpty()) {
                continue;
            }
            int receivers = channel.get().send(event);
            metrics.recordDelivered(eventName);
            delivered++;
            log.debug("[LISTENER] {} -> user {} ({} receivers)", eventName, userId, receivers);
        }
        return delivered;
    }

    private static String channelNames() {
        StringBuilder sb = new StringBuilder();
        for (ChangeChannel channel : ChangeChannel.values()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(channel.channelName());
        }
        return sb.toString();
    }
}
