package in.chathub.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus metrics for the notification hub.
 *
 * Key Metrics:
 * - hub_notifications_total{channel} - raw notifications received from the database
 * - hub_decode_failures_total{channel} - notifications dropped because the payload was bad
 * - hub_events_delivered_total{event} - per-user sends performed by the listener
 * - hub_events_lagged_total - events a slow stream never saw
 * - hub_listener_reconnects_total - database reconnect attempts
 * - hub_active_streams - open SSE connections
 * - hub_registered_users - users with a fan-out channel
 */
public class HubMetrics {

    private final CollectorRegistry registry;

    private final Counter notifications;
    private final Counter decodeFailures;
    private final Counter eventsDelivered;
    private final Counter eventsLagged;
    private final Counter listenerReconnects;
    private final Gauge activeStreams;
    private final Gauge registeredUsers;

    public HubMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public HubMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.notifications = Counter.build()
            .name("hub_notifications_total")
            .help("Raw change notifications received from the database")
            .labelNames("channel")
            .register(registry);

        this.decodeFailures = Counter.build()
            .name("hub_decode_failures_total")
            .help("Notifications dropped because the payload could not be decoded")
            .labelNames("channel")
            .register(registry);

        this.eventsDelivered = Counter.build()
            .name("hub_events_delivered_total")
            .help("Events handed to a user's fan-out channel")
            .labelNames("event")
            .register(registry);

        this.eventsLagged = Counter.build()
            .name("hub_events_lagged_total")
            .help("Events skipped by streams that fell behind")
            .register(registry);

        this.listenerReconnects = Counter.build()
            .name("hub_listener_reconnects_total")
            .help("Database listener reconnect attempts")
            .register(registry);

        this.activeStreams = Gauge.build()
            .name("hub_active_streams")
            .help("Open server-sent event streams")
            .register(registry);

        this.registeredUsers = Gauge.build()
            .name("hub_registered_users")
            .help("Users holding a fan-out channel")
            .register(registry);
    }

    public void recordNotification(String channel) {
        notifications.labels(channel).inc();
    }

    public void recordDecodeFailure(String channel) {
        decodeFailures.labels(channel).inc();
    }

    public void recordDelivered(String eventName) {
        eventsDelivered.labels(eventName).inc();
    }

    public void recordLagged(long missed) {
        eventsLagged.inc(missed);
    }

    public void recordReconnect() {
        listenerReconnects.inc();
    }

    public void streamOpened() {
        activeStreams.inc();
    }

    public void streamClosed() {
        activeStreams.dec();
    }

    public void setRegisteredUsers(int count) {
        registeredUsers.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
