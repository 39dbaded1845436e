package in.chathub.bootstrap;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.chathub.auth.JwtService;
import in.chathub.hub.SubscriberRegistry;
import in.chathub.listener.PgChangeListener;
import in.chathub.listener.ReconnectionPolicy;
import in.chathub.metrics.HubMetrics;
import in.chathub.metrics.PrometheusMetricsHandler;
import in.chathub.notify.NotificationCodec;
import in.chathub.transport.http.HealthHandler;
import in.chathub.transport.http.IdentityGate;
import in.chathub.transport.sse.EventStreamHandler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Notification hub entry point (no framework).
 *
 * Wiring:
 * - Postgres LISTEN on chat_updated / chat_message_created
 * - per-user fan-out registry
 * - SSE at GET /events (EdDSA JWT via Bearer header or ?token=)
 * - /api/health and Prometheus /metrics
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== Chat notification hub starting ===");

        HubConfig config = HubConfig.fromEnv();
        try {
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("Startup validation failed: {}", e.getMessage());
            System.exit(1);
            return;
        }

        JwtService jwtService;
        try {
            jwtService = config.authPublicKeyPem() != null
                ? JwtService.fromPem(config.authPublicKeyPem())
                : JwtService.fromPemFile(Path.of(config.authPublicKeyFile()));
        } catch (IllegalArgumentException | UncheckedIOException e) {
            log.error("Cannot load the token verification key: {}", e.getMessage());
            System.exit(1);
            return;
        }

        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // ═══════════════════════════════════════════════════════════════
        // Database + listener
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        HubMetrics metrics = new HubMetrics();
        SubscriberRegistry registry = new SubscriberRegistry(config.channelCapacity());

        ReconnectionPolicy reconnectPolicy = ReconnectionPolicy.builder()
            .initialDelay(config.backoffInitial())
            .maxDelay(config.backoffMax())
            .multiplier(2.0)
            .build();

        PgChangeListener listener = new PgChangeListener(
            dataSource,
            new NotificationCodec(mapper),
            registry,
            metrics,
            reconnectPolicy,
            config.listenerPollMs(),
            config.createOnDelivery()
        );
        listener.start();

        // ═══════════════════════════════════════════════════════════════
        // Identity gate
        // ═══════════════════════════════════════════════════════════════
        IdentityGate gate = new IdentityGate(jwtService::verify);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        EventStreamHandler events = new EventStreamHandler(gate, registry, mapper, config.keepAliveInterval(), metrics);
        HealthHandler health = new HealthHandler(listener::getState, registry);

        RoutingHandler routes = Handlers.routing()
            .get("/events", events)
            .get("/api/health", health)
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Chat notification hub\n\n" +
                    "SSE:     GET /events?token=<jwt>  (or Authorization: Bearer <jwt>)\n" +
                    "Health:  GET /api/health\n" +
                    "Metrics: GET /metrics\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("Hub started on http://localhost:{}/", config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down hub");
            events.shutdown();
            server.stop();
            listener.stop();
            dataSource.close();
        }, "hub-shutdown"));
    }

    private static HikariDataSource createDataSource(HubConfig config) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(config.dbUrl());
        hc.setUsername(config.dbUser());
        hc.setPassword(config.dbPass());
        hc.setMaximumPoolSize(config.dbPoolSize());
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(5000);
        // The listener keeps its connection for hours; the pool must not retire it mid-LISTEN.
        hc.setMaxLifetime(0);
        // Let the listener's reconnect loop handle an unreachable database at boot.
        hc.setInitializationFailTimeout(-1);
        hc.setPoolName("chathub-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hc);
    }

    private App() {}
}
