package in.chathub.transport.sse;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.chathub.hub.SubscriberRegistry;
import in.chathub.metrics.HubMetrics;
import in.chathub.transport.http.IdentityGate;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * GET /events
 *
 * Authenticates on the IO thread, then moves the exchange to a dedicated stream
 * thread in blocking mode and runs an {@link EventStream} until the client leaves.
 */
public final class EventStreamHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(EventStreamHandler.class);

    private final IdentityGate gate;
    private final SubscriberRegistry registry;
    private final ObjectMapper mapper;
    private final Duration keepAliveInterval;
    private final HubMetrics metrics;

    private final Set<EventStream> openStreams = ConcurrentHashMap.newKeySet();
    private final AtomicLong threadSeq = new AtomicLong(0);
    private final ExecutorService streamExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-stream-" + threadSeq.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public EventStreamHandler(IdentityGate gate, SubscriberRegistry registry, ObjectMapper mapper,
                              Duration keepAliveInterval, HubMetrics metrics) {
        this.gate = gate;
        this.registry = registry;
        this.mapper = mapper;
        this.keepAliveInterval = keepAliveInterval;
        this.metrics = metrics;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Long userId = gate.authenticate(exchange);
        if (userId == null) {
            return;
        }
        exchange.dispatch(streamExecutor, ex -> stream(ex, userId));
    }

    private void stream(HttpServerExchange exchange, long userId) {
        exchange.startBlocking();
        exchange.setStatusCode(200);
        exchange.getResponseHeaders()
            .put(Headers.CONTENT_TYPE, "text/event-stream")
            .put(Headers.CACHE_CONTROL, "no-cache")
            .put(HttpString.tryFromString("X-Accel-Buffering"), "no");

        EventStream stream = new EventStream(userId, registry, SseSink.of(exchange.getOutputStream()),
                mapper, keepAliveInterval, metrics);
        openStreams.add(stream);
        try {
            stream.run();
        } finally {
            openStreams.remove(stream);
        }
    }

    public int openStreamCount() {
        return openStreams.size();
    }

    /**
     * Stop every open stream and the stream threads.
     */
    public void shutdown() {
        log.info("[SSE] Shutting down {} open stream(s)", openStreams.size());
        for (EventStream stream : openStreams) {
            stream.stop();
        }
        streamExecutor.shutdown();
        try {
            if (!streamExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                streamExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            streamExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
