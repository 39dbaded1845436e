package in.chathub.transport.sse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.chathub.domain.event.ChatEvent;
import in.chathub.hub.BroadcastChannel;
import in.chathub.hub.LaggedException;
import in.chathub.hub.SubscriberRegistry;
import in.chathub.metrics.HubMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Pumps one user's fan-out channel into one client connection.
 *
 * Each stream holds its own receive handle, so a user with several open tabs
 * gets every event on each of them. The loop races the next event against the
 * keep-alive tick; keep-alives go out on a fixed schedule regardless of traffic.
 * Lag is skipped silently. The stream ends when the sink fails or {@link #stop()} is called.
 */
public final class EventStream {
    private static final Logger log = LoggerFactory.getLogger(EventStream.class);

    static final String KEEP_ALIVE_TEXT = "keep-alive";

    private final long userId;
    private final SubscriberRegistry registry;
    private final SseSink sink;
    private final ObjectMapper mapper;
    private final Duration keepAliveInterval;
    private final HubMetrics metrics;

    private volatile boolean running = true;

    public EventStream(long userId, SubscriberRegistry registry, SseSink sink, ObjectMapper mapper,
                       Duration keepAliveInterval, HubMetrics metrics) {
        this.userId = userId;
        this.registry = registry;
        this.sink = sink;
        this.mapper = mapper;
        this.keepAliveInterval = keepAliveInterval;
        this.metrics = metrics;
    }

    /**
     * Blocks until the client goes away, the stream is stopped, or the thread is interrupted.
     */
    public void run() {
        BroadcastChannel<ChatEvent> channel = registry.getOrCreate(userId);
        metrics.streamOpened();

        try (BroadcastChannel<ChatEvent>.Receiver receiver = channel.subscribe()) {
            log.info("[SSE] Stream opened for user {} ({} receivers)", userId, channel.receiverCount());
            long intervalNanos = keepAliveInterval.toNanos();
            long nextKeepAlive = System.nanoTime();

            while (running) {
                long waitNanos = nextKeepAlive - System.nanoTime();
                if (waitNanos <= 0) {
                    sink.write(SseFrame.comment(KEEP_ALIVE_TEXT));
                    nextKeepAlive += intervalNanos;
                    if (nextKeepAlive - System.nanoTime() <= 0) {
                        // Fell behind by more than a full interval; do not burst.
                        nextKeepAlive = System.nanoTime() + intervalNanos;
                    }
                    continue;
                }

                ChatEvent event;
                try {
                    event = receiver.poll(Duration.ofNanos(waitNanos));
                } catch (LaggedException e) {
                    metrics.recordLagged(e.getMissed());
                    log.debug("[SSE] User {} lagged, skipped {} event(s)", userId, e.getMissed());
                    continue;
                }

                if (event != null) {
                    SseFrame frame = toFrame(event);
                    if (frame != null) {
                        sink.write(frame);
                    }
                }
            }
        } catch (IOException e) {
            log.info("[SSE] Client for user {} disconnected: {}", userId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running = false;
            metrics.streamClosed();
            log.info("[SSE] Stream closed for user {}", userId);
        }
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    private SseFrame toFrame(ChatEvent event) {
        try {
            return SseFrame.event(event.type().wireName(), mapper.writeValueAsString(event.payload()));
        } catch (JsonProcessingException e) {
            log.warn("[SSE] Failed to serialize {} for user {}: {}", event.type(), userId, e.getMessage());
            return null;
        }
    }
}
