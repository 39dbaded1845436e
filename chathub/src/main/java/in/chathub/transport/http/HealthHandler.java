package in.chathub.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.chathub.hub.SubscriberRegistry;
import in.chathub.listener.ListenerState;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * GET /api/health
 */
public final class HealthHandler implements HttpHandler {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Supplier<ListenerState> listenerState;
    private final SubscriberRegistry registry;

    public HealthHandler(Supplier<ListenerState> listenerState, SubscriberRegistry registry) {
        this.listenerState = listenerState;
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ListenerState state = listenerState.get();

        ObjectNode body = MAPPER.createObjectNode();
        body.put("status", state == ListenerState.LISTENING ? "ok" : "degraded");
        body.put("listener", state.name());
        body.put("registeredUsers", registry.userCount());
        body.put("activeStreams", registry.receiverCount());

        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }
}
