package in.chathub.transport.http;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.function.Function;

/**
 * Resolves the caller of an HTTP exchange to a user id.
 *
 * Token sources, in order: {@code Authorization: Bearer <token>}, then {@code ?token=<token>}.
 * No usable token answers 401; a token that does not verify answers 403.
 */
public final class IdentityGate {
    private static final Logger log = LoggerFactory.getLogger(IdentityGate.class);

    // token -> userId (null if invalid)
    private final Function<String, Long> tokenVerifier;

    public IdentityGate(Function<String, Long> tokenVerifier) {
        this.tokenVerifier = tokenVerifier;
    }

    /**
     * @return the user id, or null after a 401/403 response has been sent
     */
    public Long authenticate(HttpServerExchange exchange) {
        String token = extractToken(exchange);
        if (token == null) {
            log.warn("[GATE] Missing or malformed credentials from {}", exchange.getSourceAddress());
            reject(exchange, 401, "Unauthorized");
            return null;
        }

        Long userId = tokenVerifier.apply(token);
        if (userId == null) {
            log.warn("[GATE] Token verification failed from {}", exchange.getSourceAddress());
            reject(exchange, 403, "Token verification failed");
            return null;
        }
        return userId;
    }

    static String extractToken(HttpServerExchange exchange) {
        String authHeader = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (authHeader != null) {
            if (!authHeader.startsWith("Bearer ")) {
                return null;
            }
            String token = authHeader.substring(7).trim();
            return token.isEmpty() ? null : token;
        }

        Deque<String> tokenParam = exchange.getQueryParameters().get("token");
        if (tokenParam == null || tokenParam.isEmpty()) {
            return null;
        }
        String token = tokenParam.peekFirst().trim();
        return token.isEmpty() ? null : token;
    }

    private static void reject(HttpServerExchange exchange, int status, String message) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send("{\"error\":\"" + message + "\"}", StandardCharsets.UTF_8);
    }
}
