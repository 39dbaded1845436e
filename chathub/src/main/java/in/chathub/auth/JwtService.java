package in.chathub.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * EdDSA (Ed25519) JWT verification for tokens issued by the chat server.
 *
 * The chat server signs with its private key; the hub only holds the public key.
 * Claims: iss, aud, exp (and optionally nbf) plus the user record itself
 * ({@code id}, {@code ws_id}, {@code fullname}, {@code email}, ...).
 */
public final class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String ALGORITHM = "EdDSA";
    public static final String ISSUER = "chat_server";
    public static final String AUDIENCE = "chat_web";

    private final PublicKey publicKey;

    public JwtService(PublicKey publicKey) {
        if (publicKey == null) {
            throw new IllegalArgumentException("JWT public key must not be null");
        }
        this.publicKey = publicKey;
    }

    /**
     * Load an Ed25519 public key from PEM text ({@code -----BEGIN PUBLIC KEY-----}).
     *
     * @throws IllegalArgumentException if the text is not an Ed25519 SubjectPublicKeyInfo
     */
    public static JwtService fromPem(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("JWT public key PEM must not be empty");
        }
        String base64 = pem
            .replace("-----BEGIN PUBLIC KEY-----", "")
            .replace("-----END PUBLIC KEY-----", "")
            .replaceAll("\\s", "");
        try {
            byte[] der = Base64.getDecoder().decode(base64);
            PublicKey key = KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(der));
            return new JwtService(key);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid Ed25519 public key PEM: " + e.getMessage(), e);
        }
    }

    public static JwtService fromPemFile(Path path) {
        try {
            return fromPem(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read JWT public key from " + path, e);
        }
    }

    /**
     * Validate token and extract the user id (the {@code id} claim).
     * Returns null if the token is malformed, forged, expired, not yet valid, or issued for someone else.
     */
    public Long verify(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        if (token.startsWith("Bearer ")) {
            token = token.substring(7);
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            log.debug("Invalid token format");
            return null;
        }

        try {
            Base64.Decoder decoder = Base64.getUrlDecoder();
            JsonNode header = MAPPER.readTree(decoder.decode(parts[0]));
            if (!ALGORITHM.equals(header.path("alg").asText())) {
                log.debug("Unsupported token algorithm: {}", header.path("alg").asText());
                return null;
            }

            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(publicKey);
            verifier.update((parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII));
            if (!verifier.verify(decoder.decode(parts[2]))) {
                log.debug("Invalid token signature");
                return null;
            }

            JsonNode claims = MAPPER.readTree(decoder.decode(parts[1]));
            if (!ISSUER.equals(claims.path("iss").asText()) || !hasAudience(claims.path("aud"))) {
                log.debug("Token issuer/audience mismatch");
                return null;
            }

            long nowSeconds = System.currentTimeMillis() / 1000;
            if (!claims.path("exp").canConvertToLong() || nowSeconds > claims.path("exp").asLong()) {
                log.debug("Token expired");
                return null;
            }
            if (claims.has("nbf") && nowSeconds < claims.path("nbf").asLong()) {
                log.debug("Token not yet valid");
                return null;
            }

            JsonNode id = claims.path("id");
            if (!id.isIntegralNumber()) {
                log.debug("Missing id claim");
                return null;
            }
            return id.asLong();
        } catch (Exception e) {
            log.debug("Token validation error: {}", e.getMessage());
            return null;
        }
    }

    // aud is a single string or an array of strings.
    private static boolean hasAudience(JsonNode aud) {
        if (aud.isTextual()) {
            return AUDIENCE.equals(aud.asText());
        }
        if (aud.isArray()) {
            for (JsonNode a : aud) {
                if (AUDIENCE.equals(a.asText())) {
                    return true;
                }
            }
        }
        return false;
    }
}
