package in.chathub.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.util.Base64;

/**
 * Issues EdDSA tokens the way the chat server does, from a freshly generated key pair.
 */
public final class TestTokens {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final KeyPair keyPair;

    public TestTokens() {
        try {
            keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    public String publicKeyPem() {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
            .encodeToString(keyPair.getPublic().getEncoded());
        return "-----BEGIN PUBLIC KEY-----\n" + body + "\n-----END PUBLIC KEY-----\n";
    }

    public JwtService verifier() {
        return JwtService.fromPem(publicKeyPem());
    }

    /**
     * User claims plus iss/aud/iat/nbf/exp, valid for the next hour.
     */
    public ObjectNode claims(long userId) {
        long now = System.currentTimeMillis() / 1000;
        ObjectNode claims = MAPPER.createObjectNode();
        claims.put("iat", now);
        claims.put("exp", now + 3600);
        claims.put("nbf", now);
        claims.put("iss", JwtService.ISSUER);
        claims.put("aud", JwtService.AUDIENCE);
        claims.put("id", userId);
        claims.put("ws_id", 1);
        claims.put("fullname", "User " + userId);
        claims.put("email", "user" + userId + "@example.com");
        claims.put("created_at", "2024-05-01T10:00:00Z");
        return claims;
    }

    public String token(long userId) {
        return sign(claims(userId));
    }

    public String sign(ObjectNode claims) {
        return sign("{\"alg\":\"EdDSA\",\"typ\":\"JWT\"}", claims);
    }

    public String sign(String headerJson, ObjectNode claims) {
        try {
            Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
            String header = encoder.encodeToString(headerJson.getBytes(StandardCharsets.UTF_8));
            String payload = encoder.encodeToString(MAPPER.writeValueAsBytes(claims));
            Signature signer = Signature.getInstance("Ed25519");
            signer.initSign(keyPair.getPrivate());
            signer.update((header + "." + payload).getBytes(StandardCharsets.US_ASCII));
            return header + "." + payload + "." + encoder.encodeToString(signer.sign());
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
