package com.handoff.backend.security;

import com.handoff.backend.config.SecurityProperties;
import com.handoff.backend.exception.UnauthorizedException;
import com.handoff.backend.util.ExpiringMap;
import com.handoff.backend.util.HashUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * Authenticates inbound handoffs by shared token or by HMAC-signed payload.
 * <p>
 * Signed requests carry {@code X-Timestamp} (epoch millis) and
 * {@code X-Signature: sha256=hex(HMAC-SHA256(secret, timestamp + rawBody))}. The timestamp must be within
 * the signature window of server time, and an accepted signature cannot be used again inside that window.
 */
@Slf4j
public class AuthGuard implements AutoCloseable {

    public static final String SIGNATURE_PREFIX = "sha256=";

    private final String token;
    private final String signingSecret;
    private final Duration window;
    private final Clock clock;
    private final ExpiringMap<String, Boolean> seenSignatures;

    public AuthGuard(SecurityProperties.Auth properties, Clock clock) {
        this.token = properties.getToken();
        this.signingSecret = properties.getSigningSecret();
        this.window = properties.getSignatureWindow();
        this.clock = clock;
        // A timestamp may sit up to one window ahead of the clock, so a signature stays
        // replayable for at most two windows after it is first accepted.
        this.seenSignatures = new ExpiringMap<>("seen-signatures", window.multipliedBy(2), clock, window);
    }

    public CallerPrincipal verify(AuthRequest request) {
        if (hasText(request.token())) {
            return verifyToken(request);
        }
        if (hasText(request.signature()) && hasText(request.timestamp())) {
            return verifySignature(request);
        }
        throw new UnauthorizedException("AUTH_REQUIRED",
                "Authentication required (provide X-Auth-Token or X-Signature + X-Timestamp)");
    }

    public static String sign(String secret, String timestamp, byte[] rawBody) {
        byte[] prefix = timestamp.getBytes(StandardCharsets.UTF_8);
        byte[] body = rawBody == null ? new byte[0] : rawBody;
        byte[] message = new byte[prefix.length + body.length];
        System.arraycopy(prefix, 0, message, 0, prefix.length);
        System.arraycopy(body, 0, message, prefix.length, body.length);
        return SIGNATURE_PREFIX + HashUtils.hmacSha256Hex(secret, message);
    }

    public int seenSignatureCount() {
        return seenSignatures.size();
    }

    @Override
    public void close() {
        seenSignatures.close();
    }

    private CallerPrincipal verifyToken(AuthRequest request) {
        if (!hasText(token)) {
            throw new UnauthorizedException("AUTH_NOT_CONFIGURED", "Token authentication is not configured (handoff.security.auth.token)");
        }
        if (!HashUtils.constantTimeEquals(token, request.token())) {
            throw new UnauthorizedException("INVALID_TOKEN", "Invalid authentication token");
        }
        return CallerPrincipal.builder()
                .mode(CallerPrincipal.Mode.TOKEN)
                .tokenHash(HashUtils.sha256Hex(request.token()))
                .remoteAddress(request.remoteAddress())
                .build();
    }

    private CallerPrincipal verifySignature(AuthRequest request) {
        if (!hasText(signingSecret)) {
            throw new UnauthorizedException("AUTH_NOT_CONFIGURED", "Signed payloads are not configured (handoff.security.auth.signing-secret)");
        }
        long requestTime;
        try {
            requestTime = Long.parseLong(request.timestamp().trim());
        } catch (NumberFormatException e) {
            throw new UnauthorizedException("INVALID_TIMESTAMP", "Invalid timestamp format");
        }
        long skewMs = Math.abs(clock.millis() - requestTime);
        if (skewMs > window.toMillis()) {
            throw new UnauthorizedException("TIMESTAMP_OUT_OF_WINDOW",
                    "Request timestamp outside valid window (" + window.toMinutes() + " minutes)");
        }
        String expected = sign(signingSecret, request.timestamp().trim(), request.rawBody());
        if (!HashUtils.constantTimeEquals(expected, request.signature().trim())) {
            throw new UnauthorizedException("INVALID_SIGNATURE", "Invalid HMAC signature");
        }
        if (seenSignatures.putIfAbsent(request.signature().trim(), Boolean.TRUE).isPresent()) {
            log.warn("Rejected replayed signature from {}", request.remoteAddress());
            throw new UnauthorizedException("SIGNATURE_REPLAYED", "Signature already used");
        }
        return CallerPrincipal.builder()
                .mode(CallerPrincipal.Mode.SIGNATURE)
                .remoteAddress(request.remoteAddress())
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Credentials lifted from the request headers plus the exact body bytes that were signed.
     */
    public record AuthRequest(String token, String signature, String timestamp, byte[] rawBody,
                              String remoteAddress) {
    }
}
