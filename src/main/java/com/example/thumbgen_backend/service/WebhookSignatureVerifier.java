package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.config.ReplicateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;

/**
 * Checks provider webhook signatures: HMAC-SHA256 over {@code id.timestamp.body}, keyed with the base64 part of
 * a {@code whsec_} secret, sent as space-separated {@code v1,<base64>} entries. Without a configured secret
 * every call passes.
 */
@Component
public class WebhookSignatureVerifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String SECRET_PREFIX = "whsec_";
    private static final String SIGNATURE_VERSION = "v1,";

    private final ReplicateProperties props;
    private final Clock clock;

    public WebhookSignatureVerifier(ReplicateProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return props.hasWebhookSecret();
    }

    public boolean verify(String webhookId, String timestamp, String signatureHeader, String body) {
        if (!isEnabled()) {
            return true;
        }
        if (isBlank(webhookId) || isBlank(timestamp) || isBlank(signatureHeader) || body == null) {
            LOGGER.warn("WEBHOOK signature headers missing id={}", webhookId);
            return false;
        }
        long sentAt;
        try {
            sentAt = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("WEBHOOK bad timestamp id={} value={}", webhookId, timestamp);
            return false;
        }
        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - sentAt) > props.getWebhookToleranceSeconds()) {
            LOGGER.warn("WEBHOOK timestamp outside tolerance id={} skewSeconds={}", webhookId, now - sentAt);
            return false;
        }

        byte[] expected = sign(webhookId + "." + timestamp.trim() + "." + body);
        for (String candidate : signatureHeader.trim().split("\\s+")) {
            if (!candidate.startsWith(SIGNATURE_VERSION)) {
                continue;
            }
            byte[] provided;
            try {
                provided = Base64.getDecoder().decode(candidate.substring(SIGNATURE_VERSION.length()));
            } catch (IllegalArgumentException e) {
                LOGGER.debug("WEBHOOK undecodable signature entry id={}", webhookId);
                continue;
            }
            if (MessageDigest.isEqual(expected, provided)) {
                return true;
            }
        }
        LOGGER.warn("WEBHOOK signature mismatch id={}", webhookId);
        return false;
    }

    byte[] sign(String content) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secretKey(), "HmacSHA256"));
            return mac.doFinal(content.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private byte[] secretKey() {
        String secret = props.getWebhookSecret().trim();
        if (secret.startsWith(SECRET_PREFIX)) {
            return Base64.getDecoder().decode(secret.substring(SECRET_PREFIX.length()));
        }
        return secret.getBytes(StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
