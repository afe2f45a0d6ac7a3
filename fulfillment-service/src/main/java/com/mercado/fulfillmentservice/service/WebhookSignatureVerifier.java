package com.mercado.fulfillmentservice.service;

import com.mercado.fulfillmentservice.config.FulfillmentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 over the raw request body, hex encoded, keyed per provider.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final FulfillmentProperties properties;

    /**
     * @return lower-case hex signature, or {@code null} when no secret is configured
     *         for the provider (every signature is then rejected)
     */
    public String sign(String provider, String rawBody) {
        String secret = secretFor(provider);
        if (secret == null || secret.isEmpty()) {
            log.warn("No webhook secret configured: provider={}", provider);
            return null;
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(rawBody.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    /**
     * Constant-time comparison. Accepts an optional {@code sha256=} prefix and
     * upper-case hex from the provider.
     */
    public boolean matches(String expected, String provided) {
        if (expected == null || provided == null || provided.isBlank()) {
            return false;
        }
        String normalized = provided.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(PREFIX)) {
            normalized = normalized.substring(PREFIX.length());
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                normalized.getBytes(StandardCharsets.UTF_8));
    }

    private String secretFor(String provider) {
        // unset environment variables bind as empty strings
        String secret = properties.getWebhook().getSecrets().get(provider.toLowerCase(Locale.ROOT));
        return secret != null && !secret.isEmpty() ? secret : properties.getWebhook().getDefaultSecret();
    }
}
