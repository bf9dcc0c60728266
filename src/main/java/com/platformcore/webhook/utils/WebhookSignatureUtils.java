package com.platformcore.webhook.utils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import com.platformcore.webhook.exceptions.ValidationException;

/**
 * HMAC-SHA256 signing of webhook bodies. The header format is {@code t={epochMillis},v1={hex}}
 * where the MAC covers {@code "{epochMillis}.{body}"}.
 *
 * <p>{@link #verifySignature(String, String, String)} is what receivers call on the raw request
 * body and the {@code X-Webhook-Signature} header value.
 */
public class WebhookSignatureUtils {

    public static final long DEFAULT_TOLERANCE_MS = 300000L;

    private static final String ALGORITHM = "HmacSHA256";
    private static final String TIMESTAMP_PREFIX = "t=";
    private static final String SIGNATURE_PREFIX = "v1=";

    public static String generateSignature(String payload, String secret, long timestamp) {
        if (secret == null || secret.isEmpty()) {
            throw new ValidationException("secret",
                "Webhook secret is required for HMAC signature generation");
        }
        return TIMESTAMP_PREFIX + timestamp + "," + SIGNATURE_PREFIX
            + HexFormat.of().formatHex(hmac(timestamp + "." + payload, secret));
    }

    public static boolean verifySignature(String payload, String signatureHeader, String secret) {
        return verifySignature(payload, signatureHeader, secret, DEFAULT_TOLERANCE_MS);
    }

    public static boolean verifySignature(String payload, String signatureHeader, String secret,
            long toleranceMs) {
        return verifySignature(payload, signatureHeader, secret, toleranceMs,
            System.currentTimeMillis());
    }

    public static boolean verifySignature(String payload, String signatureHeader, String secret,
            long toleranceMs, long now) {
        if (payload == null || signatureHeader == null || secret == null || secret.isEmpty()) {
            return false;
        }
        String timestampPart = null;
        String signaturePart = null;
        for (String part : signatureHeader.split(",")) {
            String trimmed = part.trim();
            if (timestampPart == null && trimmed.startsWith(TIMESTAMP_PREFIX)) {
                timestampPart = trimmed.substring(TIMESTAMP_PREFIX.length());
            } else if (signaturePart == null && trimmed.startsWith(SIGNATURE_PREFIX)) {
                signaturePart = trimmed.substring(SIGNATURE_PREFIX.length());
            }
        }
        if (timestampPart == null || signaturePart == null) {
            return false;
        }

        long timestamp;
        byte[] received;
        try {
            timestamp = Long.parseLong(timestampPart);
            received = HexFormat.of().parseHex(signaturePart);
        } catch (IllegalArgumentException e) {
            return false;
        }

        // replay protection
        if (Math.abs(now - timestamp) > toleranceMs) {
            return false;
        }

        byte[] expected = hmac(timestamp + "." + payload, secret);
        return MessageDigest.isEqual(expected, received);
    }

    private static byte[] hmac(String message, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate HMAC signature", e);
        }
    }
}
