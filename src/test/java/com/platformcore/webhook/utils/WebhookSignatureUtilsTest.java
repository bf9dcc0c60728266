package com.platformcore.webhook.utils;

import org.junit.jupiter.api.Test;
import com.platformcore.webhook.exceptions.ValidationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookSignatureUtilsTest {

    private static final String SECRET = "whsec_test";
    private static final String PAYLOAD = "{\"id\":\"evt-1\",\"type\":\"bonus.awarded\"}";
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void signatureHasTimestampAndHexParts() {
        String signature = WebhookSignatureUtils.generateSignature(PAYLOAD, SECRET, NOW);

        assertTrue(signature.startsWith("t=" + NOW + ",v1="));
        String hex = signature.substring(signature.indexOf("v1=") + 3);
        assertEquals(64, hex.length());
        assertTrue(hex.matches("[0-9a-f]+"));
    }

    @Test
    void signatureIsDeterministic() {
        assertEquals(WebhookSignatureUtils.generateSignature(PAYLOAD, SECRET, NOW),
            WebhookSignatureUtils.generateSignature(PAYLOAD, SECRET, NOW));
    }

    @Test
    void verifiesOwnSignature() {
        String signature = WebhookSignatureUtils.generateSignature(PAYLOAD, SECRET, NOW);

        assertTrue(WebhookSignatureUtils.verifySignature(PAYLOAD, signature, SECRET,
            WebhookSignatureUtils.DEFAULT_TOLERANCE_MS, NOW + 1000));
    }

    @Test
    void rejectsTamperedPayload() {
        String signature = WebhookSignatureUtils.generateSignature(PAYLOAD, SECRET, NOW);
        String tampered = PAYLOAD.replace("evt-1", "evt-2");

        assertFalse(WebhookSignatureUtils.verifySignature(tampered, signature, SECRET,
            WebhookSignatureUtils.DEFAULT_TOLERANCE_MS, NOW));
    }

    @Test
    void rejectsWrongSecret() {
        String signature = WebhookSignatureUtils.generateSignature(PAYLOAD, SECRET, NOW);

        assertFalse(WebhookSignatureUtils.verifySignature(PAYLOAD, signature, "other",
            WebhookSignatureUtils.DEFAULT_TOLERANCE_MS, NOW));
    }

    @Test
    void toleranceBoundaryIsInclusive() {
        long tolerance = 300_000L;
        String signature = WebhookSignatureUtils.generateSignature(PAYLOAD, SECRET, NOW);

        assertTrue(WebhookSignatureUtils.verifySignature(PAYLOAD, signature, SECRET, tolerance,
            NOW + tolerance));
        assertFalse(WebhookSignatureUtils.verifySignature(PAYLOAD, signature, SECRET, tolerance,
            NOW + tolerance + 1));
        assertFalse(WebhookSignatureUtils.verifySignature(PAYLOAD, signature, SECRET, tolerance,
            NOW - tolerance - 1));
    }

    @Test
    void rejectsMalformedHeaders() {
        String signature = WebhookSignatureUtils.generateSignature(PAYLOAD, SECRET, NOW);
        String hex = signature.substring(signature.indexOf("v1=") + 3);
        long tolerance = WebhookSignatureUtils.DEFAULT_TOLERANCE_MS;

        assertFalse(WebhookSignatureUtils.verifySignature(PAYLOAD, "v1=" + hex, SECRET, tolerance, NOW));
        assertFalse(WebhookSignatureUtils.verifySignature(PAYLOAD, "t=" + NOW, SECRET, tolerance, NOW));
        assertFalse(WebhookSignatureUtils.verifySignature(PAYLOAD, "t=abc,v1=" + hex, SECRET,
            tolerance, NOW));
        assertFalse(WebhookSignatureUtils.verifySignature(PAYLOAD, "t=" + NOW + ",v1=zz", SECRET,
            tolerance, NOW));
        assertFalse(WebhookSignatureUtils.verifySignature(PAYLOAD, "", SECRET, tolerance, NOW));
        assertFalse(WebhookSignatureUtils.verifySignature(PAYLOAD, null, SECRET, tolerance, NOW));
    }

    @Test
    void acceptsWhitespaceAroundParts() {
        String signature = WebhookSignatureUtils.generateSignature(PAYLOAD, SECRET, NOW);

        assertTrue(WebhookSignatureUtils.verifySignature(PAYLOAD, signature.replace(",", ", "),
            SECRET, WebhookSignatureUtils.DEFAULT_TOLERANCE_MS, NOW));
    }

    @Test
    void generateRequiresSecret() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> WebhookSignatureUtils.generateSignature(PAYLOAD, "", NOW));
        assertEquals("secret", e.getField());
        assertThrows(ValidationException.class,
            () -> WebhookSignatureUtils.generateSignature(PAYLOAD, null, NOW));
    }

    @Test
    void verifyWithEmptySecretFails() {
        String signature = WebhookSignatureUtils.generateSignature(PAYLOAD, SECRET, NOW);

        assertFalse(WebhookSignatureUtils.verifySignature(PAYLOAD, signature, "",
            WebhookSignatureUtils.DEFAULT_TOLERANCE_MS, NOW));
    }
}
