package com.mchekin.runnerdispatch.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks GitHub's {@code X-Hub-Signature-256} header against the raw request body.
 */
@Component
@Slf4j
public class SignatureVerifier {

    static final String PREFIX = "sha256=";

    /**
     * Returns false on a missing or malformed header, a blank secret or a mismatch. Never throws.
     */
    public boolean verify(String secret, byte[] rawBody, String presentedSignature) {
        if (secret == null || secret.isEmpty() || rawBody == null) {
            return false;
        }
        if (presentedSignature == null || !presentedSignature.startsWith(PREFIX)) {
            return false;
        }

        try {
            byte[] expected = sign(secret, rawBody).getBytes(StandardCharsets.US_ASCII);
            byte[] presented = presentedSignature.getBytes(StandardCharsets.US_ASCII);
            return MessageDigest.isEqual(expected, presented);
        } catch (IllegalStateException e) {
            return false;
        }
    }

    /**
     * Formats the HMAC-SHA256 of {@code rawBody} as {@code sha256=<hex>}.
     */
    public String sign(String secret, byte[] rawBody) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            SecretKeySpec secretKeySpec = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
            mac.init(secretKeySpec);
            byte[] hmacBytes = mac.doFinal(rawBody);
            return PREFIX + HexFormat.of().formatHex(hmacBytes);
        } catch (Exception e) {
            log.error("Failed to calculate HMAC", e);
            throw new IllegalStateException("Failed to calculate HMAC", e);
        }
    }
}
