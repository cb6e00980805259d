package com.cornerleague.collector.service.extract;

import com.cornerleague.collector.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over normalized title and text; identical normalized input always yields the same digest.
 */
@Component
public class ContentHasher {

    public String contentHash(String title, String text) {
        String normalized = TextNormalizer.normalizeForHash(title) + " " + TextNormalizer.normalizeForHash(text);
        return sha256Hex(normalized.trim());
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
