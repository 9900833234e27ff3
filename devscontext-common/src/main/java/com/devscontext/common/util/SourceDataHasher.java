package com.devscontext.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Digest over the raw text a context was built from. Two builds over the same
 * source data produce the same hash regardless of whitespace or letter case.
 */
public final class SourceDataHasher {

    private static final String SEPARATOR = "\n---\n";

    private SourceDataHasher() {}

    public static String hash(Collection<String> rawTexts) {
        String joined = rawTexts.stream()
            .filter(Objects::nonNull)
            .map(SourceDataHasher::normalize)
            .filter(text -> !text.isEmpty())
            .collect(Collectors.joining(SEPARATOR));
        return sha256Hex(joined);
    }

    static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT)
            .replaceAll("\\s+", " ")
            .trim();
    }

    private static String sha256Hex(String content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
