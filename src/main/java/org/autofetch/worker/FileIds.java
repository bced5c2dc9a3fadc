package org.autofetch.worker;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Maps job names to file-name-safe ids used for lock and log files.
 * <p>
 * Every character other than an ASCII letter or digit becomes {@code -}. When that
 * replacement changed the name, the first 8 hex digits of the name's SHA-256 are
 * appended, so "a/b" and "a-b" get distinct ids while "A" stays "A".
 */
public final class FileIds {

    private FileIds() {}

    public static String of(String jobName) {
        StringBuilder sanitized = new StringBuilder(jobName.length());
        for (int i = 0; i < jobName.length(); i++) {
            char c = jobName.charAt(i);
            boolean alnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            sanitized.append(alnum ? c : '-');
        }
        String id = sanitized.toString();
        if (id.equals(jobName)) {
            return id;
        }
        return id + "-" + shortHash(jobName);
    }

    private static String shortHash(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
