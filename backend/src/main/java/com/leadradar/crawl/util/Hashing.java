package com.leadradar.crawl.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashing {
    public static final int BODY_PREFIX_LENGTH = 200;

    private Hashing() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Dedup key of a lead: reviewer, company, the first 200 characters of the body and the source URL.
     */
    public static String identityHash(String reviewer, String company, String body, String sourceUrl) {
        String text = body == null ? "" : body;
        String prefix = text.length() > BODY_PREFIX_LENGTH ? text.substring(0, BODY_PREFIX_LENGTH) : text;
        return sha256Hex(nullToEmpty(reviewer) + "|" + nullToEmpty(company) + "|" + prefix + "|" + nullToEmpty(sourceUrl));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
