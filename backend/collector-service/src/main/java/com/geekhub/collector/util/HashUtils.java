package com.geekhub.collector.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * MD5 digests used as content-addressed keys.
 */
public final class HashUtils {

    private static final int URL_HASH_LENGTH = 12;

    private HashUtils() {
    }

    public static String md5Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }

    /**
     * Short, stable key of a feed address, used to partition feed logs.
     */
    public static String urlHash(String url) {
        return md5Hex(url != null ? url : "").substring(0, URL_HASH_LENGTH);
    }
}
