package com.cloudname.generator.naming.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import lombok.experimental.UtilityClass;

/**
 * Digest of the service name, used as a compact disambiguating token in
 * names too short to carry the service name itself.
 */
@UtilityClass
public class ContentHasher {

    public static final int TOKEN_LENGTH = 6;

    /**
     * Lowercase hex MD5 of the input (32 characters). Null hashes like the empty string.
     */
    public static String hash(String input) {
        String value = input == null ? "" : input;
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }

    /**
     * First {@value #TOKEN_LENGTH} characters of {@link #hash(String)}.
     */
    public static String token(String input) {
        return hash(input).substring(0, TOKEN_LENGTH);
    }
}
