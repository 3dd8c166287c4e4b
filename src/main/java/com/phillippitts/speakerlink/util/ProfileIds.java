package com.phillippitts.speakerlink.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Deterministic profile identifiers. The id depends only on the normalized name and the source
 * that created the profile, so a re-run over the same inputs assigns the same ids.
 */
public final class ProfileIds {

    private static final int ID_LENGTH = 16;

    private ProfileIds() {
        // Prevent instantiation
    }

    /**
     * @param fullName name of the record that creates the profile
     * @param source   source name of that record
     * @return 16 lower-case hex characters
     */
    public static String generate(String fullName, String source) {
        Objects.requireNonNull(fullName, "fullName must not be null");
        Objects.requireNonNull(source, "source must not be null");
        String seed = NameParser.comparisonName(fullName) + ":" + source;
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(seed.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }
}
