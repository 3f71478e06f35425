package com.phillippitts.voicegate.util;

/** Utility for privacy-safe logging of transcript previews and client identities. */
public final class LogSanitizer {
    private static final int VISIBLE_IDENTITY_CHARS = 8;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Masks an identity key (address, optional fingerprint) to its first characters followed by "...".
     */
    public static String maskIdentity(String identityKey) {
        if (identityKey == null || identityKey.isEmpty()) {
            return "";
        }
        if (identityKey.length() <= VISIBLE_IDENTITY_CHARS) {
            return identityKey.charAt(0) + "...";
        }
        return identityKey.substring(0, VISIBLE_IDENTITY_CHARS) + "...";
    }
}
