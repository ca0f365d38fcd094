package com.xbleey.grafanareporter.service;

public final class SecretMasker {

    public static final char MASK_CHAR = '*';
    private static final String MASK = "****";

    private SecretMasker() {
    }

    /**
     * Keeps the first and last two characters and replaces the rest with a fixed
     * four-character mask, so the secret length is not revealed either.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= 4) {
            return MASK;
        }
        return secret.substring(0, 2) + MASK + secret.substring(secret.length() - 2);
    }

    public static boolean isMasked(String value) {
        return value != null && value.indexOf(MASK_CHAR) >= 0;
    }
}
