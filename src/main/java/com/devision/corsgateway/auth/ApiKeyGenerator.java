package com.devision.corsgateway.auth;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Creates and sanity-checks gateway API keys.
 *
 * Generated keys look like {@code sdk-lx4k2c9a-7f3kq0z1m2n8p}: prefix, base-36 creation time and
 * a base-36 random part.
 */
public final class ApiKeyGenerator {

    public static final String DEFAULT_PREFIX = "sdk";

    private static final Pattern DEVELOPMENT_KEY = Pattern.compile("^development-key-\\d+$");
    private static final Pattern GENERATED_KEY = Pattern.compile("^[a-z]+-[a-z0-9]+-[a-z0-9]+$");
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_LENGTH = 13;
    private static final SecureRandom RANDOM = new SecureRandom();

    private ApiKeyGenerator() {
    }

    public static String generate(String prefix) {
        String p = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim().toLowerCase(Locale.ROOT);
        StringBuilder random = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            random.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return p + "-" + Long.toString(System.currentTimeMillis(), 36) + "-" + random;
    }

    public static boolean isValidFormat(String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return false;
        }
        return DEVELOPMENT_KEY.matcher(apiKey).matches() || GENERATED_KEY.matcher(apiKey).matches();
    }
}
