package com.storefront.shipping.service;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Comparison keys for province and city names.
 * Case, surrounding whitespace and accents are ignored, so "  Galápagos" and "GALAPAGOS" match.
 */
public final class LocationNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private LocationNormalizer() {
    }

    public static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String lowered = value.trim().toLowerCase(Locale.ROOT);
        String decomposed = Normalizer.normalize(lowered, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return Normalizer.normalize(stripped, Normalizer.Form.NFC);
    }

    public static boolean matches(String left, String right) {
        return normalize(left).equals(normalize(right));
    }
}
