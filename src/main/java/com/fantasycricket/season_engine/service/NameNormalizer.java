package com.fantasycricket.season_engine.service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical forms of a scraped display name.
 *
 * "J. de Vries" -> tokens [j, de, vries] -> normalized "jdevries".
 * Punctuation separates tokens ("J.de" is [j, de]); apostrophes are dropped
 * inside a word ("O'Neil" is [oneil]).
 */
public final class NameNormalizer {

    private static final Pattern APOSTROPHES = Pattern.compile("['\u2019`]");
    private static final Pattern NON_NAME_CHARS = Pattern.compile("[^\\p{L}\\p{Nd}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameNormalizer() {}

    public static List<String> tokens(String name) {
        if (name == null) return List.of();
        String lower = APOSTROPHES.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("");
        String cleaned = NON_NAME_CHARS.matcher(lower).replaceAll(" ").trim();
        if (cleaned.isEmpty()) return List.of();
        return Arrays.asList(WHITESPACE.split(cleaned));
    }

    public static String normalize(String name) {
        return String.join("", tokens(name));
    }
}
