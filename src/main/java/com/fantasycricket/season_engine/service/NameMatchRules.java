package com.fantasycricket.season_engine.service;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Decides whether two display names may refer to the same player.
 *
 * A pair matches when any of these rules accepts it:
 * <ul>
 *   <li>similarity ratio of the normalized names reaches the threshold</li>
 *   <li>one normalized name contains the other (minimum length applies)</li>
 *   <li>same token count, every position equal or one token a short prefix
 *       (initial) of the other, with at least one full-token agreement</li>
 * </ul>
 * The returned score is the similarity ratio, used to rank candidates.
 */
public class NameMatchRules {

    private final NameSimilarity similarity;
    private final double similarityThreshold;
    private final int minSubstringLength;
    private final int maxAbbreviationLength;

    public NameMatchRules(NameSimilarity similarity, double similarityThreshold,
                          int minSubstringLength, int maxAbbreviationLength) {
        if (similarityThreshold <= 0 || similarityThreshold > 1) {
            throw new IllegalStateException("similarityThreshold must be in (0, 1], was " + similarityThreshold);
        }
        this.similarity = similarity;
        this.similarityThreshold = similarityThreshold;
        this.minSubstringLength = minSubstringLength;
        this.maxAbbreviationLength = maxAbbreviationLength;
    }

    /**
     * @return the ranking score when the names match, empty otherwise
     */
    public OptionalDouble evaluate(String nameA, String nameB) {
        List<String> tokensA = NameNormalizer.tokens(nameA);
        List<String> tokensB = NameNormalizer.tokens(nameB);
        String normalizedA = String.join("", tokensA);
        String normalizedB = String.join("", tokensB);
        if (normalizedA.isEmpty() || normalizedB.isEmpty()) {
            return OptionalDouble.empty();
        }

        double ratio = similarity.ratio(normalizedA, normalizedB);
        if (meetsThreshold(ratio)
                || isContainment(normalizedA, normalizedB)
                || isPositionalAbbreviation(tokensA, tokensB)) {
            return OptionalDouble.of(ratio);
        }
        return OptionalDouble.empty();
    }

    // =========================================================================
    // Rules
    // =========================================================================

    public boolean meetsThreshold(double ratio) {
        return ratio >= similarityThreshold;
    }

    public boolean isContainment(String normalizedA, String normalizedB) {
        String shorter = normalizedA.length() <= normalizedB.length() ? normalizedA : normalizedB;
        String longer = shorter == normalizedA ? normalizedB : normalizedA;
        return shorter.length() >= minSubstringLength && longer.contains(shorter);
    }

    public boolean isPositionalAbbreviation(List<String> tokensA, List<String> tokensB) {
        if (tokensA.size() < 2 || tokensA.size() != tokensB.size()) return false;

        boolean anyAbbreviated = false;
        boolean anyFullAgreement = false;
        for (int i = 0; i < tokensA.size(); i++) {
            String a = tokensA.get(i);
            String b = tokensB.get(i);
            if (a.equals(b)) {
                anyFullAgreement |= a.length() > maxAbbreviationLength;
            } else if (abbreviates(a, b) || abbreviates(b, a)) {
                anyAbbreviated = true;
            } else {
                return false;
            }
        }
        return anyAbbreviated && anyFullAgreement;
    }

    private boolean abbreviates(String shortForm, String longForm) {
        return shortForm.length() <= maxAbbreviationLength
                && shortForm.length() < longForm.length()
                && longForm.startsWith(shortForm);
    }
}
