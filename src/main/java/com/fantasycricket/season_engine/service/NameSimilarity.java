package com.fantasycricket.season_engine.service;

/**
 * Similarity between two already-normalized names, as a ratio in [0, 1].
 */
@FunctionalInterface
public interface NameSimilarity {

    double ratio(String a, String b);
}
