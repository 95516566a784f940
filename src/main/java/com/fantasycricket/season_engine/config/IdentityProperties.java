package com.fantasycricket.season_engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "fantasy.identity")
public class IdentityProperties {

    /** Minimum similarity ratio for a fuzzy name match. */
    private double similarityThreshold = 0.85;

    /** Shortest normalized name the containment rule will accept. */
    private int minSubstringLength = 3;

    /** Longest token treated as an initial or abbreviation. */
    private int maxAbbreviationLength = 3;
}
