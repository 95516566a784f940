package com.fantasycricket.season_engine.config;

import com.fantasycricket.season_engine.model.RuleSet;
import com.fantasycricket.season_engine.service.LevenshteinSimilarity;
import com.fantasycricket.season_engine.service.NameMatchRules;
import com.fantasycricket.season_engine.service.NameSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({RuleSetProperties.class, IdentityProperties.class})
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public RuleSet ruleSet(RuleSetProperties properties) {
        RuleSet ruleSet = properties.toRuleSet();
        log.info("Loaded rule set: {} per run, {} per wicket, multiplier [{}, {}] around {}, drift {}",
                ruleSet.getPointsPerRun(), ruleSet.getPointsPerWicket(),
                ruleSet.getMinMultiplier(), ruleSet.getMaxMultiplier(),
                ruleSet.getNeutralMultiplier(), ruleSet.getDriftRate());
        return ruleSet;
    }

    @Bean
    public NameSimilarity nameSimilarity() {
        return new LevenshteinSimilarity();
    }

    @Bean
    public NameMatchRules nameMatchRules(NameSimilarity nameSimilarity, IdentityProperties properties) {
        return new NameMatchRules(nameSimilarity,
                properties.getSimilarityThreshold(),
                properties.getMinSubstringLength(),
                properties.getMaxAbbreviationLength());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
