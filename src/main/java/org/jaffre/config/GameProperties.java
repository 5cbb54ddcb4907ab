package org.jaffre.config;

import lombok.Data;
import org.jaffre.model.game.rules.RuleSet;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Réglages de tempo et de règles, préfixe {@code jaffre.game}.
 * Toutes les durées sont en millisecondes.
 */
@Data
@Component
@ConfigurationProperties(prefix = "jaffre.game")
public class GameProperties {

    private long turnTimeoutMs = 60_000;
    private long tickMs = 1_000;
    private long warningMs = 15_000;
    private long reconnectGraceMs = 15 * 60_000;
    private long trickRevealMs = 1_500;
    private long scoringAutoAdvanceMs = 60_000;
    private long persistDebounceMs = 100;
    private long staleGameMs = 60 * 60_000;
    private long emptyGameGraceMs = 120_000;
    private long botDelayMs = 1_000;

    private int victoryThreshold = 41;
    private int minBet = 7;
    private int maxBet = 12;
    private int redZeroPoints = 5;
    private int brownZeroPoints = -3;

    public RuleSet ruleSet() {
        return new RuleSet(minBet, maxBet, victoryThreshold, redZeroPoints, brownZeroPoints);
    }
}
