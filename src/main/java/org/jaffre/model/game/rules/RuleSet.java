package org.jaffre.model.game.rules;

/** Constantes de règles qu'une partie peut surcharger. */
public record RuleSet(int minBet, int maxBet, int victoryThreshold, int redZeroPoints, int brownZeroPoints) {

    public static RuleSet defaults() {
        return new RuleSet(7, 12, 41, 5, -3);
    }

    /** Somme des cartes spéciales du paquet, identique à chaque donne. */
    public int pointPool() {
        return redZeroPoints + brownZeroPoints;
    }
}
