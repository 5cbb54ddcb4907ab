package org.jaffre.model.game.rules;

import org.jaffre.model.game.TeamScores;

public final class ScoringRules {
    private ScoringRules(){}

    public record Outcome(int offenseDelta, int defenseDelta, boolean betMade) {}

    /**
     * Contrat réussi : l'attaque marque l'annonce, sinon elle la perd ; doublé sans atout.
     * La défense marque toujours ses propres points.
     */
    public static Outcome score(int betAmount, boolean withoutTrump, int offensePoints, int defensePoints) {
        int multiplier = withoutTrump ? 2 : 1;
        boolean made = offensePoints >= betAmount;
        int offense = (made ? betAmount : -betAmount) * multiplier;
        return new Outcome(offense, defensePoints, made);
    }

    /**
     * Équipe gagnante après une manche, ou null. Si les deux équipes atteignent le seuil,
     * le plus haut score gagne, l'attaque à égalité.
     */
    public static Integer winner(TeamScores scores, int offenseTeam, RuleSet rules) {
        boolean t1 = scores.getTeam1() >= rules.victoryThreshold();
        boolean t2 = scores.getTeam2() >= rules.victoryThreshold();
        if (!t1 && !t2) return null;
        if (t1 && !t2) return 1;
        if (t2 && !t1) return 2;
        if (scores.getTeam1() != scores.getTeam2()) return scores.getTeam1() > scores.getTeam2() ? 1 : 2;
        return offenseTeam;
    }

    public static int opponent(int teamId) {
        return teamId == 1 ? 2 : 1;
    }
}
