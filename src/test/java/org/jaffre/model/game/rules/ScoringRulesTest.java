package org.jaffre.model.game.rules;

import org.jaffre.model.game.TeamScores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ScoringRulesTest {

    RuleSet rules = RuleSet.defaults();

    @Test
    void score_contratReussi_marqueLAnnonce() {
        ScoringRules.Outcome o = ScoringRules.score(7, false, 8, 2);

        assertThat(o.betMade()).isTrue();
        assertThat(o.offenseDelta()).isEqualTo(7);
        assertThat(o.defenseDelta()).isEqualTo(2);
    }

    @Test
    void score_sansAtoutChute_perdLeDouble() {
        ScoringRules.Outcome o = ScoringRules.score(10, true, 8, 2);

        assertThat(o.betMade()).isFalse();
        assertThat(o.offenseDelta()).isEqualTo(-20);
        assertThat(o.defenseDelta()).isEqualTo(2);
    }

    @Test
    void score_defenseNegative_perdSesPoints() {
        ScoringRules.Outcome o = ScoringRules.score(7, false, 12, -2);

        assertThat(o.defenseDelta()).isEqualTo(-2);
    }

    @Test
    void winner_seuilAtteint() {
        assertThat(ScoringRules.winner(new TeamScores(44, 10), 1, rules)).isEqualTo(1);
        assertThat(ScoringRules.winner(new TeamScores(40, 10), 1, rules)).isNull();
        assertThat(ScoringRules.winner(new TeamScores(5, 41), 1, rules)).isEqualTo(2);
    }

    @Test
    void winner_lesDeuxAuSeuil_plusHautScore_puisAttaque() {
        assertThat(ScoringRules.winner(new TeamScores(45, 42), 2, rules)).isEqualTo(1);
        assertThat(ScoringRules.winner(new TeamScores(43, 43), 2, rules)).isEqualTo(2);
    }

    @Test
    void opponent() {
        assertThat(ScoringRules.opponent(1)).isEqualTo(2);
        assertThat(ScoringRules.opponent(2)).isEqualTo(1);
    }
}
