package org.jaffre.model.game;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Entrée de l'historique : une manche jouée et son résultat. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoundRecord {
    private int roundNumber;
    private String bettorName;
    private int bettorTeam;
    private int betAmount;
    private boolean withoutTrump;
    private int offensePoints;
    private int defensePoints;
    private boolean betMade;
    private int team1Delta;
    private int team2Delta;
    private TeamScores scoresAfter;
    private List<SeatStats> seatStats;

    public record SeatStats(String name, int teamId, int tricks, int points) {}
}
