package org.jaffre.model.game;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TeamScores {
    private int team1;
    private int team2;

    public int of(int teamId) {
        return teamId == 1 ? team1 : team2;
    }

    public void add(int teamId, int delta) {
        if (teamId == 1) team1 += delta;
        else team2 += delta;
    }

    public TeamScores copy() {
        return new TeamScores(team1, team2);
    }
}
