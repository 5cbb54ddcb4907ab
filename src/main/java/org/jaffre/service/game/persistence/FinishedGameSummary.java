package org.jaffre.service.game.persistence;

import org.jaffre.model.game.GameSession;

import java.util.List;

public record FinishedGameSummary(String gameId, Integer winningTeam, int team1Score, int team2Score,
                                  int rounds, List<String> players, long startedAt, long finishedAt) {

    public static FinishedGameSummary of(GameSession g, long finishedAt) {
        return new FinishedGameSummary(
                g.getId(),
                g.getWinningTeam(),
                g.getTeamScores().getTeam1(),
                g.getTeamScores().getTeam2(),
                g.getRoundHistory().size(),
                g.getSeats().stream().map(s -> s.getName() + ":" + s.getTeamId()).toList(),
                g.getCreatedAt(),
                finishedAt);
    }
}
