package org.jaffre.dto.game;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.jaffre.model.game.GamePhase;

import java.util.List;

/** Vue lobby d'une partie. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameSummaryDTO {
    private String id;
    private GamePhase phase;
    private String creatorName;
    private List<String> players;
    private int seatsTaken;
    private int team1Score;
    private int team2Score;
    private int roundNumber;
}
