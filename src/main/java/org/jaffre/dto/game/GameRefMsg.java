package org.jaffre.dto.game;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/** start_game, add_bot, player_ready, vote_rematch, leave_game. */
@Data
public class GameRefMsg {
    @NotBlank
    private String gameId;
}
