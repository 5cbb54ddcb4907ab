package org.jaffre.dto.game;

import jakarta.validation.constraints.*;
import lombok.Data;
import org.jaffre.model.game.Card;

@Data
public class PlayCardMsg {
    @NotBlank
    private String gameId;
    @NotNull
    private Card.Color color;
    @Min(0) @Max(7)
    private int value;
}
