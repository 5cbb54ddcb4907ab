package org.jaffre.dto.game;

import jakarta.validation.constraints.*;
import lombok.Data;

@Data
public class TakeOverBotMsg {
    @NotBlank
    private String gameId;
    @NotBlank
    private String botName;
    @NotBlank
    @Size(max = 20)
    private String playerName;
}
