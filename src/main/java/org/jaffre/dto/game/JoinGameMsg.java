package org.jaffre.dto.game;

import jakarta.validation.constraints.*;
import lombok.Data;

@Data
public class JoinGameMsg {
    @NotBlank
    private String gameId;
    @NotBlank
    @Size(max = 20)
    private String playerName;
}
