package org.jaffre.dto.game;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SwapPositionMsg {
    @NotBlank
    private String gameId;
    @NotBlank
    private String targetName;
}
