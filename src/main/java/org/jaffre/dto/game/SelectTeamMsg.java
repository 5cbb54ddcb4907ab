package org.jaffre.dto.game;

import jakarta.validation.constraints.*;
import lombok.Data;

@Data
public class SelectTeamMsg {
    @NotBlank
    private String gameId;
    @Min(1) @Max(2)
    private int teamId;
}
