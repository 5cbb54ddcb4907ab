package org.jaffre.dto.game;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/** kick_player et replace_with_bot. */
@Data
public class SeatTargetMsg {
    @NotBlank
    private String gameId;
    @NotBlank
    private String seatName;
}
