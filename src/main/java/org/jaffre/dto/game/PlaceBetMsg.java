package org.jaffre.dto.game;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PlaceBetMsg {
    @NotBlank
    private String gameId;
    private int amount;           // ignoré si skipped
    private boolean withoutTrump;
    private boolean skipped;
}
