package org.jaffre.dto.game;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ReconnectMsg {
    @NotBlank
    private String token;
}
