package org.jaffre.model.game;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrickCard {
    private String seatName;
    private String connectionId;
    private Card card;
    private int order;
}
