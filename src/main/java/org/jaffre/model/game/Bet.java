package org.jaffre.model.game;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Bet {
    private String seatName;
    private String connectionId;
    private int amount;
    private boolean withoutTrump;
    private boolean skipped;

    public static Bet skip(String seatName, String connectionId) {
        return new Bet(seatName, connectionId, 0, false, true);
    }

    public static Bet of(String seatName, String connectionId, int amount, boolean withoutTrump) {
        return new Bet(seatName, connectionId, amount, withoutTrump, false);
    }
}
