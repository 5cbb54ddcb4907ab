package org.jaffre.model.game;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class Seat {
    private String name;            // clé durable du siège
    private String connectionId;    // session STOMP courante, peut changer
    private int teamId;
    private List<Card> hand = new ArrayList<>();
    private int tricksWon;
    private int pointsWon;
    private boolean bot;
    private ConnectionStatus connectionStatus = ConnectionStatus.CONNECTED;
    private Long disconnectedAt;

    public Seat(String name, String connectionId, int teamId) {
        this.name = name;
        this.connectionId = connectionId;
        this.teamId = teamId;
    }

    public static Seat bot(String name, int teamId) {
        Seat s = new Seat(name, null, teamId);
        s.setBot(true);
        return s;
    }

    public boolean connectedHuman() {
        return !bot && connectionStatus == ConnectionStatus.CONNECTED;
    }

    public void resetForNextRound() {
        hand = new ArrayList<>();
        tricksWon = 0;
        pointsWon = 0;
    }
}
