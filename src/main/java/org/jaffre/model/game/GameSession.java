package org.jaffre.model.game;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * État complet d'une partie. Les sièges sont identifiés par leur nom ;
 * l'identifiant de connexion n'est qu'une adresse de livraison.
 */
@Data
@NoArgsConstructor
public class GameSession {
    public static final int SEATS = 4;
    public static final int SEATS_PER_TEAM = 2;

    private String id;
    private GamePhase phase = GamePhase.TEAM_SELECTION;
    private List<Seat> seats = new ArrayList<>();

    private int dealerIndex;
    private int currentSeatIndex;
    private Card.Color trump;

    private List<Bet> currentBets = new ArrayList<>();
    private Bet highestBet;

    private List<TrickCard> currentTrick = new ArrayList<>();
    private TrickResult previousTrick;
    private List<TrickResult> currentRoundTricks = new ArrayList<>();

    private TeamScores teamScores = new TeamScores();
    private int roundNumber;
    private List<RoundRecord> roundHistory = new ArrayList<>();

    private List<String> playersReady = new ArrayList<>();
    private List<String> rematchVotes = new ArrayList<>();

    private String creatorName;
    private long createdAt;
    private long lastActiveAt;
    // avance à chaque changement de joueur actif, sert de garde aux minuteurs
    private long turnSequence;
    private Integer winningTeam;

    public GameSession(String id, long now) {
        this.id = id;
        this.createdAt = now;
        this.lastActiveAt = now;
    }

    public Optional<Seat> findSeat(String name) {
        if (name == null) return Optional.empty();
        return seats.stream().filter(s -> name.equals(s.getName())).findFirst();
    }

    public Optional<Seat> findSeatByConnection(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return seats.stream().filter(s -> connectionId.equals(s.getConnectionId())).findFirst();
    }

    public int seatIndexOf(String name) {
        for (int i = 0; i < seats.size(); i++) {
            if (seats.get(i).getName().equals(name)) return i;
        }
        return -1;
    }

    public Seat actingSeat() {
        return seats.get(currentSeatIndex);
    }

    public Seat dealer() {
        return seats.get(dealerIndex);
    }

    public long teamSize(int teamId) {
        return seats.stream().filter(s -> s.getTeamId() == teamId).count();
    }

    public boolean inPlay() {
        return phase == GamePhase.BETTING || phase == GamePhase.PLAYING || phase == GamePhase.SCORING;
    }

    public void nextTurn(int seatIndex) {
        currentSeatIndex = seatIndex;
        turnSequence++;
    }

    public static int after(int index) {
        return (index + 1) % SEATS;
    }
}
