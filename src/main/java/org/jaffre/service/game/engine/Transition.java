package org.jaffre.service.game.engine;

import lombok.Data;
import org.jaffre.dto.game.GameEvent;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.model.game.GamePhase;

import java.util.ArrayList;
import java.util.List;

/**
 * Résultat d'une commande appliquée : ce qui a changé et ce qu'il reste à faire
 * côté minuteurs et diffusion.
 */
@Data
public class Transition {
    private final String gameId;
    private final GamePhase from;
    private final List<GameEvent> events = new ArrayList<>();

    private boolean turnChanged;
    private boolean trickCompleted;
    private boolean roundStarted;
    private boolean roundScored;
    private boolean gameOver;
    private boolean rematchStarted;
    private boolean forceFull;
    private boolean kicked;

    private String joinedSeat;
    private String removedSeat;
    private String removedConnectionId;
    private String botifiedSeat;
    private String botifiedConnectionId;
    private String takenOverBot;

    public static Transition of(String gameId, GamePhase from) {
        return new Transition(gameId, from);
    }

    public void emit(GameEventType type, Object payload) {
        events.add(GameEvent.of(type, gameId, payload));
    }

    public boolean seatsChanged() {
        return joinedSeat != null || removedSeat != null || botifiedSeat != null || takenOverBot != null;
    }
}
