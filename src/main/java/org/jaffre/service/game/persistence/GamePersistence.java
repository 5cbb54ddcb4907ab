package org.jaffre.service.game.persistence;

import org.jaffre.model.game.GameSession;

import java.util.List;
import java.util.Optional;

public interface GamePersistence {
    Optional<GameSession> loadGame(String gameId);
    void saveGame(GameSession session);
    void deleteGame(String gameId);
    void appendFinishedGame(FinishedGameSummary summary);
    List<GameSession> loadActiveSnapshots();
}
