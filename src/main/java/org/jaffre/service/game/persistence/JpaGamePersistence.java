package org.jaffre.service.game.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaffre.exception.GamePersistenceException;
import org.jaffre.model.game.FinishedGameEntity;
import org.jaffre.model.game.GamePhase;
import org.jaffre.model.game.GameSession;
import org.jaffre.model.game.GameSnapshotEntity;
import org.jaffre.repo.FinishedGameRepository;
import org.jaffre.repo.GameSnapshotRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sauvegarde des parties en JSON dans la base. Les écritures sont « au mieux » :
 * un échec est journalisé, l'état en mémoire reste la référence.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaGamePersistence implements GamePersistence {

    private static final List<String> ACTIVE_PHASES = List.of(
            GamePhase.TEAM_SELECTION.name(), GamePhase.BETTING.name(),
            GamePhase.PLAYING.name(), GamePhase.SCORING.name());

    private final GameSnapshotRepository snapshots;
    private final FinishedGameRepository finished;
    private final ObjectMapper mapper;

    @Override
    public Optional<GameSession> loadGame(String gameId) {
        try {
            return snapshots.findById(gameId).map(this::read);
        } catch (RuntimeException ex) {
            throw new GamePersistenceException("Lecture impossible de la partie " + gameId, ex);
        }
    }

    @Override
    public void saveGame(GameSession session) {
        try {
            GameSnapshotEntity e = snapshots.findById(session.getId()).orElseGet(GameSnapshotEntity::new);
            e.setId(session.getId());
            e.setPhase(session.getPhase().name());
            e.setStateJson(mapper.writeValueAsString(session));
            if (e.getCreatedAt() == null) e.setCreatedAt(Instant.ofEpochMilli(session.getCreatedAt()));
            e.setUpdatedAt(Instant.now());
            snapshots.save(e);
        } catch (JsonProcessingException | RuntimeException ex) {
            log.warn("Sauvegarde de la partie {} échouée", session.getId(), ex);
        }
    }

    @Override
    public void deleteGame(String gameId) {
        try {
            if (snapshots.existsById(gameId)) snapshots.deleteById(gameId);
        } catch (RuntimeException ex) {
            log.warn("Suppression de la partie {} échouée", gameId, ex);
        }
    }

    @Override
    public void appendFinishedGame(FinishedGameSummary summary) {
        try {
            FinishedGameEntity e = new FinishedGameEntity();
            e.setGameId(summary.gameId());
            e.setWinningTeam(summary.winningTeam());
            e.setTeam1Score(summary.team1Score());
            e.setTeam2Score(summary.team2Score());
            e.setRounds(summary.rounds());
            e.setPlayers(String.join(",", summary.players()));
            e.setStartedAt(Instant.ofEpochMilli(summary.startedAt()));
            e.setFinishedAt(Instant.ofEpochMilli(summary.finishedAt()));
            finished.save(e);
        } catch (RuntimeException ex) {
            log.warn("Archivage de la partie {} échoué", summary.gameId(), ex);
        }
    }

    @Override
    public List<GameSession> loadActiveSnapshots() {
        List<GameSession> out = new ArrayList<>();
        for (GameSnapshotEntity e : snapshots.findByPhaseIn(ACTIVE_PHASES)) {
            try {
                out.add(read(e));
            } catch (GamePersistenceException ex) {
                log.warn("Instantané illisible ignoré : {}", e.getId(), ex);
            }
        }
        return out;
    }

    private GameSession read(GameSnapshotEntity e) {
        try {
            return mapper.readValue(e.getStateJson(), GameSession.class);
        } catch (JsonProcessingException ex) {
            throw new GamePersistenceException("Instantané corrompu pour la partie " + e.getId(), ex);
        }
    }
}
