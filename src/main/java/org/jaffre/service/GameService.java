package org.jaffre.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaffre.config.GameProperties;
import org.jaffre.dto.game.GameCommand;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.dto.game.GameSummaryDTO;
import org.jaffre.exception.GameValidationException;
import org.jaffre.model.game.GamePhase;
import org.jaffre.model.game.GameSession;
import org.jaffre.model.game.Seat;
import org.jaffre.service.game.broadcast.DeltaBroadcaster;
import org.jaffre.service.game.broadcast.GameEventPublisher;
import org.jaffre.service.game.continuity.ConnectionContinuityService;
import org.jaffre.service.game.engine.GameReducer;
import org.jaffre.service.game.engine.RoundEngine;
import org.jaffre.service.game.engine.Transition;
import org.jaffre.service.game.identity.ReconnectionTokenService;
import org.jaffre.service.game.registry.GameRegistry;
import org.jaffre.service.game.util.Locks;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Point d'entrée des commandes joueur. Chaque commande est sérialisée par le
 * verrou de sa partie puis passe par le réducteur et le moteur de manche.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private final GameRegistry registry;
    private final GameReducer reducer;
    private final RoundEngine engine;
    private final ConnectionContinuityService continuity;
    private final ReconnectionTokenService tokens;
    private final DeltaBroadcaster broadcaster;
    private final GameEventPublisher publisher;
    private final Locks locks;
    private final GameProperties props;

    @PostConstruct
    void wireHydration() {
        registry.setHydrationListener(this::recover);
    }

    // ------------------------------------------------------------ lobby

    public GameSession createGame(String connectionId, String playerName) {
        String id = registry.newId();
        synchronized (locks.of(id)) {
            GameSession g = reducer.create(id, playerName, connectionId, now());
            registry.put(g);
            String name = g.getCreatorName();
            continuity.bind(connectionId, id, name);
            publisher.toConnection(connectionId, GameEventType.GAME_CREATED, id,
                    Map.of("gameId", id, "playerName", name));
            continuity.issueToken(g, name, connectionId);
            broadcaster.broadcast(g, true);
            log.info("Partie {} créée par {}", id, name);
            return g;
        }
    }

    public GameSession joinGame(String connectionId, String gameId, String playerName) {
        synchronized (locks.of(gameId)) {
            GameSession g = registry.get(gameId);
            Transition t = reducer.apply(g, null, connectionId,
                    new GameCommand.JoinGame(gameId, playerName), now());
            continuity.bind(connectionId, gameId, t.getJoinedSeat());
            continuity.issueToken(g, t.getJoinedSeat(), connectionId);
            engine.afterTransition(g, t);
            continuity.checkEmpty(g);
            return g;
        }
    }

    public GameSession takeOverBot(String connectionId, String gameId, String botName, String playerName) {
        synchronized (locks.of(gameId)) {
            GameSession g = registry.get(gameId);
            Transition t = reducer.apply(g, null, connectionId,
                    new GameCommand.TakeOverBot(gameId, botName, playerName), now());
            continuity.bind(connectionId, gameId, t.getJoinedSeat());
            continuity.issueToken(g, t.getJoinedSeat(), connectionId);
            engine.afterTransition(g, t);
            continuity.afterSeatChanges(g, t);
            broadcaster.sendFullTo(g, connectionId);
            return g;
        }
    }

    public GameSession reconnect(String connectionId, String token) {
        return continuity.reconnect(token, connectionId);
    }

    // ------------------------------------------------------------ en partie

    /** Commande d'un joueur assis ; l'auteur est retrouvé par sa connexion. */
    public void handle(String connectionId, String gameId, GameCommand command) {
        synchronized (locks.of(gameId)) {
            GameSession g = registry.get(gameId);
            String actor = g.findSeatByConnection(connectionId)
                    .map(Seat::getName)
                    .orElseThrow(() -> new GameValidationException("Vous n'êtes pas dans cette partie"));
            Transition t = reducer.apply(g, actor, connectionId, command, now());
            engine.afterTransition(g, t);
            if (t.seatsChanged()) continuity.afterSeatChanges(g, t);
        }
    }

    public void disconnect(String connectionId) {
        continuity.onDisconnect(connectionId);
    }

    // ------------------------------------------------------------ lecture

    public List<GameSummaryDTO> listJoinableGames() {
        List<GameSummaryDTO> out = new ArrayList<>();
        for (GameSession g : registry.all()) {
            if (g.getPhase() != GamePhase.TEAM_SELECTION || g.getSeats().size() >= GameSession.SEATS) continue;
            out.add(summary(g));
        }
        out.sort(Comparator.comparing(GameSummaryDTO::getId));
        return out;
    }

    public GameSummaryDTO getSummary(String gameId) {
        return summary(registry.get(gameId));
    }

    private GameSummaryDTO summary(GameSession g) {
        synchronized (locks.of(g.getId())) {
            return new GameSummaryDTO(
                    g.getId(),
                    g.getPhase(),
                    g.getCreatorName(),
                    g.getSeats().stream().map(Seat::getName).toList(),
                    g.getSeats().size(),
                    g.getTeamScores().getTeam1(),
                    g.getTeamScores().getTeam2(),
                    g.getRoundNumber());
        }
    }

    // ------------------------------------------------------------ maintenance

    @EventListener(ApplicationReadyEvent.class)
    public void recoverGames() {
        for (GameSession g : new ArrayList<>(registry.all())) recover(g);
    }

    /** Partie relue depuis la base : joueurs marqués déconnectés, minuteurs réarmés. */
    void recover(GameSession g) {
        synchronized (locks.of(g.getId())) {
            continuity.markAllDisconnected(g);
            engine.rearm(g);
            log.info("Partie {} reprise en phase {}", g.getId(), g.getPhase());
        }
    }

    @Scheduled(fixedRateString = "${jaffre.game.stale-sweep-ms:3600000}",
            initialDelayString = "${jaffre.game.stale-sweep-ms:3600000}")
    public void sweepStaleGames() {
        long now = now();
        List<String> stale = new ArrayList<>();
        for (GameSession g : registry.all()) {
            if (now - g.getLastActiveAt() > props.getStaleGameMs()) stale.add(g.getId());
        }
        for (String id : stale) {
            synchronized (locks.of(id)) {
                GameSession g = registry.cached(id).orElse(null);
                if (g == null || now - g.getLastActiveAt() <= props.getStaleGameMs()) continue;
                engine.closeGame(id, "inactive");
                continuity.forgetGame(id);
            }
        }
        int purged = tokens.purgeExpired();
        if (!stale.isEmpty() || purged > 0) {
            log.info("Balayage : {} partie(s) inactive(s) fermée(s), {} jeton(s) expiré(s)", stale.size(), purged);
        }
    }

    @PreDestroy
    public void flushAll() {
        for (GameSession g : registry.all()) {
            synchronized (locks.of(g.getId())) {
                broadcaster.saveNow(g);
            }
        }
    }

    private long now() { return System.currentTimeMillis(); }
}
