package org.jaffre.service.game.continuity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaffre.config.GameProperties;
import org.jaffre.dto.game.GameCommand;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.exception.GameNotFoundException;
import org.jaffre.exception.GameSecurityException;
import org.jaffre.exception.GameValidationException;
import org.jaffre.model.game.ConnectionStatus;
import org.jaffre.model.game.GamePhase;
import org.jaffre.model.game.GameSession;
import org.jaffre.model.game.Seat;
import org.jaffre.service.game.broadcast.DeltaBroadcaster;
import org.jaffre.service.game.broadcast.GameEventPublisher;
import org.jaffre.service.game.engine.GameReducer;
import org.jaffre.service.game.engine.RoundEngine;
import org.jaffre.service.game.engine.Transition;
import org.jaffre.service.game.identity.ReconnectionSession;
import org.jaffre.service.game.identity.ReconnectionTokenService;
import org.jaffre.service.game.registry.GameRegistry;
import org.jaffre.service.game.util.Locks;
import org.jaffre.service.game.util.ScheduledEvents;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Continuité des sièges quand les connexions tombent et reviennent : délai de
 * grâce, reconnexion par jeton, conséquences d'un départ.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionContinuityService {
    private final GameRegistry registry;
    private final GameReducer reducer;
    private final RoundEngine engine;
    private final ReconnectionTokenService tokens;
    private final DeltaBroadcaster broadcaster;
    private final GameEventPublisher publisher;
    private final ScheduledEvents events;
    private final Locks locks;
    private final GameProperties props;

    public record SeatRef(String gameId, String seatName) {}

    // connexion STOMP -> siège, pour retrouver la partie à la déconnexion
    private final Map<String, SeatRef> connections = new ConcurrentHashMap<>();

    public void bind(String connectionId, String gameId, String seatName) {
        if (connectionId != null) connections.put(connectionId, new SeatRef(gameId, seatName));
    }

    public void unbind(String connectionId) {
        if (connectionId != null) connections.remove(connectionId);
    }

    public SeatRef seatOf(String connectionId) {
        return connections.get(connectionId);
    }

    /** Émet un nouveau jeton pour le siège et l'envoie à sa connexion. */
    public void issueToken(GameSession g, String seatName, String connectionId) {
        String token = tokens.issue(g.getId(), seatName);
        publisher.toConnection(connectionId, GameEventType.RECONNECTION_TOKEN, g.getId(),
                Map.of("token", token, "gameId", g.getId(), "playerName", seatName));
    }

    // ---------------------------------------------------------------- reconnexion

    public GameSession reconnect(String token, String connectionId) {
        ReconnectionSession rs = tokens.validate(token);
        synchronized (locks.of(rs.gameId())) {
            GameSession g = registry.find(rs.gameId()).orElseThrow(() -> {
                tokens.invalidate(rs.gameId(), rs.seatName());
                return new GameNotFoundException("La partie n'existe plus");
            });
            if (g.getPhase() == GamePhase.GAME_OVER) {
                tokens.invalidate(rs.gameId(), rs.seatName());
                throw new GameValidationException("La partie est terminée");
            }
            Seat seat = g.findSeat(rs.seatName()).orElse(null);
            if (seat == null || seat.isBot()) {
                tokens.invalidate(rs.gameId(), rs.seatName());
                throw new GameSecurityException("Votre siège a été attribué à un bot");
            }

            String previous = seat.getConnectionId();
            if (previous != null && !previous.equals(connectionId)) unbind(previous);
            SeatReferences.rebindConnection(g, seat.getName(), connectionId);
            seat.setConnectionStatus(ConnectionStatus.CONNECTED);
            seat.setDisconnectedAt(null);
            bind(connectionId, g.getId(), seat.getName());

            events.cancel(g.getId(), ScheduledEvents.RECONNECT_GRACE, seat.getName());
            events.cancel(g.getId(), ScheduledEvents.EMPTY_GAME, null);
            engine.resumeTurn(g);

            String fresh = tokens.rotate(rs);
            publisher.toConnection(connectionId, GameEventType.RECONNECTION_TOKEN, g.getId(),
                    Map.of("token", fresh, "gameId", g.getId(), "playerName", seat.getName()));
            publisher.toGame(g.getId(), GameEventType.PLAYER_RECONNECTED, Map.of("playerName", seat.getName()));
            broadcaster.sendFullTo(g, connectionId);
            broadcaster.broadcast(g, false);
            log.info("{} reconnecté à la partie {}", seat.getName(), g.getId());
            return g;
        }
    }

    // ---------------------------------------------------------------- déconnexion

    public void onDisconnect(String connectionId) {
        SeatRef ref = connections.remove(connectionId);
        if (ref == null) return;
        synchronized (locks.of(ref.gameId())) {
            GameSession g = registry.cached(ref.gameId()).orElse(null);
            if (g == null) return;
            Seat seat = g.findSeat(ref.seatName()).orElse(null);
            // siège déjà repris par une connexion plus récente
            if (seat == null || seat.isBot() || !Objects.equals(seat.getConnectionId(), connectionId)) return;

            seat.setConnectionStatus(ConnectionStatus.DISCONNECTED);
            seat.setDisconnectedAt(System.currentTimeMillis());
            String seatName = seat.getName();
            events.schedule(g.getId(), ScheduledEvents.RECONNECT_GRACE, seatName, props.getReconnectGraceMs(),
                    () -> onGraceExpired(ref.gameId(), seatName, connectionId));
            publisher.toGame(g.getId(), GameEventType.PLAYER_DISCONNECTED, Map.of("playerName", seatName));
            broadcaster.broadcast(g, false);
            checkEmpty(g);
            log.info("{} déconnecté de la partie {}", seatName, g.getId());
        }
    }

    /** Sans retour dans le délai : mêmes conséquences qu'un départ volontaire. */
    void onGraceExpired(String gameId, String seatName, String connectionId) {
        synchronized (locks.of(gameId)) {
            GameSession g = registry.cached(gameId).orElse(null);
            if (g == null) return;
            Seat seat = g.findSeat(seatName).orElse(null);
            if (seat == null || seat.isBot() || seat.getConnectionStatus() != ConnectionStatus.DISCONNECTED) return;
            if (!Objects.equals(seat.getConnectionId(), connectionId)) return;

            log.info("Délai de reconnexion écoulé pour {} dans la partie {}", seatName, gameId);
            Transition t = reducer.apply(g, seatName, connectionId, new GameCommand.LeaveGame(gameId),
                    System.currentTimeMillis());
            engine.afterTransition(g, t);
            afterSeatChanges(g, t);
        }
    }

    // ---------------------------------------------------------------- sièges

    /**
     * Suites d'un changement de sièges : jetons, index des connexions, partie vide.
     * Sous verrou.
     */
    public void afterSeatChanges(GameSession g, Transition t) {
        if (t.getRemovedSeat() != null) {
            tokens.invalidate(g.getId(), t.getRemovedSeat());
            events.cancel(g.getId(), ScheduledEvents.RECONNECT_GRACE, t.getRemovedSeat());
            unbind(t.getRemovedConnectionId());
            if (t.isKicked()) {
                publisher.toConnection(t.getRemovedConnectionId(), GameEventType.PLAYER_KICKED, g.getId(),
                        Map.of("playerName", t.getRemovedSeat()));
            }
        }
        if (t.getBotifiedSeat() != null) {
            tokens.invalidate(g.getId(), t.getBotifiedSeat());
            events.cancel(g.getId(), ScheduledEvents.RECONNECT_GRACE, t.getBotifiedSeat());
            unbind(t.getBotifiedConnectionId());
        }
        if (t.getTakenOverBot() != null) {
            tokens.invalidate(g.getId(), t.getTakenOverBot());
        }
        if (g.getSeats().isEmpty()) {
            engine.closeGame(g.getId(), "plus aucun joueur");
            return;
        }
        checkEmpty(g);
    }

    /** Sans humain connecté, la partie est supprimée après un délai. Sous verrou. */
    public void checkEmpty(GameSession g) {
        boolean anyConnected = g.getSeats().stream().anyMatch(Seat::connectedHuman);
        if (anyConnected) {
            events.cancel(g.getId(), ScheduledEvents.EMPTY_GAME, null);
            return;
        }
        if (events.isScheduled(g.getId(), ScheduledEvents.EMPTY_GAME, null)) return;
        String gameId = g.getId();
        events.schedule(gameId, ScheduledEvents.EMPTY_GAME, null, props.getEmptyGameGraceMs(), () -> {
            synchronized (locks.of(gameId)) {
                GameSession current = registry.cached(gameId).orElse(null);
                if (current == null) return;
                if (current.getSeats().stream().anyMatch(Seat::connectedHuman)) return;
                engine.closeGame(gameId, "aucun joueur connecté");
            }
        });
    }

    /** Partie relue au démarrage : toutes les connexions d'avant sont perdues. Sous verrou. */
    public void markAllDisconnected(GameSession g) {
        long now = System.currentTimeMillis();
        for (Seat seat : g.getSeats()) {
            if (seat.isBot()) continue;
            seat.setConnectionStatus(ConnectionStatus.DISCONNECTED);
            if (seat.getDisconnectedAt() == null) seat.setDisconnectedAt(now);
            String seatName = seat.getName();
            String connectionId = seat.getConnectionId();
            events.schedule(g.getId(), ScheduledEvents.RECONNECT_GRACE, seatName, props.getReconnectGraceMs(),
                    () -> onGraceExpired(g.getId(), seatName, connectionId));
        }
        checkEmpty(g);
    }

    public void forgetGame(String gameId) {
        connections.values().removeIf(r -> r.gameId().equals(gameId));
    }
}
