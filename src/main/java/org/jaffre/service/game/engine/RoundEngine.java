package org.jaffre.service.game.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaffre.config.GameProperties;
import org.jaffre.dto.game.GameCommand;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.exception.GameException;
import org.jaffre.model.game.*;
import org.jaffre.model.game.rules.BettingRules;
import org.jaffre.service.game.bot.BotStrategy;
import org.jaffre.service.game.broadcast.DeltaBroadcaster;
import org.jaffre.service.game.broadcast.GameEventPublisher;
import org.jaffre.service.game.clock.TurnClock;
import org.jaffre.service.game.identity.ReconnectionTokenService;
import org.jaffre.service.game.persistence.FinishedGameSummary;
import org.jaffre.service.game.persistence.GamePersistence;
import org.jaffre.service.game.registry.GameRegistry;
import org.jaffre.service.game.util.Locks;
import org.jaffre.service.game.util.ScheduledEvents;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effets de bord d'une transition : diffusion, minuteurs de tour, pli affiché,
 * passage automatique à la manche suivante, coups des bots.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundEngine {
    private final GameRegistry registry;
    private final GameReducer reducer;
    private final TurnClock clock;
    private final ScheduledEvents events;
    private final DeltaBroadcaster broadcaster;
    private final GameEventPublisher publisher;
    private final BotStrategy bots;
    private final GamePersistence persistence;
    private final ReconnectionTokenService tokens;
    private final Locks locks;
    private final GameProperties props;

    /** Appelé sous le verrou de la partie, juste après {@link GameReducer#apply}. */
    public void afterTransition(GameSession g, Transition t) {
        String id = g.getId();
        t.getEvents().forEach(publisher::toGame);

        if (t.isTrickCompleted()) {
            clock.stop(id);
            events.cancelPurpose(id, ScheduledEvents.BOT);
            events.schedule(id, ScheduledEvents.CLEAR_TRICK, null, props.getTrickRevealMs(),
                    () -> runInternal(id, new GameCommand.ClearTrick(id)));
        }
        if (t.isRoundStarted()) events.cancel(id, ScheduledEvents.NEXT_ROUND, null);
        if (t.isRoundScored() && g.getPhase() == GamePhase.SCORING) {
            events.schedule(id, ScheduledEvents.NEXT_ROUND, null, props.getScoringAutoAdvanceMs(),
                    () -> runInternal(id, new GameCommand.StartNextRound(id)));
        }
        if (t.isGameOver()) {
            persistence.appendFinishedGame(FinishedGameSummary.of(g, now()));
            log.info("Partie {} terminée, équipe {} gagnante ({} - {})", id, g.getWinningTeam(),
                    g.getTeamScores().getTeam1(), g.getTeamScores().getTeam2());
        }

        if (g.getPhase() != GamePhase.BETTING && g.getPhase() != GamePhase.PLAYING) {
            clock.stop(id);
            events.cancelPurpose(id, ScheduledEvents.BOT);
        } else if (t.isTurnChanged()) {
            armTurn(g);
        }

        broadcaster.broadcast(g, t.isForceFull());
    }

    /** (Ré)arme le délai du siège actif ; un bot joue après un court délai. */
    public void armTurn(GameSession g) {
        events.cancelPurpose(g.getId(), ScheduledEvents.BOT);
        if (g.getPhase() == GamePhase.PLAYING && g.getCurrentTrick().size() >= GameSession.SEATS) return;
        TurnClock.Deadline d = clock.start(g, this::onTurnTimeout);
        scheduleBotMove(g, d);
    }

    /** Reprise après reconnexion ou redémarrage : garde l'échéance en cours. */
    public void resumeTurn(GameSession g) {
        if (g.getPhase() != GamePhase.BETTING && g.getPhase() != GamePhase.PLAYING) return;
        if (g.getPhase() == GamePhase.PLAYING && g.getCurrentTrick().size() >= GameSession.SEATS) return;
        TurnClock.Deadline d = clock.resume(g, this::onTurnTimeout);
        scheduleBotMove(g, d);
    }

    private void scheduleBotMove(GameSession g, TurnClock.Deadline d) {
        Seat acting = g.actingSeat();
        if (!acting.isBot()) return;
        events.schedule(g.getId(), ScheduledEvents.BOT, acting.getName(), props.getBotDelayMs(),
                () -> autoAct(d, false));
    }

    void onTurnTimeout(TurnClock.Deadline d) {
        autoAct(d, true);
    }

    /**
     * Action par défaut du siège visé par l'échéance. Sans effet si ce siège a
     * déjà joué entre-temps.
     */
    void autoAct(TurnClock.Deadline d, boolean timedOut) {
        synchronized (locks.of(d.gameId())) {
            GameSession g = registry.cached(d.gameId()).orElse(null);
            if (g == null || !d.stillCurrent(g)) return;
            if (g.getPhase() == GamePhase.PLAYING && g.getCurrentTrick().size() >= GameSession.SEATS) return;

            Seat seat = g.actingSeat();
            GameCommand cmd;
            Map<String, Object> action = new LinkedHashMap<>();
            action.put("playerName", seat.getName());
            if (g.getPhase() == GamePhase.BETTING) {
                boolean isDealer = g.getCurrentSeatIndex() == g.getDealerIndex();
                Bet bet = BettingRules.defaultBet(seat.getName(), seat.getConnectionId(), isDealer,
                        g.getCurrentBets(), props.ruleSet());
                cmd = new GameCommand.PlaceBet(g.getId(), bet.getAmount(), bet.isWithoutTrump(), bet.isSkipped());
                action.put("action", bet.isSkipped() ? "skip" : "bet");
                action.put("amount", bet.getAmount());
            } else {
                Card card = bots.selectCard(g, seat.getName());
                cmd = new GameCommand.PlayCard(g.getId(), card);
                action.put("action", "play_card");
                action.put("card", card);
            }

            Transition t = reducer.apply(g, seat.getName(), seat.getConnectionId(), cmd, now());
            if (timedOut && !seat.isBot()) {
                log.info("Temps écoulé pour {} dans la partie {}", seat.getName(), g.getId());
                publisher.toGame(g.getId(), GameEventType.AUTO_ACTION_TAKEN, action);
            }
            afterTransition(g, t);
        }
    }

    /** Commandes internes déclenchées par minuteur. */
    void runInternal(String gameId, GameCommand cmd) {
        synchronized (locks.of(gameId)) {
            GameSession g = registry.cached(gameId).orElse(null);
            if (g == null) return;
            try {
                Transition t = reducer.apply(g, null, null, cmd, now());
                afterTransition(g, t);
            } catch (GameException ex) {
                log.warn("Commande interne {} refusée pour la partie {} : {}",
                        cmd.getClass().getSimpleName(), gameId, ex.getMessage());
            }
        }
    }

    /** Réarme les minuteurs d'une partie relue depuis la base. Sous verrou. */
    public void rearm(GameSession g) {
        String id = g.getId();
        if (g.getPhase() == GamePhase.PLAYING && g.getCurrentTrick().size() >= GameSession.SEATS) {
            events.schedule(id, ScheduledEvents.CLEAR_TRICK, null, props.getTrickRevealMs(),
                    () -> runInternal(id, new GameCommand.ClearTrick(id)));
        } else if (g.getPhase() == GamePhase.SCORING) {
            events.schedule(id, ScheduledEvents.NEXT_ROUND, null, props.getScoringAutoAdvanceMs(),
                    () -> runInternal(id, new GameCommand.StartNextRound(id)));
        } else {
            resumeTurn(g);
        }
    }

    /** Retire la partie de partout : mémoire, minuteurs, base, jetons. Sous verrou. */
    public void closeGame(String gameId, String reason) {
        clock.stop(gameId);
        events.cancelAllOf(gameId);
        broadcaster.forget(gameId);
        registry.remove(gameId);
        persistence.deleteGame(gameId);
        tokens.invalidateGame(gameId);
        log.info("Partie {} fermée ({})", gameId, reason);
    }

    private long now() { return System.currentTimeMillis(); }
}
