package org.jaffre.service.game.clock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaffre.config.GameProperties;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.model.game.GamePhase;
import org.jaffre.model.game.GameSession;
import org.jaffre.service.game.broadcast.GameEventPublisher;
import org.jaffre.service.game.util.ScheduledEvents;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Délai de jeu du siège actif : un décompte chaque seconde et une échéance.
 * Une seule échéance par partie.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnClock {

    private final ScheduledEvents events;
    private final GameEventPublisher publisher;
    private final GameProperties props;

    private final Map<String, Deadline> deadlines = new ConcurrentHashMap<>();
    private final Set<Deadline> warned = ConcurrentHashMap.newKeySet();

    /** Échéance d'un tour ; (siège, phase, numéro de tour) identifie le tour visé. */
    public record Deadline(String gameId, String seatName, GamePhase phase, long turnSequence, long deadlineEpochMs) {

        public boolean stillCurrent(GameSession g) {
            return g.getPhase() == phase
                    && g.getTurnSequence() == turnSequence
                    && g.getSeats().size() == GameSession.SEATS
                    && seatName.equals(g.actingSeat().getName());
        }
    }

    @FunctionalInterface
    public interface TimeoutHandler {
        void onTimeout(Deadline deadline);
    }

    public Deadline start(GameSession g, TimeoutHandler onTimeout) {
        Deadline d = new Deadline(g.getId(), g.actingSeat().getName(), g.getPhase(), g.getTurnSequence(),
                now() + props.getTurnTimeoutMs());
        arm(d, onTimeout);
        return d;
    }

    /** Reprend l'échéance en cours si elle vise toujours ce tour, sinon en démarre une. */
    public Deadline resume(GameSession g, TimeoutHandler onTimeout) {
        Deadline pending = deadlines.get(g.getId());
        if (pending != null && pending.stillCurrent(g)) {
            arm(pending, onTimeout);
            return pending;
        }
        return start(g, onTimeout);
    }

    public void stop(String gameId) {
        Deadline d = deadlines.remove(gameId);
        if (d != null) warned.remove(d);
        events.cancelPurpose(gameId, ScheduledEvents.COUNTDOWN);
        events.cancelPurpose(gameId, ScheduledEvents.TURN);
    }

    public Optional<Deadline> pending(String gameId) {
        return Optional.ofNullable(deadlines.get(gameId));
    }

    private void arm(Deadline d, TimeoutHandler onTimeout) {
        String gameId = d.gameId();
        Deadline previous = deadlines.put(gameId, d);
        if (previous != null && !previous.equals(d)) warned.remove(previous);
        // le décompte est coupé avant que l'échéance ne soit replanifiée
        events.cancelPurpose(gameId, ScheduledEvents.COUNTDOWN);
        events.cancelPurpose(gameId, ScheduledEvents.TURN);

        long remaining = Math.max(0, d.deadlineEpochMs() - now());
        events.schedule(gameId, ScheduledEvents.TURN, d.seatName(), remaining, () -> {
            if (!deadlines.remove(gameId, d)) return;
            warned.remove(d);
            events.cancel(gameId, ScheduledEvents.COUNTDOWN, d.seatName());
            onTimeout.onTimeout(d);
        });
        events.scheduleAtFixedRate(gameId, ScheduledEvents.COUNTDOWN, d.seatName(), 0, props.getTickMs(),
                () -> tick(d));
    }

    void tick(Deadline d) {
        if (!d.equals(deadlines.get(d.gameId()))) {
            events.cancel(d.gameId(), ScheduledEvents.COUNTDOWN, d.seatName());
            return;
        }
        long remainingMs = d.deadlineEpochMs() - now();
        if (remainingMs <= 0) {
            events.cancel(d.gameId(), ScheduledEvents.COUNTDOWN, d.seatName());
            return;
        }
        long seconds = (remainingMs + 999) / 1000;
        publisher.toGame(d.gameId(), GameEventType.TIMEOUT_COUNTDOWN, Map.of(
                "playerName", d.seatName(),
                "secondsRemaining", seconds,
                "deadline", d.deadlineEpochMs()));
        if (remainingMs <= props.getWarningMs() && warned.add(d)) {
            publisher.toGame(d.gameId(), GameEventType.TIMEOUT_WARNING, Map.of(
                    "playerName", d.seatName(),
                    "secondsRemaining", seconds));
        }
    }

    private long now() { return System.currentTimeMillis(); }
}
