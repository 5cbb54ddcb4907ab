package org.jaffre.service.game.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Minuteurs différés d'une partie. Clé = (partie, objet, siège) ; planifier
 * sur une clé existante remplace l'ancien minuteur.
 */
@Slf4j
@Component
public class ScheduledEvents {

    public static final String TURN = "turn";
    public static final String COUNTDOWN = "countdown";
    public static final String CLEAR_TRICK = "clearTrick";
    public static final String NEXT_ROUND = "nextRound";
    public static final String BOT = "bot";
    public static final String RECONNECT_GRACE = "reconnectGrace";
    public static final String EMPTY_GAME = "emptyGame";
    public static final String SAVE = "save";

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public ScheduledEvents(@Qualifier("gameEventScheduler") ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public void schedule(String gameId, String purpose, String seatName, long delayMs, Runnable task) {
        String key = key(gameId, purpose, seatName);
        cancel(gameId, purpose, seatName);
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
        ScheduledFuture<?> f = scheduler.schedule(() -> {
            tasks.remove(key, self.get());
            runSafely(key, task);
        }, delayMs, TimeUnit.MILLISECONDS);
        self.set(f);
        tasks.put(key, f);
    }

    public void scheduleAtFixedRate(String gameId, String purpose, String seatName,
                                    long initialDelayMs, long periodMs, Runnable task) {
        String key = key(gameId, purpose, seatName);
        cancel(gameId, purpose, seatName);
        tasks.put(key, scheduler.scheduleAtFixedRate(() -> runSafely(key, task),
                initialDelayMs, periodMs, TimeUnit.MILLISECONDS));
    }

    public void cancel(String gameId, String purpose, String seatName) {
        ScheduledFuture<?> f = tasks.remove(key(gameId, purpose, seatName));
        if (f != null) f.cancel(false);
    }

    /** Annule tous les minuteurs d'un objet donné, quel que soit le siège. */
    public void cancelPurpose(String gameId, String purpose) {
        cancelMatching(gameId + ":" + purpose + ":");
    }

    public void cancelAllOf(String gameId) {
        cancelMatching(gameId + ":");
    }

    public boolean isScheduled(String gameId, String purpose, String seatName) {
        ScheduledFuture<?> f = tasks.get(key(gameId, purpose, seatName));
        return f != null && !f.isDone();
    }

    private void cancelMatching(String prefix) {
        tasks.keySet().removeIf(k -> {
            if (!k.startsWith(prefix)) return false;
            ScheduledFuture<?> f = tasks.get(k);
            if (f != null) f.cancel(false);
            return true;
        });
    }

    // une exception dans une tâche ne doit ni tuer le pool ni toucher les autres parties
    private void runSafely(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException ex) {
            log.error("Échec du minuteur {}", key, ex);
        }
    }

    private String key(String gameId, String purpose, String seatName) {
        return gameId + ":" + purpose + ":" + (seatName == null ? "*" : seatName);
    }
}
