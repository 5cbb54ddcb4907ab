package org.jaffre.service.game.broadcast;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaffre.config.GameProperties;
import org.jaffre.dto.game.GameEventType;
import org.jaffre.model.game.GameSession;
import org.jaffre.model.game.Seat;
import org.jaffre.service.game.persistence.GamePersistence;
import org.jaffre.service.game.util.Locks;
import org.jaffre.service.game.util.ScheduledEvents;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Envoie l'état après chaque transition : complet au changement de phase ou sans
 * référence, sinon seulement les champs modifiés. Planifie aussi la sauvegarde
 * différée qui regroupe les rafales d'écritures.
 * Les méthodes publiques s'appellent sous le verrou de la partie.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeltaBroadcaster {

    private final ObjectMapper mapper;
    private final GameEventPublisher publisher;
    private final Payloads payloads;
    private final GamePersistence persistence;
    private final ScheduledEvents events;
    private final GameProperties props;
    private final Locks locks;

    // dernier état envoyé, copie profonde
    private final Map<String, GameSession> baselines = new ConcurrentHashMap<>();

    public void broadcast(GameSession g, boolean forceFull) {
        GameSession before = baselines.get(g.getId());
        boolean full = forceFull
                || before == null
                || before.getPhase() != g.getPhase()
                || before.getSeats().size() != g.getSeats().size();

        if (full) {
            sendFull(g);
        } else {
            Map<String, Object> delta = StateDiff.between(before, g);
            if (delta.isEmpty()) return;
            List<Seat> seats = g.getSeats();
            for (int i = 0; i < seats.size(); i++) {
                Seat s = seats.get(i);
                if (s.isBot()) continue;
                publisher.toConnection(s.getConnectionId(), GameEventType.GAME_UPDATED_DELTA, g.getId(),
                        payloads.deltaFor(delta, i));
            }
        }
        baselines.put(g.getId(), snapshot(g));
        scheduleSave(g.getId());
    }

    /** État complet pour une seule connexion (arrivée, reconnexion). */
    public void sendFullTo(GameSession g, String connectionId) {
        String viewer = g.findSeatByConnection(connectionId).map(Seat::getName).orElse(null);
        publisher.toConnection(connectionId, GameEventType.GAME_UPDATED, g.getId(), payloads.gameState(g, viewer));
    }

    public void forget(String gameId) {
        baselines.remove(gameId);
        events.cancel(gameId, ScheduledEvents.SAVE, null);
    }

    /** Sauvegarde immédiate, hors diffusion (fin de partie, arrêt). */
    public void saveNow(GameSession g) {
        persistence.saveGame(snapshot(g));
    }

    GameSession snapshot(GameSession g) {
        return mapper.convertValue(g, GameSession.class);
    }

    private void sendFull(GameSession g) {
        for (Seat s : g.getSeats()) {
            if (s.isBot()) continue;
            publisher.toConnection(s.getConnectionId(), GameEventType.GAME_UPDATED, g.getId(),
                    payloads.gameState(g, s.getName()));
        }
    }

    private void scheduleSave(String gameId) {
        events.schedule(gameId, ScheduledEvents.SAVE, null, props.getPersistDebounceMs(), () -> {
            // sous le verrou de la partie : une partie fermée entre-temps n'est pas réécrite
            synchronized (locks.of(gameId)) {
                GameSession copy = baselines.get(gameId);
                if (copy == null) return;
                persistence.saveGame(copy);
            }
            log.debug("Partie {} sauvegardée", gameId);
        });
    }
}
