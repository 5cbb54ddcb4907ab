package org.jaffre.service.game.registry;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaffre.exception.GameNotFoundException;
import org.jaffre.exception.GamePersistenceException;
import org.jaffre.model.game.GameSession;
import org.jaffre.service.game.persistence.GamePersistence;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/** Parties en mémoire ; un identifiant inconnu est relu depuis la base. */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameRegistry {
    private static final String ID_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int ID_LENGTH = 6;

    private final GamePersistence persistence;
    private final Map<String, GameSession> games = new ConcurrentHashMap<>();
    private final SecureRandom rnd = new SecureRandom();
    private volatile Consumer<GameSession> onHydrated = g -> {};

    @PostConstruct
    public void loadActiveSnapshots() {
        List<GameSession> stored;
        try {
            stored = persistence.loadActiveSnapshots();
        } catch (RuntimeException ex) {
            log.warn("Base indisponible au démarrage, aucune partie restaurée", ex);
            return;
        }
        for (GameSession g : stored) {
            games.put(g.getId(), g);
        }
        log.info("{} partie(s) restaurée(s) depuis la base", games.size());
    }

    public void setHydrationListener(Consumer<GameSession> listener) {
        this.onHydrated = listener;
    }

    public Collection<GameSession> all() { return games.values(); }

    public GameSession get(String id) {
        return find(id).orElseThrow(() -> new GameNotFoundException("Partie inconnue"));
    }

    public Optional<GameSession> find(String id) {
        if (id == null) return Optional.empty();
        GameSession cached = games.get(id);
        if (cached != null) return Optional.of(cached);

        Optional<GameSession> loaded = persistence.loadGame(id);
        if (loaded.isEmpty()) return Optional.empty();
        GameSession existing = games.putIfAbsent(id, loaded.get());
        if (existing != null) return Optional.of(existing);
        log.info("Partie {} rechargée depuis la base", id);
        onHydrated.accept(loaded.get());
        return loaded;
    }

    /** Présente en mémoire, sans relecture en base. */
    public Optional<GameSession> cached(String id) {
        return Optional.ofNullable(games.get(id));
    }

    public void put(GameSession g) { games.put(g.getId(), g); }
    public void remove(String id) { games.remove(id); }

    public String newId() {
        String id;
        do {
            StringBuilder sb = new StringBuilder(ID_LENGTH);
            for (int i = 0; i < ID_LENGTH; i++) sb.append(ID_ALPHABET.charAt(rnd.nextInt(ID_ALPHABET.length())));
            id = sb.toString();
        } while (games.containsKey(id) || storedElsewhere(id));
        return id;
    }

    private boolean storedElsewhere(String id) {
        try {
            return persistence.loadGame(id).isPresent();
        } catch (GamePersistenceException ex) {
            // la mémoire fait foi
            log.warn("Base indisponible, unicité de {} vérifiée en mémoire seulement", id, ex);
            return false;
        }
    }
}
