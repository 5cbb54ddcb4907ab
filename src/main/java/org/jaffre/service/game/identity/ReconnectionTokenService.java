package org.jaffre.service.game.identity;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.jaffre.exception.GameSecurityException;
import org.jaffre.model.game.ReconnectionSessionEntity;
import org.jaffre.repo.ReconnectionSessionRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.Key;
import java.util.Base64;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Jetons signés permettant de retrouver son siège après une coupure. Chaque
 * reconnexion consomme le jeton et en émet un nouveau ; présenter un jeton déjà
 * consommé invalide toutes les sessions du siège. Les sessions sont écrites en
 * base pour rester valables après un redémarrage ; la mémoire sert de cache.
 */
@Slf4j
@Service
public class ReconnectionTokenService {
    private static final String GAME_CLAIM = "gameId";
    private static final String INVALID = "Session invalide, rejoignez la partie à nouveau";

    private final Key key;
    private final long idleExpiryMs;
    private final ReconnectionSessionRepository repository;
    private final Map<String, ReconnectionSession> sessions = new ConcurrentHashMap<>();

    public ReconnectionTokenService(@Value("${jaffre.identity.secret:}") String secretBase64,
                                    @Value("${jaffre.identity.idle-expiry-ms:86400000}") long idleExpiryMs,
                                    ReconnectionSessionRepository repository) {
        if (secretBase64 == null || secretBase64.isBlank()) {
            log.warn("jaffre.identity.secret absent : clé éphémère, les jetons ne survivront pas au redémarrage");
            this.key = Keys.secretKeyFor(SignatureAlgorithm.HS256);
        } else {
            this.key = Keys.hmacShaKeyFor(Base64.getDecoder().decode(secretBase64));
        }
        this.idleExpiryMs = idleExpiryMs;
        this.repository = repository;
    }

    public String issue(String gameId, String seatName) {
        long now = now();
        String tokenId = UUID.randomUUID().toString();
        ReconnectionSession s = new ReconnectionSession(tokenId, gameId, seatName, now, now);
        sessions.put(tokenId, s);
        store(s);
        return Jwts.builder()
                .setId(tokenId)
                .setSubject(seatName)
                .claim(GAME_CLAIM, gameId)
                .setIssuedAt(new Date(now))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public ReconnectionSession validate(String token) {
        Claims claims;
        try {
            claims = Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token).getBody();
        } catch (JwtException | IllegalArgumentException e) {
            throw new GameSecurityException(INVALID);
        }
        String gameId = claims.get(GAME_CLAIM, String.class);
        String seatName = claims.getSubject();

        ReconnectionSession s = sessions.get(claims.getId());
        if (s == null) s = reload(claims.getId());
        if (s == null) {
            // jeton déjà consommé ou révoqué : on ferme tout pour ce siège
            log.warn("Jeton réutilisé pour {} / {}, sessions révoquées", gameId, seatName);
            invalidate(gameId, seatName);
            throw new GameSecurityException(INVALID);
        }
        if (now() - s.lastUsedAt() > idleExpiryMs) {
            sessions.remove(s.tokenId());
            delete(s.tokenId());
            throw new GameSecurityException(INVALID);
        }
        ReconnectionSession touched = new ReconnectionSession(s.tokenId(), s.gameId(), s.seatName(), s.issuedAt(), now());
        sessions.put(touched.tokenId(), touched);
        store(touched);
        return touched;
    }

    /** Consomme le jeton et en émet un nouveau pour le même siège. */
    public String rotate(ReconnectionSession s) {
        sessions.remove(s.tokenId());
        delete(s.tokenId());
        return issue(s.gameId(), s.seatName());
    }

    public void invalidate(String gameId, String seatName) {
        sessions.values().removeIf(s -> s.gameId().equals(gameId) && s.seatName().equals(seatName));
        try {
            repository.deleteSeat(gameId, seatName);
        } catch (RuntimeException ex) {
            log.warn("Révocation en base échouée pour {} / {}", gameId, seatName, ex);
        }
    }

    public void invalidateGame(String gameId) {
        sessions.values().removeIf(s -> s.gameId().equals(gameId));
        try {
            repository.deleteGame(gameId);
        } catch (RuntimeException ex) {
            log.warn("Révocation en base échouée pour la partie {}", gameId, ex);
        }
    }

    public int purgeExpired() {
        long now = now();
        int before = sessions.size();
        sessions.values().removeIf(s -> now - s.lastUsedAt() > idleExpiryMs);
        int purged = before - sessions.size();
        try {
            purged = Math.max(purged, repository.deleteIdleSince(now - idleExpiryMs));
        } catch (RuntimeException ex) {
            log.warn("Purge des sessions en base échouée", ex);
        }
        return purged;
    }

    public int activeSessions() {
        return sessions.size();
    }

    // ---------------------------------------------------------------- base

    private ReconnectionSession reload(String tokenId) {
        if (tokenId == null) return null;
        Optional<ReconnectionSessionEntity> found;
        try {
            found = repository.findById(tokenId);
        } catch (RuntimeException ex) {
            log.warn("Lecture de la session {} impossible", tokenId, ex);
            throw new GameSecurityException(INVALID);
        }
        return found.map(e -> {
            ReconnectionSession s = new ReconnectionSession(e.getTokenId(), e.getGameId(), e.getSeatName(),
                    e.getIssuedAt(), e.getLastUsedAt());
            sessions.put(s.tokenId(), s);
            return s;
        }).orElse(null);
    }

    private void store(ReconnectionSession s) {
        try {
            ReconnectionSessionEntity e = new ReconnectionSessionEntity();
            e.setTokenId(s.tokenId());
            e.setGameId(s.gameId());
            e.setSeatName(s.seatName());
            e.setIssuedAt(s.issuedAt());
            e.setLastUsedAt(s.lastUsedAt());
            repository.save(e);
        } catch (RuntimeException ex) {
            log.warn("Écriture de la session {} échouée", s.tokenId(), ex);
        }
    }

    private void delete(String tokenId) {
        try {
            repository.deleteById(tokenId);
        } catch (RuntimeException ex) {
            log.warn("Suppression de la session {} échouée", tokenId, ex);
        }
    }

    private long now() { return System.currentTimeMillis(); }
}
