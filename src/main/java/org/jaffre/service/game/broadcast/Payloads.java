package org.jaffre.service.game.broadcast;

import org.jaffre.model.game.Bet;
import org.jaffre.model.game.GameSession;
import org.jaffre.model.game.Seat;
import org.jaffre.model.game.TrickCard;
import org.jaffre.model.game.TrickResult;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Vues envoyées aux clients. Chaque joueur ne reçoit que sa propre main ;
 * pour les autres sièges seul le nombre de cartes est visible. Les annonces et
 * les plis sont désignés par nom de siège, jamais par connexion.
 */
@Component
public class Payloads {

    public List<Map<String, Object>> seatsPayload(GameSession g, String viewerName) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Seat s : g.getSeats()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", s.getName());
            m.put("teamId", s.getTeamId());
            m.put("bot", s.isBot());
            m.put("connectionStatus", s.getConnectionStatus());
            m.put("tricksWon", s.getTricksWon());
            m.put("pointsWon", s.getPointsWon());
            m.put("handSize", s.getHand().size());
            if (Objects.equals(viewerName, s.getName())) m.put("hand", s.getHand());
            out.add(m);
        }
        return out;
    }

    public Map<String, Object> gameState(GameSession g, String viewerName) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", g.getId());
        m.put("phase", g.getPhase());
        m.put("seats", seatsPayload(g, viewerName));
        m.put("dealerIndex", g.getDealerIndex());
        m.put("currentSeatIndex", g.getCurrentSeatIndex());
        m.put("trump", g.getTrump());
        m.put("currentBets", betsView(g.getCurrentBets()));
        m.put("highestBet", betView(g.getHighestBet()));
        m.put("currentTrick", trickView(g.getCurrentTrick()));
        m.put("previousTrick", trickResultView(g.getPreviousTrick()));
        m.put("teamScores", g.getTeamScores());
        m.put("roundNumber", g.getRoundNumber());
        m.put("roundHistory", g.getRoundHistory());
        m.put("playersReady", g.getPlayersReady());
        m.put("rematchVotes", g.getRematchVotes());
        m.put("creatorName", g.getCreatorName());
        m.put("winningTeam", g.getWinningTeam());
        return m;
    }

    // ---------------------------------------------------------------- vues sans connexion

    public static Map<String, Object> betView(Bet b) {
        if (b == null) return null;
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("seatName", b.getSeatName());
        m.put("amount", b.getAmount());
        m.put("withoutTrump", b.isWithoutTrump());
        m.put("skipped", b.isSkipped());
        return m;
    }

    public static List<Map<String, Object>> betsView(List<Bet> bets) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Bet b : bets) out.add(betView(b));
        return out;
    }

    public static List<Map<String, Object>> trickView(List<TrickCard> cards) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (TrickCard tc : cards) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("seatName", tc.getSeatName());
            m.put("card", tc.getCard());
            m.put("order", tc.getOrder());
            out.add(m);
        }
        return out;
    }

    public static Map<String, Object> trickResultView(TrickResult r) {
        if (r == null) return null;
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("cards", trickView(r.getCards()));
        m.put("winnerName", r.getWinnerName());
        m.put("points", r.getPoints());
        return m;
    }

    /** Remplace la main des autres sièges par sa taille dans un delta. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> deltaFor(Map<String, Object> delta, int viewerIndex) {
        Object updates = delta.get("playerUpdates");
        if (!(updates instanceof List<?> list)) return delta;

        List<Map<String, Object>> masked = new ArrayList<>();
        for (Object o : list) {
            Map<String, Object> u = (Map<String, Object>) o;
            Map<String, Object> changes = (Map<String, Object>) u.get("changes");
            if ((int) u.get("index") != viewerIndex && changes.containsKey("hand")) {
                Map<String, Object> c = new LinkedHashMap<>(changes);
                List<?> hand = (List<?>) c.remove("hand");
                c.put("handSize", hand == null ? 0 : hand.size());
                Map<String, Object> copy = new LinkedHashMap<>(u);
                copy.put("changes", c);
                masked.add(copy);
            } else {
                masked.add(u);
            }
        }
        Map<String, Object> out = new LinkedHashMap<>(delta);
        out.put("playerUpdates", masked);
        return out;
    }
}
