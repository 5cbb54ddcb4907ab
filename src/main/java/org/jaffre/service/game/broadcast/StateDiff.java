package org.jaffre.service.game.broadcast;

import org.jaffre.model.game.GameSession;
import org.jaffre.model.game.Seat;

import java.util.*;

/**
 * Différence observable entre deux états d'une même partie. Une map vide
 * signifie qu'il n'y a rien à envoyer.
 */
public final class StateDiff {
    private StateDiff(){}

    public static Map<String, Object> between(GameSession before, GameSession after) {
        Map<String, Object> d = new LinkedHashMap<>();
        putIfChanged(d, "currentSeatIndex", before.getCurrentSeatIndex(), after.getCurrentSeatIndex());
        putIfChanged(d, "dealerIndex", before.getDealerIndex(), after.getDealerIndex());
        putIfChanged(d, "trump", before.getTrump(), after.getTrump());
        putIfChanged(d, "roundNumber", before.getRoundNumber(), after.getRoundNumber());
        putIfChanged(d, "creatorName", before.getCreatorName(), after.getCreatorName());
        putIfChanged(d, "winningTeam", before.getWinningTeam(), after.getWinningTeam());
        putIfChanged(d, "teamScores", before.getTeamScores(), after.getTeamScores());
        // comparées sur leur vue publique : un changement de connexion seul n'est pas diffusé
        putIfChanged(d, "highestBet", Payloads.betView(before.getHighestBet()), Payloads.betView(after.getHighestBet()));
        putIfChanged(d, "previousTrick", Payloads.trickResultView(before.getPreviousTrick()),
                Payloads.trickResultView(after.getPreviousTrick()));
        putIfChanged(d, "currentTrick", Payloads.trickView(before.getCurrentTrick()), Payloads.trickView(after.getCurrentTrick()));
        putIfChanged(d, "currentBets", Payloads.betsView(before.getCurrentBets()), Payloads.betsView(after.getCurrentBets()));
        putIfChanged(d, "playersReady", before.getPlayersReady(), after.getPlayersReady());
        putIfChanged(d, "rematchVotes", before.getRematchVotes(), after.getRematchVotes());

        List<Map<String, Object>> seatUpdates = new ArrayList<>();
        for (int i = 0; i < after.getSeats().size(); i++) {
            Seat now = after.getSeats().get(i);
            Seat was = i < before.getSeats().size() ? before.getSeats().get(i) : new Seat();
            Map<String, Object> changes = seatChanges(was, now);
            if (!changes.isEmpty()) {
                Map<String, Object> u = new LinkedHashMap<>();
                u.put("index", i);
                u.put("changes", changes);
                seatUpdates.add(u);
            }
        }
        if (!seatUpdates.isEmpty()) d.put("playerUpdates", seatUpdates);

        int known = before.getRoundHistory().size();
        if (after.getRoundHistory().size() > known) {
            d.put("newRoundHistory", new ArrayList<>(after.getRoundHistory().subList(known, after.getRoundHistory().size())));
        }
        return d;
    }

    static Map<String, Object> seatChanges(Seat was, Seat now) {
        Map<String, Object> c = new LinkedHashMap<>();
        putIfChanged(c, "name", was.getName(), now.getName());
        putIfChanged(c, "teamId", was.getTeamId(), now.getTeamId());
        putIfChanged(c, "hand", was.getHand(), now.getHand());
        putIfChanged(c, "tricksWon", was.getTricksWon(), now.getTricksWon());
        putIfChanged(c, "pointsWon", was.getPointsWon(), now.getPointsWon());
        putIfChanged(c, "bot", was.isBot(), now.isBot());
        putIfChanged(c, "connectionStatus", was.getConnectionStatus(), now.getConnectionStatus());
        return c;
    }

    private static void putIfChanged(Map<String, Object> out, String field, Object was, Object now) {
        if (!Objects.equals(was, now)) out.put(field, now);
    }
}
