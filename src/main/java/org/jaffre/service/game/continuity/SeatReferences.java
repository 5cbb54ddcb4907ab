package org.jaffre.service.game.continuity;

import org.jaffre.model.game.*;

import java.util.List;
import java.util.Objects;

/**
 * Réécrit les références à un siège dans tout l'état de la partie, lors d'un
 * changement de connexion ou d'un changement de nom.
 */
public final class SeatReferences {
    private SeatReferences(){}

    public static void rebindConnection(GameSession g, String seatName, String connectionId) {
        g.findSeat(seatName).ifPresent(s -> s.setConnectionId(connectionId));
        for (TrickCard tc : g.getCurrentTrick()) {
            if (seatName.equals(tc.getSeatName())) tc.setConnectionId(connectionId);
        }
        for (Bet b : g.getCurrentBets()) {
            if (seatName.equals(b.getSeatName())) b.setConnectionId(connectionId);
        }
        Bet hb = g.getHighestBet();
        if (hb != null && seatName.equals(hb.getSeatName())) hb.setConnectionId(connectionId);
        if (g.getPreviousTrick() != null) rebindTrick(g.getPreviousTrick().getCards(), seatName, connectionId);
        for (TrickResult tr : g.getCurrentRoundTricks()) rebindTrick(tr.getCards(), seatName, connectionId);
    }

    public static void renameSeat(GameSession g, String oldName, String newName) {
        g.findSeat(oldName).ifPresent(s -> s.setName(newName));
        for (TrickCard tc : g.getCurrentTrick()) {
            if (oldName.equals(tc.getSeatName())) tc.setSeatName(newName);
        }
        for (Bet b : g.getCurrentBets()) {
            if (oldName.equals(b.getSeatName())) b.setSeatName(newName);
        }
        Bet hb = g.getHighestBet();
        if (hb != null && oldName.equals(hb.getSeatName())) hb.setSeatName(newName);
        renameInResult(g.getPreviousTrick(), oldName, newName);
        for (TrickResult tr : g.getCurrentRoundTricks()) renameInResult(tr, oldName, newName);
        g.getPlayersReady().replaceAll(n -> oldName.equals(n) ? newName : n);
        g.getRematchVotes().replaceAll(n -> oldName.equals(n) ? newName : n);
        if (oldName.equals(g.getCreatorName())) g.setCreatorName(newName);
        for (RoundRecord r : g.getRoundHistory()) {
            if (oldName.equals(r.getBettorName())) r.setBettorName(newName);
            if (r.getSeatStats() != null) {
                r.setSeatStats(r.getSeatStats().stream()
                        .map(st -> oldName.equals(st.name())
                                ? new RoundRecord.SeatStats(newName, st.teamId(), st.tricks(), st.points())
                                : st)
                        .toList());
            }
        }
    }

    private static void rebindTrick(List<TrickCard> cards, String seatName, String connectionId) {
        for (TrickCard tc : cards) {
            if (seatName.equals(tc.getSeatName())) tc.setConnectionId(connectionId);
        }
    }

    private static void renameInResult(TrickResult tr, String oldName, String newName) {
        if (tr == null) return;
        for (TrickCard tc : tr.getCards()) {
            if (oldName.equals(tc.getSeatName())) tc.setSeatName(newName);
        }
        if (Objects.equals(oldName, tr.getWinnerName())) tr.setWinnerName(newName);
    }
}
