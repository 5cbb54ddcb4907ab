package org.jaffre.model.game.rules;

import org.jaffre.model.game.Card;
import org.jaffre.model.game.Deck;
import org.jaffre.model.game.GameSession;
import org.jaffre.model.game.Seat;

import java.util.Comparator;

public final class DealingRules {
    private DealingRules(){}

    public static final int HAND_SIZE = 8;

    private static final Comparator<Card> HAND_ORDER =
            Comparator.comparing(Card::color).thenComparingInt(Card::value);

    /** Distribue 8 cartes à chacun, en commençant après le donneur. */
    public static void deal(GameSession g, Deck deck) {
        for (Seat s : g.getSeats()) s.resetForNextRound();
        int start = GameSession.after(g.getDealerIndex());
        for (int round = 0; round < HAND_SIZE; round++) {
            for (int k = 0; k < GameSession.SEATS; k++) {
                g.getSeats().get((start + k) % GameSession.SEATS).getHand().add(deck.draw());
            }
        }
        for (Seat s : g.getSeats()) s.getHand().sort(HAND_ORDER);
    }
}
