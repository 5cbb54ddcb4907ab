package org.jaffre.model.game;

import java.security.SecureRandom;
import java.util.*;

public class Deck {
    public static final int SIZE = 32;

    private final Deque<Card> cards = new ArrayDeque<>();

    public Deck() {
        this(new SecureRandom());
    }

    public Deck(Random rnd) {
        List<Card> tmp = fullDeck();
        Collections.shuffle(tmp, rnd);
        cards.addAll(tmp);
    }

    public static List<Card> fullDeck() {
        List<Card> tmp = new ArrayList<>(SIZE);
        for (Card.Color c : Card.Color.values()) {
            for (int v = Card.MIN_VALUE; v <= Card.MAX_VALUE; v++) tmp.add(new Card(c, v));
        }
        return tmp;
    }

    public Card draw() {
        Card c = cards.pollFirst();
        if (c == null) throw new IllegalStateException("Paquet vide");
        return c;
    }

    public int remaining() {
        return cards.size();
    }
}
