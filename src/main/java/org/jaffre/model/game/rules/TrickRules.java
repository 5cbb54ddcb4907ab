package org.jaffre.model.game.rules;

import org.jaffre.model.game.Card;
import org.jaffre.model.game.TrickCard;

import java.util.List;

public final class TrickRules {
    private TrickRules(){}

    public record Resolution(String winnerName, int points) {}

    public static int specialPoints(Card c, RuleSet rules) {
        if (c.value() != 0) return 0;
        if (c.color() == Card.Color.RED) return rules.redZeroPoints();
        if (c.color() == Card.Color.BROWN) return rules.brownZeroPoints();
        return 0;
    }

    /** 1 point pour le pli, plus les cartes spéciales qu'il contient. */
    public static int trickValue(List<TrickCard> plays, RuleSet rules) {
        int value = 1;
        for (TrickCard p : plays) value += specialPoints(p.getCard(), rules);
        return value;
    }

    public static TrickCard winningPlay(List<TrickCard> plays, Card.Color trump) {
        if (plays.isEmpty()) throw new IllegalArgumentException("Pli vide");
        TrickCard best = plays.get(0);
        for (int i = 1; i < plays.size(); i++) {
            TrickCard p = plays.get(i);
            if (beats(p.getCard(), best.getCard(), trump)) best = p;
        }
        return best;
    }

    // la meilleure carte courante est toujours de la couleur demandée ou de l'atout
    static boolean beats(Card challenger, Card best, Card.Color trump) {
        boolean challengerTrump = trump != null && challenger.color() == trump;
        boolean bestTrump = trump != null && best.color() == trump;
        if (challengerTrump != bestTrump) return challengerTrump;
        if (challenger.color() != best.color()) return false;
        return challenger.value() > best.value();
    }

    public static Resolution resolve(List<TrickCard> plays, Card.Color trump, RuleSet rules) {
        TrickCard winner = winningPlay(plays, trump);
        return new Resolution(winner.getSeatName(), trickValue(plays, rules));
    }

    public static boolean isLegalPlay(List<Card> hand, List<TrickCard> trick, Card card) {
        if (!hand.contains(card)) return false;
        if (trick.isEmpty()) return true;
        Card.Color led = trick.get(0).getCard().color();
        if (card.color() == led) return true;
        return hand.stream().noneMatch(c -> c.color() == led);
    }

    public static List<Card> legalCards(List<Card> hand, List<TrickCard> trick) {
        return hand.stream().filter(c -> isLegalPlay(hand, trick, c)).toList();
    }
}
