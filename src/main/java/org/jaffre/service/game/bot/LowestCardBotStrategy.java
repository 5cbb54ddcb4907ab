package org.jaffre.service.game.bot;

import lombok.RequiredArgsConstructor;
import org.jaffre.config.GameProperties;
import org.jaffre.model.game.Card;
import org.jaffre.model.game.GameSession;
import org.jaffre.model.game.Seat;
import org.jaffre.model.game.TrickCard;
import org.jaffre.model.game.rules.RuleSet;
import org.jaffre.model.game.rules.TrickRules;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stratégie simple : prendre le pli au plus juste quand c'est possible, sinon
 * se défausser de la plus petite carte. Le zéro rouge n'est jamais offert à
 * l'adversaire, le zéro marron lui est donné dès que possible.
 */
@Component
@RequiredArgsConstructor
public class LowestCardBotStrategy implements BotStrategy {

    private final GameProperties props;

    @Override
    public Card selectCard(GameSession g, String seatName) {
        Seat seat = g.findSeat(seatName).orElseThrow(() -> new IllegalArgumentException("Siège inconnu : " + seatName));
        List<TrickCard> trick = g.getCurrentTrick();
        List<Card> legal = TrickRules.legalCards(seat.getHand(), trick);
        if (legal.isEmpty()) throw new IllegalStateException("Aucune carte jouable pour " + seatName);

        RuleSet rules = props.ruleSet();
        Comparator<Card> cheapest = Comparator
                .comparingInt((Card c) -> TrickRules.specialPoints(c, rules) > 0 ? 1 : 0)
                .thenComparingInt(Card::value);
        if (trick.isEmpty()) return legal.stream().min(cheapest).orElseThrow();

        TrickCard winning = TrickRules.winningPlay(trick, g.getTrump());
        boolean partnerWinning = g.findSeat(winning.getSeatName())
                .map(s -> s.getTeamId() == seat.getTeamId())
                .orElse(false);
        if (partnerWinning) return legal.stream().min(cheapest).orElseThrow();

        List<Card> winners = legal.stream()
                .filter(c -> wins(trick, seatName, c, g.getTrump()))
                .toList();
        if (!winners.isEmpty()) return winners.stream().min(Comparator.comparingInt(Card::value)).orElseThrow();

        return legal.stream()
                .filter(c -> TrickRules.specialPoints(c, rules) < 0)
                .findFirst()
                .orElseGet(() -> legal.stream().min(cheapest).orElseThrow());
    }

    private boolean wins(List<TrickCard> trick, String seatName, Card card, Card.Color trump) {
        List<TrickCard> attempt = new ArrayList<>(trick);
        attempt.add(new TrickCard(seatName, null, card, trick.size()));
        return TrickRules.winningPlay(attempt, trump).getSeatName().equals(seatName);
    }
}
