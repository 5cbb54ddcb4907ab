package org.jaffre.model.game.rules;

import org.jaffre.exception.GameValidationException;
import org.jaffre.model.game.Bet;

import java.util.List;

public final class BettingRules {
    private BettingRules(){}

    public static boolean hasValidBet(List<Bet> bets) {
        return bets.stream().anyMatch(b -> !b.isSkipped());
    }

    public static boolean allSkipped(List<Bet> bets) {
        return !bets.isEmpty() && !hasValidBet(bets);
    }

    /** Ordre strict : montant, puis "sans atout" au-dessus de "avec atout". */
    public static int compare(Bet a, Bet b) {
        if (a.getAmount() != b.getAmount()) return Integer.compare(a.getAmount(), b.getAmount());
        return Boolean.compare(a.isWithoutTrump(), b.isWithoutTrump());
    }

    /** Meilleure annonce non passée ; à égalité exacte le donneur l'emporte. */
    public static Bet highest(List<Bet> bets, String dealerName) {
        Bet best = null;
        for (Bet b : bets) {
            if (b.isSkipped()) continue;
            if (best == null) { best = b; continue; }
            int cmp = compare(b, best);
            if (cmp > 0 || (cmp == 0 && b.getSeatName().equals(dealerName))) best = b;
        }
        return best;
    }

    /**
     * Refuse une annonce illégale. Le donneur peut égaliser le montant le plus haut,
     * sans descendre de "sans atout" à "avec atout" ; les autres doivent surenchérir.
     */
    public static void check(int amount, boolean withoutTrump, boolean skipped, boolean isDealer,
                             List<Bet> bets, RuleSet rules) {
        if (skipped) {
            if (isDealer && !hasValidBet(bets)) {
                throw new GameValidationException(
                        "Le donneur doit annoncer au moins " + rules.minBet() + " quand personne n'a annoncé");
            }
            return;
        }
        if (amount < rules.minBet() || amount > rules.maxBet()) {
            throw new GameValidationException(
                    "L'annonce doit être comprise entre " + rules.minBet() + " et " + rules.maxBet());
        }
        Bet current = highest(bets, null);
        if (current == null) return;

        Bet candidate = Bet.of(null, null, amount, withoutTrump);
        if (isDealer) {
            if (compare(candidate, current) < 0) {
                throw new GameValidationException("Le donneur doit au moins égaliser l'annonce la plus haute");
            }
        } else if (compare(candidate, current) <= 0) {
            throw new GameValidationException("L'annonce doit dépasser l'annonce la plus haute");
        }
    }

    /** Action par défaut quand le temps est écoulé. */
    public static Bet defaultBet(String seatName, String connectionId, boolean isDealer,
                                 List<Bet> bets, RuleSet rules) {
        if (isDealer && !hasValidBet(bets)) return Bet.of(seatName, connectionId, rules.minBet(), false);
        return Bet.skip(seatName, connectionId);
    }
}
