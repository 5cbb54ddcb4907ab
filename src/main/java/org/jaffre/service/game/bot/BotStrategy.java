package org.jaffre.service.game.bot;

import org.jaffre.model.game.Card;
import org.jaffre.model.game.GameSession;

/** Choix de carte pour un bot ou pour un joueur dont le temps est écoulé. */
public interface BotStrategy {
    /** Doit renvoyer une carte légale de la main du siège. */
    Card selectCard(GameSession session, String seatName);
}
