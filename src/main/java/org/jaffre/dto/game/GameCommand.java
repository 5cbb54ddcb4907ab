package org.jaffre.dto.game;

import org.jaffre.model.game.Card;

/**
 * Toutes les actions qui peuvent modifier une partie, côté joueur ou interne (minuteurs).
 */
public sealed interface GameCommand {

    record JoinGame(String gameId, String playerName) implements GameCommand {}
    record AddBot(String gameId) implements GameCommand {}
    record SelectTeam(String gameId, int teamId) implements GameCommand {}
    record SwapPosition(String gameId, String targetSeatName) implements GameCommand {}
    record StartGame(String gameId) implements GameCommand {}
    record PlaceBet(String gameId, int amount, boolean withoutTrump, boolean skipped) implements GameCommand {}
    record PlayCard(String gameId, Card card) implements GameCommand {}
    record PlayerReady(String gameId) implements GameCommand {}
    record VoteRematch(String gameId) implements GameCommand {}
    record LeaveGame(String gameId) implements GameCommand {}
    record KickPlayer(String gameId, String seatName) implements GameCommand {}
    record ReplaceWithBot(String gameId, String seatName) implements GameCommand {}
    record TakeOverBot(String gameId, String botName, String playerName) implements GameCommand {}

    // internes
    record ClearTrick(String gameId) implements GameCommand {}
    record StartNextRound(String gameId) implements GameCommand {}
}
