package org.jaffre.service.game.identity;

/** Jeton de reconnexion actif : un siège d'une partie. */
public record ReconnectionSession(String tokenId, String gameId, String seatName, long issuedAt, long lastUsedAt) {}
