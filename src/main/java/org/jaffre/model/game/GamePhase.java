package org.jaffre.model.game;

public enum GamePhase { TEAM_SELECTION, BETTING, PLAYING, SCORING, GAME_OVER }
