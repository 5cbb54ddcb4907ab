package org.jaffre.model.game;

public enum ConnectionStatus { CONNECTED, DISCONNECTED }
