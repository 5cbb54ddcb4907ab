package org.jaffre.exception;

public class GameNotFoundException extends GameException {
    public GameNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
