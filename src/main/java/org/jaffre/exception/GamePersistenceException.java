package org.jaffre.exception;

public class GamePersistenceException extends GameException {
    public GamePersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE, message, cause);
    }
}
