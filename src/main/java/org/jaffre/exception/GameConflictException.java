package org.jaffre.exception;

public class GameConflictException extends GameException {
    public GameConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
