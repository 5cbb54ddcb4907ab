package org.jaffre.exception;

public class GameValidationException extends GameException {
    public GameValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }
}
