package org.jaffre.exception;

public class GameSecurityException extends GameException {
    public GameSecurityException(String message) {
        super(ErrorCode.SECURITY, message);
    }
}
