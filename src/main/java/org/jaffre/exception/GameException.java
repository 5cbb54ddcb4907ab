package org.jaffre.exception;

import lombok.Getter;

@Getter
public class GameException extends RuntimeException {
    private final ErrorCode code;

    public GameException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GameException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
