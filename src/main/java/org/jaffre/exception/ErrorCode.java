package org.jaffre.exception;

/** Codes renvoyés au client dans l'événement {@code error}. */
public enum ErrorCode {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    SECURITY,
    PERSISTENCE,
    INTERNAL
}
