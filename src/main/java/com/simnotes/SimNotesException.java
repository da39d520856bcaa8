package com.simnotes;

public class SimNotesException extends RuntimeException {
    public SimNotesException(String message) {
        super(message);
    }

    public SimNotesException(String message, Throwable cause) {
        super(message, cause);
    }
}
