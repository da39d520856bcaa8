package com.simnotes.store;

import com.simnotes.SimNotesException;

public class StoreWriteException extends SimNotesException {
    public StoreWriteException(String message) {
        super(message);
    }

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
