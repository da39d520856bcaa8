package com.simnotes.store;

import com.simnotes.SimNotesException;

public class StoreQueryException extends SimNotesException {
    public StoreQueryException(String message) {
        super(message);
    }

    public StoreQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
