package com.simnotes.store;

import com.simnotes.SimNotesException;

public class StoreInitException extends SimNotesException {
    public StoreInitException(String message) {
        super(message);
    }

    public StoreInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
