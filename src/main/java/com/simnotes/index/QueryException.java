package com.simnotes.index;

import com.simnotes.SimNotesException;

/**
 * Raised when a similarity query cannot be answered. The cause is the embedding, store or read failure.
 */
public class QueryException extends SimNotesException {
    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
