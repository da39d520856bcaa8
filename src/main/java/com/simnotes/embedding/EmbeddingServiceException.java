package com.simnotes.embedding;

import com.simnotes.SimNotesException;

public class EmbeddingServiceException extends SimNotesException {
    public EmbeddingServiceException(String message) {
        super(message);
    }

    public EmbeddingServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
