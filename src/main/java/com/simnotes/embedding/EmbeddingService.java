package com.simnotes.embedding;

public interface EmbeddingService {
    /**
     * Produces the embedding for {@code text}. Blank text is passed through to the backend unchanged.
     *
     * @throws EmbeddingServiceException when the backend is unreachable or answers with a failure
     */
    float[] embed(String text);

    int dimension();

    default String version() {
        return "unversioned";
    }
}
