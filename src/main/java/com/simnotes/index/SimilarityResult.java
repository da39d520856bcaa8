package com.simnotes.index;

import java.util.List;

public record SimilarityResult(String queryPath, List<SimilarNote> matches) {
    public SimilarityResult {
        matches = List.copyOf(matches);
    }

    public static SimilarityResult empty(String queryPath) {
        return new SimilarityResult(queryPath, List.of());
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    public boolean contains(String path) {
        return matches.stream().anyMatch(match -> match.path().equals(path));
    }
}
