package com.simnotes.index;

public record SimilarNote(String path, float score) {
}
