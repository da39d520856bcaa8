package com.simnotes.vault;

public record Document(String path, String content) {
    public Document {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("document path must not be blank");
        }
        content = content == null ? "" : content;
    }
}
