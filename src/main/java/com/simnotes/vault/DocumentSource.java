package com.simnotes.vault;

import java.io.IOException;
import java.util.List;

public interface DocumentSource {
    List<String> listPaths() throws IOException;

    String read(String path) throws IOException;

    default Document load(String path) throws IOException {
        return new Document(path, read(path));
    }
}
