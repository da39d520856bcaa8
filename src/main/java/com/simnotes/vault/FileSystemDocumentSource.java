package com.simnotes.vault;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

public class FileSystemDocumentSource implements DocumentSource {
    private final Path root;
    private final List<String> extensions;

    public FileSystemDocumentSource(Path root, List<String> extensions) {
        this.root = root.toAbsolutePath().normalize();
        this.extensions = extensions.stream()
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .map(extension -> extension.startsWith(".") ? extension : "." + extension)
                .toList();
    }

    public Path root() {
        return root;
    }

    @Override
    public List<String> listPaths() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Vault directory does not exist: " + root);
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(this::accepts)
                    .map(FileSystemDocumentSource::toVaultPath)
                    .sorted()
                    .toList();
        }
    }

    @Override
    public String read(String path) throws IOException {
        return Files.readString(resolve(path), StandardCharsets.UTF_8);
    }

    public Path resolve(String path) {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the vault: " + path);
        }
        return resolved;
    }

    /**
     * Returns whether a vault-relative path names an indexable note: a matching extension and no hidden
     * segment such as {@code .obsidian} or {@code .simnotes}.
     */
    public boolean accepts(Path relative) {
        if (isHidden(relative)) {
            return false;
        }
        String name = relative.getFileName() == null ? "" : relative.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    public static String toVaultPath(Path relative) {
        return relative.toString().replace('\\', '/');
    }
}
