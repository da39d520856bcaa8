package com.simnotes.index;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.simnotes.store.PointId;

/**
 * Per-path record of what the vector store is believed to hold. A path without an entry is
 * {@link IndexStatus#UNINDEXED}.
 */
public class IndexLedger {
    private final Map<String, LedgerEntry> entries = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Clock clock;

    public IndexLedger() {
        this(Clock.systemUTC());
    }

    IndexLedger(Clock clock) {
        this.clock = clock;
    }

    public static IndexLedger load(Path path) throws IOException {
        IndexLedger ledger = new IndexLedger();
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return ledger;
        }
        List<LedgerEntry> loaded = ledger.objectMapper.readValue(path.toFile(), new TypeReference<List<LedgerEntry>>() {
        });
        for (LedgerEntry entry : loaded) {
            ledger.entries.put(entry.path(), entry);
        }
        return ledger;
    }

    public synchronized void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        List<LedgerEntry> snapshot = entries.values().stream()
                .sorted((a, b) -> a.path().compareTo(b.path()))
                .toList();
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public IndexStatus status(String path) {
        LedgerEntry entry = entries.get(path);
        return entry == null ? IndexStatus.UNINDEXED : entry.status();
    }

    public Optional<LedgerEntry> entry(String path) {
        return Optional.ofNullable(entries.get(path));
    }

    /**
     * Returns whether the path was indexed from identical content, by the same embedding version, into the same
     * store collection.
     */
    public boolean isCurrent(String path, String fingerprint, String embeddingVersion, String target) {
        LedgerEntry entry = entries.get(path);
        return entry != null
                && entry.status() == IndexStatus.INDEXED
                && fingerprint.equals(entry.fingerprint())
                && embeddingVersion.equals(entry.embeddingVersion())
                && target.equals(entry.target());
    }

    public void markIndexed(String path, PointId pointId, String fingerprint, String embeddingVersion, String target) {
        entries.put(path, new LedgerEntry(path, IndexStatus.INDEXED, pointId.value(), fingerprint, embeddingVersion, target, null,
                clock.instant()));
    }

    public void markStale(String path) {
        entries.computeIfPresent(path, (key, entry) -> entry.status() == IndexStatus.INDEXED ? stale(entry) : entry);
    }

    /**
     * Marks every indexed entry written to {@code target} as stale, for when that collection was created afresh and
     * holds none of the ledger's points.
     */
    public int invalidateTarget(String target) {
        int invalidated = 0;
        for (LedgerEntry entry : entries.values()) {
            if (entry.status() == IndexStatus.INDEXED && target.equals(entry.target())
                    && entries.replace(entry.path(), entry, stale(entry))) {
                invalidated++;
            }
        }
        return invalidated;
    }

    public void markFailed(String path, PointId pointId, String error) {
        Instant now = clock.instant();
        entries.merge(path,
                new LedgerEntry(path, IndexStatus.FAILED, pointId.value(), null, null, null, error, now),
                (previous, failed) -> new LedgerEntry(path, IndexStatus.FAILED, previous.pointId(), previous.fingerprint(),
                        previous.embeddingVersion(), previous.target(), error, now));
    }

    public void remove(String path) {
        entries.remove(path);
    }

    public List<String> paths() {
        return entries.keySet().stream().sorted().toList();
    }

    public List<LedgerEntry> entriesWithStatus(IndexStatus status) {
        return entries.values().stream()
                .filter(entry -> entry.status() == status)
                .sorted((a, b) -> a.path().compareTo(b.path()))
                .toList();
    }

    public Map<IndexStatus, Integer> counts() {
        Map<IndexStatus, Integer> counts = new EnumMap<>(IndexStatus.class);
        for (LedgerEntry entry : entries.values()) {
            counts.merge(entry.status(), 1, Integer::sum);
        }
        return counts;
    }

    private LedgerEntry stale(LedgerEntry entry) {
        return new LedgerEntry(entry.path(), IndexStatus.STALE, entry.pointId(), entry.fingerprint(), entry.embeddingVersion(),
                entry.target(), null, clock.instant());
    }

    public static String fingerprint(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
