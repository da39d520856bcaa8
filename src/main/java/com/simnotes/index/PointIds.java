package com.simnotes.index;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

import com.simnotes.store.PointId;

/**
 * Maps a vault path to the id of its point. Ids are name-based UUIDs (RFC 4122 version 5), so the same
 * path always addresses the same point and re-indexing overwrites instead of inserting.
 */
public final class PointIds {
    static final UUID NOTE_PATH_NAMESPACE = UUID.fromString("3f1c2d9e-5b7a-4c8e-9a41-7d2e6b0c5f13");

    private PointIds() {
    }

    public static PointId pointId(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        return new PointId(nameUuid(NOTE_PATH_NAMESPACE, path).toString());
    }

    static UUID nameUuid(UUID namespace, String name) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 unavailable", e);
        }
        digest.update(ByteBuffer.allocate(16)
                .putLong(namespace.getMostSignificantBits())
                .putLong(namespace.getLeastSignificantBits())
                .array());
        byte[] hash = digest.digest(name.getBytes(StandardCharsets.UTF_8));
        hash[6] &= 0x0f;
        hash[6] |= 0x50;
        hash[8] &= 0x3f;
        hash[8] |= (byte) 0x80;
        ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(buffer.getLong(), buffer.getLong());
    }
}
