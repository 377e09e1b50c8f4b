package com.phillippitts.speakstream.domain;

import java.time.Instant;

/**
 * A user vocabulary entry synced from the remote service. Soft-deleted items carry a
 * non-null {@code deletedAt}.
 */
public record DictionaryItem(String id, String word, String pronunciation, Instant updatedAt, Instant deletedAt) {

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
