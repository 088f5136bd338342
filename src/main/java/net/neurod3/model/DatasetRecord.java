/**
 * One ingested catalog entry as read from the unified dataset relation
 *
 * Features:
 * - Identified by its (source, id) natural key
 * - Carries the raw delimited modality field exactly as the source reported it
 * - Never mutated by the query layer; ingestion jobs own inserts and upserts
 */
package net.neurod3.model;

import java.time.Instant;
import java.util.Objects;

import lombok.Builder;

@Builder
public record DatasetRecord(DatasetSource source,
                            String id,
                            String title,
                            String modality,
                            int citations,
                            String url,
                            String description,
                            Instant createdAt,
                            Instant updatedAt) {

    public DatasetRecord {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(id, "id");
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Dataset " + source.label() + ":" + id + " has no title");
        }
        if (citations < 0) {
            throw new IllegalArgumentException("Citations must be non-negative for " + source.label() + ":" + id);
        }
        url = url == null ? "" : url;
    }

    public DatasetKey key() {
        return new DatasetKey(source, id);
    }
}
