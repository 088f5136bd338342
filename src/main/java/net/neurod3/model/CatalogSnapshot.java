package net.neurod3.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

/**
 * Point-in-time, read-only view of every catalog entry currently known.
 *
 * <p>Rows repeating an already seen {@code (source, id)} key are dropped so the natural key
 * stays unique within one snapshot; the first occurrence wins.</p>
 */
@Slf4j
public final class CatalogSnapshot {

    private final List<DatasetRecord> records;
    private final String relation;

    private CatalogSnapshot(List<DatasetRecord> records, String relation) {
        this.records = records;
        this.relation = relation;
    }

    public static CatalogSnapshot of(List<DatasetRecord> rows, String relation) {
        Objects.requireNonNull(relation, "relation");
        if (rows == null || rows.isEmpty()) {
            return new CatalogSnapshot(List.of(), relation);
        }
        Set<DatasetKey> seen = new HashSet<>(rows.size() * 2);
        List<DatasetRecord> unique = new ArrayList<>(rows.size());
        for (DatasetRecord row : rows) {
            if (row == null) {
                continue;
            }
            if (seen.add(row.key())) {
                unique.add(row);
            } else {
                log.warn("Dropping repeated catalog row {} from relation {}", row.key(), relation);
            }
        }
        return new CatalogSnapshot(List.copyOf(unique), relation);
    }

    public static CatalogSnapshot of(List<DatasetRecord> rows) {
        return of(rows, "in-memory");
    }

    public List<DatasetRecord> records() {
        return records;
    }

    /**
     * Name of the relation the rows were read from ({@code unified_datasets} or a fallback table).
     */
    public String relation() {
        return relation;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
