package net.neurod3.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * External catalogs the ingestion jobs harvest dataset metadata from.
 *
 * <p>The wire label is the exact value stored in the {@code source} column and
 * accepted by the {@code source} query parameter. Adding a catalog means adding
 * a constant here; nothing else in the query layer enumerates sources.</p>
 */
public enum DatasetSource {
    DANDI("DANDI"),
    KAGGLE("Kaggle"),
    OPENNEURO("OpenNeuro"),
    PHYSIONET("PhysioNet");

    private final String label;

    DatasetSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a wire label or enum name, ignoring case and surrounding whitespace.
     *
     * @param raw user- or database-supplied value
     * @return matching source, or empty when the value names no known catalog
     */
    public static Optional<DatasetSource> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String candidate = raw.trim();
        for (DatasetSource source : values()) {
            if (source.label.equalsIgnoreCase(candidate) || source.name().equals(candidate.toUpperCase(Locale.ROOT))) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(DatasetSource::label).toList();
    }
}
