package net.neurod3.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Catalog columns a caller may sort by.
 */
public enum SortColumn {
    PUBLISHED,
    TITLE,
    ID,
    SOURCE,
    MODALITY,
    CITATIONS;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SortColumn> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String candidate = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(column -> column.name().equals(candidate)).findFirst();
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(SortColumn::wireValue).toList();
    }
}
