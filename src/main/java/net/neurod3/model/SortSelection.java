package net.neurod3.model;

import java.util.Objects;

/**
 * Active sort column and direction of a catalog table.
 *
 * <p>Column header clicks go through {@link #select(SortColumn)}: clicking the active
 * column flips its direction, clicking another column starts it descending.</p>
 */
public record SortSelection(SortColumn column, SortDirection direction) {

    public static final SortSelection DEFAULT = new SortSelection(SortColumn.CITATIONS, SortDirection.DESC);

    public SortSelection {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(direction, "direction");
    }

    public static SortSelection of(SortColumn column, SortDirection direction) {
        return new SortSelection(column, direction);
    }

    public SortSelection select(SortColumn requested) {
        Objects.requireNonNull(requested, "requested");
        if (requested == column) {
            return new SortSelection(column, direction.toggle());
        }
        return new SortSelection(requested, SortDirection.DESC);
    }
}
