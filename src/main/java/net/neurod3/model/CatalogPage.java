package net.neurod3.model;

import java.util.List;
import java.util.Objects;

/**
 * One page of a sorted, filtered catalog result.
 *
 * @param items entries on the effective page
 * @param totalCount matching entries before pagination
 * @param page effective 1-based page after clamping
 * @param pageSize requested page size
 * @param totalPages at least 1, even when nothing matches
 * @param requestedPage page the caller asked for
 * @param clamped whether {@code requestedPage} was beyond {@code totalPages}
 * @param sort ordering applied before slicing
 */
public record CatalogPage<T>(List<T> items,
                             int totalCount,
                             int page,
                             int pageSize,
                             int totalPages,
                             int requestedPage,
                             boolean clamped,
                             SortSelection sort) {

    public CatalogPage {
        items = items == null ? List.of() : List.copyOf(items);
        Objects.requireNonNull(sort, "sort");
    }
}
