package net.neurod3.model;

import net.neurod3.util.ModalityTokens;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Caller-supplied filter, sort, and paging state for one catalog evaluation.
 *
 * @param source selected source catalog, or {@code null} for all sources
 * @param selectedModalities modality comparison keys that must all be present (AND semantics);
 *                           entries are normalized with {@link ModalityTokens#normalizeForCompare}
 *                           and blanks are dropped
 * @param sort active sort selection
 * @param page 1-based page number as requested
 * @param pageSize page size, at least 1
 */
public record FilterState(DatasetSource source,
                          Set<String> selectedModalities,
                          SortSelection sort,
                          int page,
                          int pageSize) {

    public FilterState {
        selectedModalities = normalizeSelection(selectedModalities);
        sort = sort == null ? SortSelection.DEFAULT : sort;
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1 but was " + pageSize);
        }
    }

    public static FilterState defaults(int pageSize) {
        return new FilterState(null, Set.of(), SortSelection.DEFAULT, 1, pageSize);
    }

    public FilterState withSource(DatasetSource newSource) {
        return new FilterState(newSource, selectedModalities, sort, page, pageSize);
    }

    public FilterState withPage(int newPage) {
        return new FilterState(source, selectedModalities, sort, newPage, pageSize);
    }

    private static Set<String> normalizeSelection(Set<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        Set<String> keys = new LinkedHashSet<>();
        for (String entry : raw) {
            String key = ModalityTokens.normalizeForCompare(entry);
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return keys.isEmpty() ? Set.of() : Collections.unmodifiableSet(keys);
    }
}
