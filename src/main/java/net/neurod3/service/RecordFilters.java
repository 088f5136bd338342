package net.neurod3.service;

import net.neurod3.model.DatasetRecord;
import net.neurod3.model.DatasetSource;
import net.neurod3.util.ModalityTokens;

import java.util.Set;

/**
 * Shared record predicates so facet counting and querying agree on what "matches" means.
 */
final class RecordFilters {

    private RecordFilters() {
    }

    /**
     * @param source required source, {@code null} for any
     */
    static boolean matchesSource(DatasetRecord record, DatasetSource source) {
        return source == null || record.source() == source;
    }

    /**
     * Every selected key must be among the record's canonical tokens. An empty selection
     * matches everything, including records without a modality.
     */
    static boolean matchesModalities(DatasetRecord record, Set<String> selectedKeys) {
        if (selectedKeys == null || selectedKeys.isEmpty()) {
            return true;
        }
        Set<String> tokens = ModalityTokens.canonicalTokens(record.modality());
        return !tokens.isEmpty() && tokens.containsAll(selectedKeys);
    }

    static boolean matches(DatasetRecord record, DatasetSource source, Set<String> selectedKeys) {
        return matchesSource(record, source) && matchesModalities(record, selectedKeys);
    }
}
