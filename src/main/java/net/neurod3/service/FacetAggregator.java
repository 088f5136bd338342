package net.neurod3.service;

import lombok.extern.slf4j.Slf4j;
import net.neurod3.model.DatasetRecord;
import net.neurod3.model.DatasetSource;
import net.neurod3.model.FacetStats;
import net.neurod3.model.FilterState;
import net.neurod3.util.ModalityTokens;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Counts records per source and per modality token, and keeps a filter state consistent
 * with the counts.
 *
 * <p>The two facets behave differently: a source whose count
 * drops to zero is reset to "all sources", while selected modalities are sticky and stay
 * selected even at zero.</p>
 */
@Service
@Slf4j
public class FacetAggregator {

    /**
     * Counts over the records matching both constraints.
     *
     * @param records candidate records, may be null
     * @param source source constraint, {@code null} for all sources
     * @param selectedKeys canonical modality keys that must all be present
     */
    public FacetStats computeFacets(List<DatasetRecord> records, DatasetSource source, Set<String> selectedKeys) {
        if (records == null || records.isEmpty()) {
            return FacetStats.empty();
        }
        Counts counts = new Counts();
        for (DatasetRecord record : records) {
            if (RecordFilters.matches(record, source, selectedKeys)) {
                counts.total++;
                counts.addSource(record);
                counts.addModalities(record);
            }
        }
        return counts.toStats();
    }

    /**
     * Counts each facet without its own constraint: sources are counted under the modality
     * selection only, modalities under the source selection only. {@code total} still
     * applies both, so it equals the number of records a query with {@code filters} returns.
     */
    public FacetStats computeComplementaryFacets(List<DatasetRecord> records, FilterState filters) {
        Objects.requireNonNull(filters, "filters");
        if (records == null || records.isEmpty()) {
            return FacetStats.empty();
        }
        DatasetSource source = filters.source();
        Set<String> selectedKeys = filters.selectedModalities();
        Counts counts = new Counts();
        for (DatasetRecord record : records) {
            boolean sourceMatch = RecordFilters.matchesSource(record, source);
            boolean modalityMatch = RecordFilters.matchesModalities(record, selectedKeys);
            if (modalityMatch) {
                counts.addSource(record);
            }
            if (sourceMatch) {
                counts.addModalities(record);
            }
            if (sourceMatch && modalityMatch) {
                counts.total++;
            }
        }
        return counts.toStats();
    }

    /**
     * Resets the source selection to "all" when it has no records left in {@code facets}.
     * Selected modalities are returned untouched.
     */
    public Reconciliation reconcile(FilterState filters, FacetStats facets) {
        Objects.requireNonNull(filters, "filters");
        Objects.requireNonNull(facets, "facets");
        DatasetSource source = filters.source();
        if (source != null && facets.sourceCount(source) == 0) {
            log.debug("Resetting source filter {}: no records under the current modality selection", source.label());
            return new Reconciliation(filters.withSource(null).withPage(1), true);
        }
        return new Reconciliation(filters, false);
    }

    /**
     * Outcome of {@link #reconcile(FilterState, FacetStats)}.
     *
     * @param filters effective filter state
     * @param sourceReset whether the source selection was cleared
     */
    public record Reconciliation(FilterState filters, boolean sourceReset) {
    }

    private static final class Counts {
        private int total;
        private final Map<DatasetSource, Integer> bySource = new EnumMap<>(DatasetSource.class);
        private final Map<String, Integer> byModality = new LinkedHashMap<>();
        private final Map<String, String> labels = new LinkedHashMap<>();

        void addSource(DatasetRecord record) {
            bySource.merge(record.source(), 1, Integer::sum);
        }

        void addModalities(DatasetRecord record) {
            Map<String, String> seen = new LinkedHashMap<>();
            for (String token : ModalityTokens.splitTokens(record.modality())) {
                seen.putIfAbsent(ModalityTokens.normalizeForCompare(token), token);
            }
            for (Map.Entry<String, String> entry : seen.entrySet()) {
                byModality.merge(entry.getKey(), 1, Integer::sum);
                labels.putIfAbsent(entry.getKey(), ModalityTokens.formatToken(entry.getValue()));
            }
        }

        FacetStats toStats() {
            return new FacetStats(total, bySource, byModality, labels);
        }
    }
}
