package net.neurod3.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-source and per-modality counts for a filtered record set.
 *
 * @param total number of records matching the active filters, before pagination
 * @param bySource record count per source catalog
 * @param byModality record count per canonical modality key
 * @param modalityLabels display label for every canonical modality key in {@code byModality}
 */
public record FacetStats(int total,
                         Map<DatasetSource, Integer> bySource,
                         Map<String, Integer> byModality,
                         Map<String, String> modalityLabels) {

    public FacetStats {
        bySource = bySource == null || bySource.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(bySource));
        byModality = byModality == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byModality));
        modalityLabels = modalityLabels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(modalityLabels));
    }

    public static FacetStats empty() {
        return new FacetStats(0, Map.of(), Map.of(), Map.of());
    }

    public int sourceCount(DatasetSource source) {
        return bySource.getOrDefault(source, 0);
    }

    public int modalityCount(String canonicalKey) {
        return byModality.getOrDefault(canonicalKey, 0);
    }

    /**
     * Sources with a strictly positive count, in declaration order.
     */
    public List<DatasetSource> availableSources() {
        List<DatasetSource> available = new ArrayList<>();
        for (DatasetSource source : DatasetSource.values()) {
            if (sourceCount(source) > 0) {
                available.add(source);
            }
        }
        return List.copyOf(available);
    }

    /**
     * Modality options with a strictly positive count, sorted by display label.
     */
    public List<ModalityOption> availableModalities() {
        return byModality.entrySet().stream()
            .filter(entry -> entry.getValue() > 0)
            .map(entry -> new ModalityOption(
                entry.getKey(),
                modalityLabels.getOrDefault(entry.getKey(), entry.getKey()),
                entry.getValue()))
            .sorted((left, right) -> String.CASE_INSENSITIVE_ORDER.compare(left.label(), right.label()))
            .toList();
    }

    /**
     * A selectable modality facet value.
     *
     * @param key canonical comparison key
     * @param label display casing of the token
     * @param count records carrying the token
     */
    public record ModalityOption(String key, String label, int count) {
    }
}
