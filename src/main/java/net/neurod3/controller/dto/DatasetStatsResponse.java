package net.neurod3.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response of {@code GET /api/datasets/stats}.
 *
 * @param total records matching the filters
 * @param unique duplicate groups among them
 * @param bySource count per source wire label
 * @param byModality count per canonical modality token ({@code eeg}, {@code calcium imaging})
 */
public record DatasetStatsResponse(
    int total,
    int unique,

    @JsonProperty("by_source")
    Map<String, Integer> bySource,

    @JsonProperty("by_modality")
    Map<String, Integer> byModality
) {
}
