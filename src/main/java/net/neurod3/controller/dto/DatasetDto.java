package net.neurod3.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One catalog entry as exposed to API clients.
 *
 * @param source wire label of the source catalog ({@code DANDI}, {@code Kaggle}, ...)
 * @param id identifier within the source catalog
 * @param modality raw delimited modality field, may be null
 * @param createdAt ISO-8601 instant, null when the source never reported one
 * @param updatedAt ISO-8601 instant, null when unknown
 */
public record DatasetDto(
    String source,
    String id,
    String title,
    String modality,
    int citations,
    String url,
    String description,

    @JsonProperty("created_at")
    String createdAt,

    @JsonProperty("updated_at")
    String updatedAt
) {
}
