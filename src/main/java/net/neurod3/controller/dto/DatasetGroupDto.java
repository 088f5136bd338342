package net.neurod3.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** A primary entry with the near-duplicates found for it in other catalogs. */
public record DatasetGroupDto(
    DatasetDto primary,
    List<DatasetDto> alternates,

    @JsonProperty("has_duplicates")
    boolean hasDuplicates
) {
}
