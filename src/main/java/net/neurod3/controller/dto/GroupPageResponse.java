package net.neurod3.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of {@code GET /api/datasets/groups}; {@code count} is the number of matching groups.
 */
public record GroupPageResponse(
    List<DatasetGroupDto> groups,
    int count,
    int page,

    @JsonProperty("page_size")
    int pageSize,

    @JsonProperty("total_pages")
    int totalPages,

    boolean clamped,

    @JsonProperty("sort_by")
    String sortBy,

    @JsonProperty("sort_order")
    String sortOrder
) {
}
