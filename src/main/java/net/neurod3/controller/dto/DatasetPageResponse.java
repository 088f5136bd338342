package net.neurod3.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of {@code GET /api/datasets}.
 *
 * @param count matching records before pagination
 * @param page effective page after clamping
 * @param clamped whether the requested page was past the last page
 */
public record DatasetPageResponse(
    List<DatasetDto> datasets,
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
