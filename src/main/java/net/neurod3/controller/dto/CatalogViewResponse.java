package net.neurod3.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response of {@code GET /api/catalog}: one table render in either flat or grouped mode.
 *
 * @param source effective source filter after reconciliation, null for all sources
 * @param sourceReset whether the requested source was cleared because nothing matched it
 * @param totalCount records in the whole catalog
 * @param uniqueCount duplicate groups in the whole catalog
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogViewResponse(
    boolean grouped,
    List<DatasetDto> datasets,
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
    String sortOrder,

    String source,

    @JsonProperty("selected_modalities")
    List<String> selectedModalities,

    @JsonProperty("source_reset")
    boolean sourceReset,

    @JsonProperty("available_sources")
    List<String> availableSources,

    @JsonProperty("available_modalities")
    List<ModalityOptionDto> availableModalities,

    @JsonProperty("by_source")
    Map<String, Integer> bySource,

    @JsonProperty("total_count")
    int totalCount,

    @JsonProperty("unique_count")
    int uniqueCount
) {
}
