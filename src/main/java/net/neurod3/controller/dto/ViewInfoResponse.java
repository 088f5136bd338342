package net.neurod3.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.neurod3.repository.DatasetCatalogRepository;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code GET /api/debug/view-info}. Counts are omitted for relations that do not exist.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViewInfoResponse(
    @JsonProperty("unified_datasets_view_exists")
    boolean unifiedDatasetsViewExists,

    @JsonProperty("dandi_dataset_table_exists")
    boolean dandiDatasetTableExists,

    @JsonProperty("neuroscience_datasets_table_exists")
    boolean neuroscienceDatasetsTableExists,

    @JsonProperty("dandi_dataset_count")
    Long dandiDatasetCount,

    @JsonProperty("neuroscience_datasets_count")
    Long neuroscienceDatasetsCount,

    @JsonProperty("unified_datasets_count")
    Long unifiedDatasetsCount,

    @JsonProperty("unified_datasets_by_source")
    Map<String, Long> unifiedDatasetsBySource,

    @JsonProperty("sample_sources")
    List<String> sampleSources
) {

    public static ViewInfoResponse from(DatasetCatalogRepository.ViewInfo info) {
        return new ViewInfoResponse(
            info.viewExists(),
            info.dandiTableExists(),
            info.neuroTableExists(),
            info.dandiCount(),
            info.neuroCount(),
            info.viewCount(),
            info.viewRowsBySource(),
            info.sampleSources()
        );
    }
}
