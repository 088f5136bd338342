package net.neurod3.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code GET /api/health}, for both the healthy and unhealthy case. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
    String status,
    String database,

    @JsonProperty("unified_datasets_view")
    String unifiedDatasetsView,

    @JsonProperty("view_row_count")
    Long viewRowCount,

    String error
) {

    public static HealthResponse healthy(boolean viewExists, Long viewRowCount) {
        return new HealthResponse("healthy", "connected", viewExists ? "exists" : "missing", viewRowCount, null);
    }

    public static HealthResponse unhealthy(String error) {
        return new HealthResponse("unhealthy", "disconnected", null, null, error);
    }
}
