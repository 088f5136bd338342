package net.neurod3.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record RefreshViewResponse(
    String status,
    String message,

    @JsonProperty("total_rows")
    long totalRows,

    @JsonProperty("rows_by_source")
    Map<String, Long> rowsBySource
) {
}
