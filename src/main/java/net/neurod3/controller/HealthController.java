package net.neurod3.controller;

import lombok.extern.slf4j.Slf4j;
import net.neurod3.controller.dto.HealthResponse;
import net.neurod3.controller.dto.RefreshViewResponse;
import net.neurod3.controller.dto.ViewInfoResponse;
import net.neurod3.controller.support.ErrorResponseUtils;
import net.neurod3.repository.DatasetCatalogRepository;
import net.neurod3.service.CatalogSnapshotService;
import net.neurod3.util.ApplicationConstants;
import net.neurod3.util.ReactiveControllerUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Liveness, database health and maintenance endpoints.
 */
@RestController
@Slf4j
public class HealthController {

    private final DatasetCatalogRepository repository;
    private final CatalogSnapshotService snapshotService;

    public HealthController(DatasetCatalogRepository repository, CatalogSnapshotService snapshotService) {
        this.repository = repository;
        this.snapshotService = snapshotService;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("status", "ok", "message", "NeuroD3 API is running");
    }

    /**
     * 200 when the database answers, 503 with the failure otherwise.
     */
    @GetMapping("/api/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        return ReactiveControllerUtils.blocking(repository::healthInfo)
            .map(info -> ResponseEntity.ok(HealthResponse.healthy(info.viewExists(), info.viewRowCount())))
            .onErrorResume(ex -> {
                log.error("Health check failed: {}", ex.getMessage(), ex);
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(HealthResponse.unhealthy(ex.getMessage())));
            });
    }

    /**
     * Which catalog relations exist, with row counts. Database failures answer 503.
     */
    @GetMapping("/api/debug/view-info")
    public Mono<ResponseEntity<ViewInfoResponse>> viewInfo() {
        return ReactiveControllerUtils.ok(
            ReactiveControllerUtils.blocking(repository::viewInfo).map(ViewInfoResponse::from),
            "Failed to inspect catalog relations"
        );
    }

    /**
     * Recreates the {@code unified_datasets} view and drops the cached snapshot.
     * Answers 400 when neither base table exists yet.
     */
    @PostMapping("/api/refresh-view")
    public Mono<ResponseEntity<?>> refreshView() {
        return ReactiveControllerUtils.blocking(snapshotService::refreshView)
            .<ResponseEntity<?>>map(result -> ResponseEntity.ok(new RefreshViewResponse(
                "success",
                ApplicationConstants.Relations.UNIFIED_VIEW + " view created/refreshed",
                result.totalRows(),
                result.rowsBySource())))
            .onErrorResume(IllegalArgumentException.class, ex -> {
                log.error("Error creating view: {}", ex.getMessage());
                return Mono.just(ErrorResponseUtils.badRequest(ex.getMessage()));
            });
    }
}
