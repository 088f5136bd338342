/**
 * REST controller exposing the unified neuroscience dataset catalog.
 */
package net.neurod3.controller;

import lombok.extern.slf4j.Slf4j;
import net.neurod3.config.CatalogProperties;
import net.neurod3.controller.dto.CatalogDtoMapper;
import net.neurod3.controller.dto.CatalogViewResponse;
import net.neurod3.controller.dto.DatasetPageResponse;
import net.neurod3.controller.dto.DatasetStatsResponse;
import net.neurod3.controller.dto.GroupPageResponse;
import net.neurod3.model.CatalogSnapshot;
import net.neurod3.model.DatasetSource;
import net.neurod3.model.FacetStats;
import net.neurod3.model.FilterState;
import net.neurod3.model.SortColumn;
import net.neurod3.model.SortDirection;
import net.neurod3.model.SortSelection;
import net.neurod3.service.CatalogQueryService;
import net.neurod3.service.CatalogSnapshotService;
import net.neurod3.service.CatalogViewService;
import net.neurod3.service.FacetAggregator;
import net.neurod3.util.ApplicationConstants;
import net.neurod3.util.ModalityTokens;
import net.neurod3.util.PagingUtils;
import net.neurod3.util.ReactiveControllerUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api")
@Slf4j
public class DatasetController {

    private final CatalogSnapshotService snapshotService;
    private final CatalogQueryService queryService;
    private final FacetAggregator facetAggregator;
    private final CatalogViewService viewService;
    private final CatalogProperties catalogProperties;

    public DatasetController(CatalogSnapshotService snapshotService,
                             CatalogQueryService queryService,
                             FacetAggregator facetAggregator,
                             CatalogViewService viewService,
                             CatalogProperties catalogProperties) {
        this.snapshotService = snapshotService;
        this.queryService = queryService;
        this.facetAggregator = facetAggregator;
        this.viewService = viewService;
        this.catalogProperties = catalogProperties;
    }

    /**
     * Filter, sort and paging parameters shared by the catalog endpoints.
     * Spring MVC binds query parameters to record fields by name; {@code modality} may repeat.
     */
    record CatalogQueryParams(String source, List<String> modality, String search,
                              Integer limit, Integer offset, Integer page,
                              String sortBy, String sortOrder, Boolean grouped) {
        boolean effectiveGrouped() { return Boolean.TRUE.equals(grouped); }
    }

    @GetMapping("/datasets")
    public Mono<ResponseEntity<DatasetPageResponse>> getDatasets(CatalogQueryParams params) {
        FilterState filters = toFilterState(params);
        return ReactiveControllerUtils.ok(
            ReactiveControllerUtils.blocking(() -> queryService.queryRecords(snapshotService.currentSnapshot(), filters))
                .map(CatalogDtoMapper::toRecordPage),
            "Failed to query datasets"
        );
    }

    @GetMapping("/datasets/groups")
    public Mono<ResponseEntity<GroupPageResponse>> getDatasetGroups(CatalogQueryParams params) {
        FilterState filters = toFilterState(params);
        return ReactiveControllerUtils.ok(
            ReactiveControllerUtils.blocking(() -> queryService.queryGroups(snapshotService.currentSnapshot(), filters))
                .map(CatalogDtoMapper::toGroupPage),
            "Failed to query dataset groups"
        );
    }

    @GetMapping("/datasets/stats")
    public Mono<ResponseEntity<DatasetStatsResponse>> getDatasetStats(CatalogQueryParams params) {
        DatasetSource source = parseSource(params.source());
        Set<String> modalities = ModalityTokens.parseSelection(params.modality());
        FilterState filters = new FilterState(source, modalities, SortSelection.DEFAULT, 1,
            catalogProperties.getDefaultPageSize());
        return ReactiveControllerUtils.ok(
            ReactiveControllerUtils.blocking(() -> {
                CatalogSnapshot snapshot = snapshotService.currentSnapshot();
                FacetStats facets = facetAggregator.computeFacets(snapshot.records(), source, modalities);
                int unique = queryService.countGroups(snapshot, filters);
                return CatalogDtoMapper.toStats(facets, unique);
            }),
            "Failed to compute dataset stats"
        );
    }

    @GetMapping("/catalog")
    public Mono<ResponseEntity<CatalogViewResponse>> getCatalogView(CatalogQueryParams params) {
        FilterState filters = toFilterState(params);
        boolean grouped = params.effectiveGrouped();
        return ReactiveControllerUtils.ok(
            ReactiveControllerUtils.blocking(() -> viewService.view(filters, grouped))
                .map(CatalogDtoMapper::toView),
            "Failed to build catalog view"
        );
    }

    FilterState toFilterState(CatalogQueryParams params) {
        if (StringUtils.hasText(params.search())) {
            log.debug("Ignoring search term '{}': free-text search is not supported", params.search());
        }
        DatasetSource source = parseSource(params.source());
        Set<String> modalities = ModalityTokens.parseSelection(params.modality());
        SortSelection sort = parseSort(params.sortBy(), params.sortOrder());

        int limit = params.limit() != null ? params.limit() : catalogProperties.getDefaultPageSize();
        if (limit < ApplicationConstants.Paging.MIN_PAGE_SIZE || limit > catalogProperties.getMaxPageSize()) {
            throw badRequest("Invalid limit: " + limit + ". Must be between "
                + ApplicationConstants.Paging.MIN_PAGE_SIZE + " and " + catalogProperties.getMaxPageSize());
        }
        int page;
        if (params.page() != null) {
            if (params.page() < 1) {
                throw badRequest("Invalid page: " + params.page() + ". Pages start at 1");
            }
            page = params.page();
        } else {
            int offset = params.offset() != null ? params.offset() : 0;
            if (offset < 0) {
                throw badRequest("Invalid offset: " + offset + ". Must not be negative");
            }
            page = PagingUtils.pageForOffset(offset, limit);
        }
        return new FilterState(source, modalities, sort, page, limit);
    }

    private DatasetSource parseSource(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        return DatasetSource.fromValue(raw).orElseThrow(() -> badRequest(
            "Invalid source: " + raw + ". Supported values: " + String.join(", ", DatasetSource.labels())));
    }

    private SortSelection parseSort(String sortBy, String sortOrder) {
        SortColumn column = SortSelection.DEFAULT.column();
        if (StringUtils.hasText(sortBy)) {
            column = SortColumn.fromValue(sortBy).orElseThrow(() -> badRequest(
                "Invalid sortBy: " + sortBy + ". Supported values: " + String.join(", ", SortColumn.wireValues())));
        }
        SortDirection direction = SortSelection.DEFAULT.direction();
        if (StringUtils.hasText(sortOrder)) {
            direction = SortDirection.fromValue(sortOrder).orElseThrow(() -> badRequest(
                "Invalid sortOrder: " + sortOrder + ". Supported values: asc, desc"));
        }
        return SortSelection.of(column, direction);
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }
}
