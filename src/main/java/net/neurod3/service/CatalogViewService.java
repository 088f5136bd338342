package net.neurod3.service;

import lombok.extern.slf4j.Slf4j;
import net.neurod3.model.CatalogPage;
import net.neurod3.model.CatalogSnapshot;
import net.neurod3.model.DatasetGroup;
import net.neurod3.model.DatasetRecord;
import net.neurod3.model.DatasetSource;
import net.neurod3.model.FacetStats;
import net.neurod3.model.FilterState;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Produces everything a catalog table needs for one filter state: the page, the facet
 * counts, the selectable options and the effective filter after reconciliation.
 */
@Service
@Slf4j
public class CatalogViewService {

    private final CatalogSnapshotService snapshotService;
    private final FacetAggregator facetAggregator;
    private final CatalogQueryService queryService;
    private final DatasetClusteringService clusteringService;

    public CatalogViewService(CatalogSnapshotService snapshotService,
                              FacetAggregator facetAggregator,
                              CatalogQueryService queryService,
                              DatasetClusteringService clusteringService) {
        this.snapshotService = Objects.requireNonNull(snapshotService, "snapshotService");
        this.facetAggregator = Objects.requireNonNull(facetAggregator, "facetAggregator");
        this.queryService = Objects.requireNonNull(queryService, "queryService");
        this.clusteringService = Objects.requireNonNull(clusteringService, "clusteringService");
    }

    public CatalogView view(FilterState requested, boolean grouped) {
        Objects.requireNonNull(requested, "requested");
        CatalogSnapshot snapshot = snapshotService.currentSnapshot();
        return view(snapshot, requested, grouped);
    }

    CatalogView view(CatalogSnapshot snapshot, FilterState requested, boolean grouped) {
        FacetStats facets = facetAggregator.computeComplementaryFacets(snapshot.records(), requested);
        FacetAggregator.Reconciliation reconciliation = facetAggregator.reconcile(requested, facets);
        FilterState effective = reconciliation.filters();
        if (reconciliation.sourceReset()) {
            // Modality counts and the total depend on the source filter.
            facets = facetAggregator.computeComplementaryFacets(snapshot.records(), effective);
        }

        List<DatasetGroup> allGroups = clusteringService.cluster(snapshot.records());
        CatalogPage<DatasetRecord> records = grouped ? null : queryService.queryRecords(snapshot, effective);
        CatalogPage<DatasetGroup> groups = grouped ? queryService.queryGroups(allGroups, effective) : null;

        return new CatalogView(
            records,
            groups,
            facets,
            facets.availableSources(),
            facets.availableModalities(),
            effective,
            reconciliation.sourceReset(),
            snapshot.size(),
            allGroups.size()
        );
    }

    /**
     * Combined result for one table render. Exactly one of {@code records} and
     * {@code groups} is set, depending on the mode.
     *
     * @param totalCount records in the whole snapshot
     * @param uniqueCount duplicate groups in the whole snapshot
     */
    public record CatalogView(CatalogPage<DatasetRecord> records,
                              CatalogPage<DatasetGroup> groups,
                              FacetStats facets,
                              List<DatasetSource> availableSources,
                              List<FacetStats.ModalityOption> availableModalities,
                              FilterState filters,
                              boolean sourceReset,
                              int totalCount,
                              int uniqueCount) {

        public boolean grouped() {
            return groups != null;
        }
    }
}
