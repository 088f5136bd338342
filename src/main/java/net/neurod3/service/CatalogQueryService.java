package net.neurod3.service;

import lombok.extern.slf4j.Slf4j;
import net.neurod3.model.CatalogPage;
import net.neurod3.model.CatalogSnapshot;
import net.neurod3.model.DatasetGroup;
import net.neurod3.model.DatasetRecord;
import net.neurod3.model.FilterState;
import net.neurod3.model.SortDirection;
import net.neurod3.model.SortSelection;
import net.neurod3.util.PagingUtils;
import org.springframework.stereotype.Service;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Filters, sorts and paginates a catalog snapshot for a table view.
 *
 * <p>The ordering uses only the selected column. Entries that compare equal on it have no
 * guaranteed relative order, so callers must not depend on one.</p>
 */
@Service
@Slf4j
public class CatalogQueryService {

    private final DatasetClusteringService clusteringService;

    public CatalogQueryService(DatasetClusteringService clusteringService) {
        this.clusteringService = Objects.requireNonNull(clusteringService, "clusteringService");
    }

    /**
     * Records matching {@code filters}, sorted and cut to the requested page.
     */
    public CatalogPage<DatasetRecord> queryRecords(CatalogSnapshot snapshot, FilterState filters) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(filters, "filters");

        List<DatasetRecord> matching = new ArrayList<>();
        for (DatasetRecord record : snapshot.records()) {
            if (RecordFilters.matches(record, filters.source(), filters.selectedModalities())) {
                matching.add(record);
            }
        }
        matching.sort(comparatorFor(filters.sort()));
        return paginate(matching, filters);
    }

    /**
     * Duplicate groups of the whole snapshot, keeping a group when its primary or any of its
     * alternates matches {@code filters}. Groups are ordered by their primary.
     */
    public CatalogPage<DatasetGroup> queryGroups(CatalogSnapshot snapshot, FilterState filters) {
        Objects.requireNonNull(snapshot, "snapshot");
        return queryGroups(clusteringService.cluster(snapshot.records()), filters);
    }

    /**
     * Same as {@link #queryGroups(CatalogSnapshot, FilterState)} over groups the caller
     * already clustered from the whole snapshot.
     */
    public CatalogPage<DatasetGroup> queryGroups(List<DatasetGroup> groups, FilterState filters) {
        Objects.requireNonNull(groups, "groups");
        Objects.requireNonNull(filters, "filters");

        List<DatasetGroup> matching = matchingGroups(groups, filters);
        Comparator<DatasetRecord> byRecord = comparatorFor(filters.sort());
        matching.sort(Comparator.comparing(DatasetGroup::primary, byRecord));
        return paginate(matching, filters);
    }

    /**
     * Number of duplicate groups with at least one member matching {@code filters}. Skips
     * sorting and paging.
     */
    public int countGroups(CatalogSnapshot snapshot, FilterState filters) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(filters, "filters");
        return matchingGroups(clusteringService.cluster(snapshot.records()), filters).size();
    }

    private static List<DatasetGroup> matchingGroups(List<DatasetGroup> groups, FilterState filters) {
        List<DatasetGroup> matching = new ArrayList<>();
        for (DatasetGroup group : groups) {
            boolean anyMatch = group.members().stream()
                .anyMatch(member -> RecordFilters.matches(member, filters.source(), filters.selectedModalities()));
            if (anyMatch) {
                matching.add(group);
            }
        }
        return matching;
    }

    /**
     * Comparator for a sort selection. {@code PUBLISHED} treats a missing creation date as
     * older than any date; text columns use an English collator.
     */
    public static Comparator<DatasetRecord> comparatorFor(SortSelection sort) {
        Objects.requireNonNull(sort, "sort");
        Comparator<DatasetRecord> ascending = switch (sort.column()) {
            case PUBLISHED -> Comparator.comparing(DatasetRecord::createdAt,
                Comparator.nullsFirst(Comparator.naturalOrder()));
            case TITLE -> textComparator(DatasetRecord::title);
            case ID -> textComparator(DatasetRecord::id);
            case SOURCE -> textComparator(record -> record.source().label());
            case MODALITY -> textComparator(record -> record.modality() == null ? "" : record.modality());
            case CITATIONS -> Comparator.comparingInt(DatasetRecord::citations);
        };
        return sort.direction() == SortDirection.DESC ? ascending.reversed() : ascending;
    }

    private static Comparator<DatasetRecord> textComparator(Function<DatasetRecord, String> extractor) {
        // Collator is not thread-safe; one instance per comparator keeps concurrent queries apart.
        Collator collator = Collator.getInstance(Locale.ENGLISH);
        collator.setStrength(Collator.TERTIARY);
        return (left, right) -> collator.compare(extractor.apply(left), extractor.apply(right));
    }

    private <T> CatalogPage<T> paginate(List<T> sorted, FilterState filters) {
        int pageSize = filters.pageSize();
        int totalCount = sorted.size();
        int totalPages = PagingUtils.totalPages(totalCount, pageSize);
        int requestedPage = filters.page();
        int page = PagingUtils.clamp(requestedPage, 1, totalPages);
        boolean clamped = requestedPage > totalPages;

        List<T> items = PagingUtils.slice(sorted, PagingUtils.offsetForPage(page, pageSize), pageSize);
        log.debug("Catalog query matched {} entries; serving page {}/{} (requested {}) sorted by {} {}",
            totalCount, page, totalPages, requestedPage,
            filters.sort().column().wireValue(), filters.sort().direction().wireValue());
        return new CatalogPage<>(items, totalCount, page, pageSize, totalPages, requestedPage, clamped, filters.sort());
    }
}
