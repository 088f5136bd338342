package net.neurod3.controller.dto;

import net.neurod3.model.CatalogPage;
import net.neurod3.model.DatasetGroup;
import net.neurod3.model.DatasetRecord;
import net.neurod3.model.DatasetSource;
import net.neurod3.model.FacetStats;
import net.neurod3.service.CatalogViewService.CatalogView;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared mapper that turns catalog domain objects into API-facing DTOs.
 */
public final class CatalogDtoMapper {

    private CatalogDtoMapper() {
    }

    public static DatasetDto toDto(DatasetRecord record) {
        if (record == null) {
            return null;
        }
        return new DatasetDto(
            record.source().label(),
            record.id(),
            record.title(),
            record.modality(),
            record.citations(),
            record.url(),
            record.description(),
            isoOrNull(record.createdAt()),
            isoOrNull(record.updatedAt())
        );
    }

    public static DatasetGroupDto toDto(DatasetGroup group) {
        List<DatasetDto> alternates = group.alternates().stream().map(CatalogDtoMapper::toDto).toList();
        return new DatasetGroupDto(toDto(group.primary()), alternates, group.hasDuplicates());
    }

    public static DatasetPageResponse toRecordPage(CatalogPage<DatasetRecord> page) {
        return new DatasetPageResponse(
            page.items().stream().map(CatalogDtoMapper::toDto).toList(),
            page.totalCount(),
            page.page(),
            page.pageSize(),
            page.totalPages(),
            page.clamped(),
            page.sort().column().wireValue(),
            page.sort().direction().wireValue()
        );
    }

    public static GroupPageResponse toGroupPage(CatalogPage<DatasetGroup> page) {
        return new GroupPageResponse(
            page.items().stream().map(CatalogDtoMapper::toDto).toList(),
            page.totalCount(),
            page.page(),
            page.pageSize(),
            page.totalPages(),
            page.clamped(),
            page.sort().column().wireValue(),
            page.sort().direction().wireValue()
        );
    }

    public static DatasetStatsResponse toStats(FacetStats facets, int unique) {
        return new DatasetStatsResponse(facets.total(), unique, sourceCounts(facets), modalityCounts(facets));
    }

    public static CatalogViewResponse toView(CatalogView view) {
        CatalogPage<?> page = view.grouped() ? view.groups() : view.records();
        List<DatasetDto> datasets = view.grouped()
            ? null
            : view.records().items().stream().map(CatalogDtoMapper::toDto).toList();
        List<DatasetGroupDto> groups = view.grouped()
            ? view.groups().items().stream().map(CatalogDtoMapper::toDto).toList()
            : null;
        List<ModalityOptionDto> modalities = view.availableModalities().stream()
            .map(option -> new ModalityOptionDto(option.key(), option.label(), option.count()))
            .toList();

        return new CatalogViewResponse(
            view.grouped(),
            datasets,
            groups,
            page.totalCount(),
            page.page(),
            page.pageSize(),
            page.totalPages(),
            page.clamped(),
            page.sort().column().wireValue(),
            page.sort().direction().wireValue(),
            view.filters().source() != null ? view.filters().source().label() : null,
            new ArrayList<>(view.filters().selectedModalities()),
            view.sourceReset(),
            view.availableSources().stream().map(DatasetSource::label).toList(),
            modalities,
            sourceCounts(view.facets()),
            view.totalCount(),
            view.uniqueCount()
        );
    }

    private static Map<String, Integer> sourceCounts(FacetStats facets) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        facets.bySource().forEach((source, count) -> counts.put(source.label(), count));
        return counts;
    }

    /**
     * Counts keyed by canonical modality token, ordered by display label.
     */
    private static Map<String, Integer> modalityCounts(FacetStats facets) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (FacetStats.ModalityOption option : facets.availableModalities()) {
            counts.put(option.key(), option.count());
        }
        return counts;
    }

    private static String isoOrNull(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
