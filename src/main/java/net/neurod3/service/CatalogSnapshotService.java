package net.neurod3.service;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import net.neurod3.config.CacheFactory;
import net.neurod3.model.CatalogSnapshot;
import net.neurod3.repository.DatasetCatalogRepository;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Serves the current catalog snapshot, reading through a single-entry Caffeine cache so
 * bursts of table requests share one database read.
 */
@Service
@Slf4j
public class CatalogSnapshotService {

    private final DatasetCatalogRepository repository;
    private final Cache<String, CatalogSnapshot> snapshotCache;

    public CatalogSnapshotService(DatasetCatalogRepository repository,
                                  Cache<String, CatalogSnapshot> catalogSnapshotCache) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.snapshotCache = Objects.requireNonNull(catalogSnapshotCache, "catalogSnapshotCache");
    }

    /**
     * Returns the cached snapshot, loading it when absent or expired. Load failures are not
     * cached.
     *
     * @throws net.neurod3.exception.CatalogUnavailableException when the catalog cannot be read
     */
    public CatalogSnapshot currentSnapshot() {
        return snapshotCache.get(CacheFactory.SNAPSHOT_KEY, key -> repository.fetchAll());
    }

    /**
     * Rebuilds the unified view from the base tables and drops the cached snapshot.
     *
     * @throws IllegalArgumentException when neither base table exists
     */
    public DatasetCatalogRepository.ViewRefreshResult refreshView() {
        DatasetCatalogRepository.ViewRefreshResult result = repository.refreshUnifiedView();
        invalidate();
        return result;
    }

    /**
     * Drops the cached snapshot so the next read goes back to the database.
     */
    public void invalidate() {
        snapshotCache.invalidate(CacheFactory.SNAPSHOT_KEY);
        log.info("Catalog snapshot cache invalidated");
    }
}
