package net.neurod3.config;

import lombok.extern.slf4j.Slf4j;
import net.neurod3.repository.DatasetCatalogRepository;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Reports catalog database reachability and whether the unified view exists to the
 * actuator health endpoint. A missing view is still UP since reads fall back to the base table.
 */
@Component("catalogHealthIndicator")
@Slf4j
class CatalogHealthIndicator implements HealthIndicator {

    private final DatasetCatalogRepository repository;

    CatalogHealthIndicator(DatasetCatalogRepository repository) {
        this.repository = repository;
    }

    @Override
    public Health health() {
        try {
            DatasetCatalogRepository.CatalogHealth info = repository.healthInfo();
            Health.Builder builder = Health.up()
                .withDetail("unified_datasets_view", info.viewExists() ? "exists" : "missing");
            if (info.viewRowCount() != null) {
                builder.withDetail("view_row_count", info.viewRowCount());
            }
            return builder.build();
        } catch (DataAccessException ex) {
            log.warn("Catalog health check failed: {}", ex.getMessage());
            return Health.down(ex).build();
        }
    }
}
