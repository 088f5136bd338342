package net.neurod3.config;

import net.neurod3.repository.DatasetCatalogRepository;
import org.junit.jupiter.api.Test;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.Status;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CatalogHealthIndicatorTest {

    private final DatasetCatalogRepository repository = mock(DatasetCatalogRepository.class);
    private final CatalogHealthIndicator indicator = new CatalogHealthIndicator(repository);

    @Test
    void upWithRowCountWhenViewExists() {
        when(repository.healthInfo()).thenReturn(new DatasetCatalogRepository.CatalogHealth(true, 42L));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("view_row_count", 42L);
    }

    @Test
    void upWhenViewMissing() {
        when(repository.healthInfo()).thenReturn(new DatasetCatalogRepository.CatalogHealth(false, null));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("unified_datasets_view", "missing")
            .doesNotContainKey("view_row_count");
    }

    @Test
    void downWhenDatabaseUnreachable() {
        when(repository.healthInfo()).thenThrow(new DataAccessResourceFailureException("Connection refused"));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
