package net.neurod3.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogPropertiesTest {

    @Test
    void defaultsAreValid() {
        CatalogProperties properties = new CatalogProperties();

        assertThatCode(properties::validate).doesNotThrowAnyException();
        assertThat(properties.getDefaultPageSize()).isEqualTo(25);
        assertThat(properties.getSimilarityThreshold()).isEqualTo(0.6);
        assertThat(properties.getSnapshotCacheTtl()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void rejectsThresholdOfOne() {
        CatalogProperties properties = new CatalogProperties();
        properties.setSimilarityThreshold(1.0);

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("similarity-threshold");
    }

    @Test
    void rejectsMaxBelowDefault() {
        CatalogProperties properties = new CatalogProperties();
        properties.setDefaultPageSize(50);
        properties.setMaxPageSize(10);

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalArgumentException.class);
    }
}
