package net.neurod3.config;

import jakarta.annotation.PostConstruct;
import net.neurod3.util.ApplicationConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.List;

/**
 * Strongly typed configuration for the catalog query layer.
 */
@Component
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    /**
     * How long a loaded catalog snapshot is served before the next read goes back to Postgres.
     */
    private Duration snapshotCacheTtl = Duration.ofMinutes(5);

    /**
     * Keyword overlap a title must strictly exceed to be grouped under an earlier title.
     */
    private double similarityThreshold = ApplicationConstants.Dedup.DEFAULT_SIMILARITY_THRESHOLD;

    /**
     * Page size applied when a request omits {@code limit}.
     */
    private int defaultPageSize = ApplicationConstants.Paging.DEFAULT_PAGE_SIZE;

    /**
     * Largest accepted {@code limit}.
     */
    private int maxPageSize = ApplicationConstants.Paging.MAX_PAGE_SIZE;

    /**
     * Browser origins allowed to call the API.
     */
    private List<String> corsAllowedOrigins = List.of("http://localhost:3000", "http://frontend:3000");

    @PostConstruct
    void validate() {
        Assert.isTrue(!snapshotCacheTtl.isNegative(), "catalog.snapshot-cache-ttl must be non-negative");
        Assert.isTrue(similarityThreshold >= 0.0 && similarityThreshold < 1.0,
                "catalog.similarity-threshold must be in [0, 1)");
        Assert.isTrue(defaultPageSize >= ApplicationConstants.Paging.MIN_PAGE_SIZE,
                "catalog.default-page-size must be positive");
        Assert.isTrue(maxPageSize >= defaultPageSize,
                "catalog.max-page-size must not be smaller than catalog.default-page-size");
    }

    public Duration getSnapshotCacheTtl() {
        return snapshotCacheTtl;
    }

    public void setSnapshotCacheTtl(Duration snapshotCacheTtl) {
        this.snapshotCacheTtl = snapshotCacheTtl != null ? snapshotCacheTtl : Duration.ofMinutes(5);
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public List<String> getCorsAllowedOrigins() {
        return corsAllowedOrigins;
    }

    public void setCorsAllowedOrigins(List<String> corsAllowedOrigins) {
        this.corsAllowedOrigins = corsAllowedOrigins != null ? List.copyOf(corsAllowedOrigins) : List.of();
    }
}
