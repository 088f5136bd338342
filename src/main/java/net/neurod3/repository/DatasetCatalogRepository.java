package net.neurod3.repository;

import lombok.extern.slf4j.Slf4j;
import net.neurod3.exception.CatalogUnavailableException;
import net.neurod3.model.CatalogSnapshot;
import net.neurod3.model.DatasetRecord;
import net.neurod3.model.DatasetSource;
import net.neurod3.util.ApplicationConstants.Messages;
import net.neurod3.util.ApplicationConstants.Relations;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Postgres access for the unified dataset catalog.
 *
 * <p>Reads go to the {@code unified_datasets} view and fall back to the
 * {@code neuroscience_datasets} table when the view has not been created yet. The
 * ingestion jobs own every write except the view definition itself.</p>
 */
@Slf4j
@Repository
public class DatasetCatalogRepository {

    private static final String RELATION_EXISTS_SQL = """
            SELECT EXISTS (
                SELECT FROM information_schema.tables
                WHERE table_schema = 'public' AND table_name = ?
            ) OR EXISTS (
                SELECT FROM information_schema.views
                WHERE table_schema = 'public' AND table_name = ?
            )
            """;

    private static final String VIEW_EXISTS_SQL = """
            SELECT EXISTS (
                SELECT FROM information_schema.views
                WHERE table_schema = 'public' AND table_name = ?
            )
            """;

    private static final String SELECT_COLUMNS = """
            SELECT source, dataset_id AS id, title, modality, citations, url,
                   description, created_at, updated_at
            FROM %s
            """;

    private static final String DANDI_VIEW_BRANCH = """
            SELECT 'DANDI'::text AS source, dataset_id, title, modality, citations, url,
                   description, created_at, updated_at, version
            FROM dandi_dataset
            """;

    private static final String NEURO_VIEW_BRANCH = """
            SELECT source::text, dataset_id, title, modality, citations, url,
                   description, created_at, updated_at, NULL::VARCHAR(64) AS version
            FROM neuroscience_datasets
            """;

    private static final String SAMPLE_SOURCES_SQL =
        "SELECT DISTINCT source FROM " + Relations.UNIFIED_VIEW + " ORDER BY source LIMIT 10";

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<DatasetRecord> rowMapper = this::mapRow;

    public DatasetCatalogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Loads every catalog row into an immutable snapshot.
     *
     * @throws CatalogUnavailableException when no backing relation exists or the query fails
     */
    public CatalogSnapshot fetchAll() {
        try {
            String relation = resolveReadRelation()
                .orElseThrow(() -> new CatalogUnavailableException(
                    CatalogUnavailableException.Reason.CATALOG_MISSING, Messages.CATALOG_MISSING));
            long started = System.nanoTime();
            List<DatasetRecord> rows = jdbcTemplate.query(SELECT_COLUMNS.formatted(relation), rowMapper);
            CatalogSnapshot snapshot = CatalogSnapshot.of(rows, relation);
            log.info("Loaded {} catalog rows from {} in {} ms",
                snapshot.size(), relation, (System.nanoTime() - started) / 1_000_000);
            return snapshot;
        } catch (DataAccessException ex) {
            throw new CatalogUnavailableException(CatalogUnavailableException.Reason.DATABASE_ERROR,
                "Database query failed: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    /**
     * Checks connectivity and reports whether the unified view exists.
     *
     * @throws DataAccessException when the database cannot be reached
     */
    public CatalogHealth healthInfo() {
        jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        if (!viewExists(Relations.UNIFIED_VIEW)) {
            return new CatalogHealth(false, null);
        }
        return new CatalogHealth(true, countRows(Relations.UNIFIED_VIEW));
    }

    /**
     * Creates or replaces the unified view from whichever base tables exist. Rows of the
     * general table labelled {@code DANDI} are left out when the dedicated DANDI table is
     * present.
     *
     * @throws IllegalArgumentException when neither base table exists
     * @throws CatalogUnavailableException when a statement fails
     */
    public ViewRefreshResult refreshUnifiedView() {
        try {
            return rebuildUnifiedView();
        } catch (DataAccessException ex) {
            throw new CatalogUnavailableException(CatalogUnavailableException.Reason.DATABASE_ERROR,
                "Database error: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    private ViewRefreshResult rebuildUnifiedView() {
        boolean dandiExists = relationExists(Relations.DANDI_TABLE);
        boolean neuroExists = relationExists(Relations.NEURO_TABLE);
        if (!dandiExists && !neuroExists) {
            throw new IllegalArgumentException(
                "Neither " + Relations.DANDI_TABLE + " nor " + Relations.NEURO_TABLE + " tables exist");
        }

        String body;
        if (dandiExists && neuroExists) {
            body = DANDI_VIEW_BRANCH + " UNION ALL " + NEURO_VIEW_BRANCH + " WHERE source != 'DANDI'";
        } else if (dandiExists) {
            body = DANDI_VIEW_BRANCH;
        } else {
            body = NEURO_VIEW_BRANCH;
        }
        jdbcTemplate.execute("CREATE OR REPLACE VIEW " + Relations.UNIFIED_VIEW + " AS " + body);

        long total = countRows(Relations.UNIFIED_VIEW);
        Map<String, Long> bySource = viewRowsBySource();
        log.info("Refreshed {} view from {}{}: {} rows",
            Relations.UNIFIED_VIEW,
            dandiExists ? Relations.DANDI_TABLE : "",
            neuroExists ? (dandiExists ? ", " : "") + Relations.NEURO_TABLE : "",
            total);
        return new ViewRefreshResult(total, bySource);
    }

    /**
     * Reports which catalog relations exist and how many rows each holds.
     *
     * @throws CatalogUnavailableException when a statement fails
     */
    public ViewInfo viewInfo() {
        try {
            boolean viewExists = viewExists(Relations.UNIFIED_VIEW);
            boolean dandiExists = relationExists(Relations.DANDI_TABLE);
            boolean neuroExists = relationExists(Relations.NEURO_TABLE);
            return new ViewInfo(
                viewExists,
                dandiExists,
                neuroExists,
                dandiExists ? countRows(Relations.DANDI_TABLE) : null,
                neuroExists ? countRows(Relations.NEURO_TABLE) : null,
                viewExists ? countRows(Relations.UNIFIED_VIEW) : null,
                viewExists ? viewRowsBySource() : null,
                viewExists ? jdbcTemplate.queryForList(SAMPLE_SOURCES_SQL, String.class) : null
            );
        } catch (DataAccessException ex) {
            throw new CatalogUnavailableException(CatalogUnavailableException.Reason.DATABASE_ERROR,
                "Database error: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    private Long countRows(String relation) {
        return Objects.requireNonNullElse(
            jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + relation, Long.class), 0L);
    }

    private Map<String, Long> viewRowsBySource() {
        Map<String, Long> bySource = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT source, COUNT(*) AS count FROM " + Relations.UNIFIED_VIEW + " GROUP BY source ORDER BY source",
            (RowCallbackHandler) rs -> bySource.put(rs.getString("source"), rs.getLong("count")));
        return bySource;
    }

    Optional<String> resolveReadRelation() {
        if (viewExists(Relations.UNIFIED_VIEW)) {
            return Optional.of(Relations.UNIFIED_VIEW);
        }
        if (relationExists(Relations.NEURO_TABLE)) {
            log.warn("{} view does not exist, falling back to {} table", Relations.UNIFIED_VIEW, Relations.NEURO_TABLE);
            return Optional.of(Relations.NEURO_TABLE);
        }
        return Optional.empty();
    }

    private boolean viewExists(String name) {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(VIEW_EXISTS_SQL, Boolean.class, name));
    }

    private boolean relationExists(String name) {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(RELATION_EXISTS_SQL, Boolean.class, name, name));
    }

    /**
     * Maps one row, returning {@code null} for rows the query layer cannot represent
     * (unknown source label or missing title). {@link CatalogSnapshot} drops nulls.
     */
    DatasetRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        String rawSource = rs.getString("source");
        String id = rs.getString("id");
        Optional<DatasetSource> source = DatasetSource.fromValue(rawSource);
        if (source.isEmpty()) {
            log.warn("Skipping catalog row {} with unknown source '{}'", id, rawSource);
            return null;
        }
        String title = rs.getString("title");
        if (!StringUtils.hasText(id) || !StringUtils.hasText(title)) {
            log.warn("Skipping {} catalog row at position {} without id or title", source.get().label(), rowNum);
            return null;
        }
        int citations = rs.getInt("citations");
        if (rs.wasNull() || citations < 0) {
            citations = 0;
        }
        return DatasetRecord.builder()
            .source(source.get())
            .id(id)
            .title(title)
            .modality(rs.getString("modality"))
            .citations(citations)
            .url(rs.getString("url"))
            .description(rs.getString("description"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .build();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    /**
     * Connectivity check result.
     *
     * @param viewExists whether {@code unified_datasets} exists
     * @param viewRowCount row count of the view, {@code null} when it is missing
     */
    public record CatalogHealth(boolean viewExists, Long viewRowCount) {
    }

    /**
     * Presence and size of the catalog relations. Counts are {@code null} for relations that
     * do not exist; the per-source breakdown and sample cover the unified view only.
     */
    public record ViewInfo(boolean viewExists,
                           boolean dandiTableExists,
                           boolean neuroTableExists,
                           Long dandiCount,
                           Long neuroCount,
                           Long viewCount,
                           Map<String, Long> viewRowsBySource,
                           List<String> sampleSources) {
    }

    /**
     * Outcome of a view rebuild.
     */
    public record ViewRefreshResult(long totalRows, Map<String, Long> rowsBySource) {
        public ViewRefreshResult {
            rowsBySource = rowsBySource == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rowsBySource));
        }
    }
}
