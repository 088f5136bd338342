package net.neurod3.service;

import lombok.extern.slf4j.Slf4j;
import net.neurod3.config.CatalogProperties;
import net.neurod3.model.DatasetGroup;
import net.neurod3.model.DatasetRecord;
import net.neurod3.util.TitleNormalizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Groups catalog entries whose titles describe the same dataset so a table can show one
 * row per dataset with the other catalogs' copies as alternates.
 *
 * <p>Single greedy pass in input order:
 * <ol>
 *   <li>The first unassigned record becomes a group primary.</li>
 *   <li>Every later unassigned record whose keyword similarity to that primary is strictly
 *       above the threshold joins the group as an alternate.</li>
 * </ol>
 *
 * <p>Membership is decided against the primary only, so similarity is not transitive:
 * an alternate never pulls its own look-alikes into the group. Records whose title yields
 * no keywords always end up alone.</p>
 */
@Service
@Slf4j
public class DatasetClusteringService {

    private final double similarityThreshold;

    @Autowired
    public DatasetClusteringService(CatalogProperties catalogProperties) {
        this(catalogProperties.getSimilarityThreshold());
    }

    public DatasetClusteringService(double similarityThreshold) {
        if (similarityThreshold < 0.0 || similarityThreshold >= 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be in [0, 1) but was " + similarityThreshold);
        }
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * Partitions {@code records} into groups. Every input record lands in exactly one group;
     * group order follows the input order of the primaries.
     *
     * @param records records in the order they should be scanned, may be null
     * @return groups, empty for empty input
     */
    public List<DatasetGroup> cluster(List<DatasetRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }

        int size = records.size();
        List<Set<String>> keywords = new ArrayList<>(size);
        for (DatasetRecord record : records) {
            keywords.add(TitleNormalizer.keywords(record.title()));
        }

        boolean[] assigned = new boolean[size];
        List<DatasetGroup> groups = new ArrayList<>();
        int duplicateCount = 0;

        for (int i = 0; i < size; i++) {
            if (assigned[i]) {
                continue;
            }
            assigned[i] = true;
            Set<String> primaryKeywords = keywords.get(i);
            List<DatasetRecord> alternates = new ArrayList<>();

            if (!primaryKeywords.isEmpty()) {
                for (int j = i + 1; j < size; j++) {
                    if (assigned[j]) {
                        continue;
                    }
                    if (TitleNormalizer.similarity(primaryKeywords, keywords.get(j)) > similarityThreshold) {
                        assigned[j] = true;
                        alternates.add(records.get(j));
                    }
                }
            }

            duplicateCount += alternates.size();
            groups.add(new DatasetGroup(records.get(i), alternates));
        }

        if (log.isDebugEnabled()) {
            log.debug("Clustered {} records into {} groups ({} alternates) at threshold {}",
                size, groups.size(), duplicateCount, similarityThreshold);
        }
        return List.copyOf(groups);
    }
}
