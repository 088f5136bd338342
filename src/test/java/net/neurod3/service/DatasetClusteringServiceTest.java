package net.neurod3.service;

import net.neurod3.model.DatasetGroup;
import net.neurod3.model.DatasetRecord;
import net.neurod3.model.DatasetSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static net.neurod3.testutil.DatasetTestData.dataset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetClusteringServiceTest {

    private final DatasetClusteringService service = new DatasetClusteringService(0.6);

    @Test
    @DisplayName("near-identical titles across catalogs group under the first one")
    void cluster_groupsIntracranialDuplicatesUnderDandi() {
        DatasetRecord dandi = dataset(DatasetSource.DANDI, "000055",
            "Intracranial EEG Recordings During Sleep Staging");
        DatasetRecord openNeuro = dataset(DatasetSource.OPENNEURO, "ds003029",
            "Intracranial EEG Recordings During Sleep Staging Analysis");

        List<DatasetGroup> groups = service.cluster(List.of(dandi, openNeuro));

        assertThat(groups).hasSize(1);
        DatasetGroup group = groups.get(0);
        assertThat(group.primary()).isEqualTo(dandi);
        assertThat(group.alternates()).containsExactly(openNeuro);
        assertThat(group.hasDuplicates()).isTrue();
    }

    @Test
    @DisplayName("similarity is checked against the primary only, not transitively")
    void cluster_isNotTransitive() {
        DatasetRecord a = dataset(DatasetSource.DANDI, "a", "Amber Birch Cedar");
        DatasetRecord b = dataset(DatasetSource.KAGGLE, "b", "Birch Cedar Daisy");
        DatasetRecord c = dataset(DatasetSource.OPENNEURO, "c", "Cedar Daisy Eagle");

        List<DatasetGroup> groups = service.cluster(List.of(a, b, c));

        assertThat(groups).containsExactly(
            new DatasetGroup(a, List.of(b)),
            new DatasetGroup(c, List.of()));
    }

    @Test
    void cluster_keywordlessTitleIsAlwaysSingleton() {
        DatasetRecord shortTitle = dataset(DatasetSource.PHYSIONET, "p1", "EEG of a cat");
        DatasetRecord sameShortTitle = dataset(DatasetSource.KAGGLE, "k1", "EEG of a cat");
        DatasetRecord other = dataset(DatasetSource.DANDI, "d1", "Mouse Visual Cortex Imaging");

        List<DatasetGroup> groups = service.cluster(List.of(shortTitle, sameShortTitle, other));

        assertThat(groups).hasSize(3).allSatisfy(group -> assertThat(group.hasDuplicates()).isFalse());
    }

    @Test
    @DisplayName("a similarity of exactly the threshold does not group")
    void cluster_thresholdIsStrict() {
        DatasetRecord base = dataset(DatasetSource.DANDI, "1", "alpha bravo charlie delta hotel");
        DatasetRecord threeOfFive = dataset(DatasetSource.KAGGLE, "2", "alpha bravo charlie kilos lemon");
        DatasetRecord fourOfFive = dataset(DatasetSource.OPENNEURO, "3", "alpha bravo charlie delta mango");

        List<DatasetGroup> groups = service.cluster(List.of(base, threeOfFive, fourOfFive));

        assertThat(groups).containsExactly(
            new DatasetGroup(base, List.of(fourOfFive)),
            new DatasetGroup(threeOfFive, List.of()));
    }

    @Test
    void cluster_producesPartitionOfInput() {
        List<DatasetRecord> records = List.of(
            dataset(DatasetSource.DANDI, "1", "Human Motor Imagery Dataset"),
            dataset(DatasetSource.KAGGLE, "2", "Motor Imagery Dataset Human Subjects"),
            dataset(DatasetSource.PHYSIONET, "3", "EEG"),
            dataset(DatasetSource.OPENNEURO, "4", "Resting State Functional Connectivity"),
            dataset(DatasetSource.OPENNEURO, "5", "Functional Connectivity Resting State Replication"),
            dataset(DatasetSource.DANDI, "6", "Calcium Imaging of Hippocampal Neurons"));

        List<DatasetGroup> groups = service.cluster(records);

        List<DatasetRecord> flattened = new ArrayList<>();
        groups.forEach(group -> flattened.addAll(group.members()));
        assertThat(flattened).containsExactlyInAnyOrderElementsOf(records);
        assertThat(groups).extracting(DatasetGroup::primary)
            .extracting(DatasetRecord::id)
            .containsExactly("1", "3", "4", "6");
    }

    @Test
    void cluster_emptyInputYieldsNoGroups() {
        assertThat(service.cluster(List.of())).isEmpty();
        assertThat(service.cluster(null)).isEmpty();
    }

    @Test
    void constructor_rejectsThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> new DatasetClusteringService(1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DatasetClusteringService(-0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}
