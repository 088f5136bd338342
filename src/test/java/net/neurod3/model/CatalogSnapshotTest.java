package net.neurod3.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static net.neurod3.testutil.DatasetTestData.dataset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogSnapshotTest {

    @Test
    void of_keepsFirstRowForRepeatedKey() {
        DatasetRecord first = dataset(DatasetSource.KAGGLE, "eeg-brainwave", "EEG Brainwave Dataset");
        DatasetRecord repeat = dataset(DatasetSource.KAGGLE, "eeg-brainwave", "EEG Brainwave Dataset (mirror)");
        DatasetRecord sameIdOtherSource = dataset(DatasetSource.OPENNEURO, "eeg-brainwave", "EEG Brainwave");

        CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(first, repeat, sameIdOtherSource));

        assertThat(snapshot.records()).containsExactly(first, sameIdOtherSource);
    }

    @Test
    void of_skipsNullRows() {
        DatasetRecord record = dataset(DatasetSource.DANDI, "000001", "Mouse Cortex");

        CatalogSnapshot snapshot = CatalogSnapshot.of(Arrays.asList(null, record, null));

        assertThat(snapshot.size()).isEqualTo(1);
        assertThat(snapshot.records()).containsExactly(record);
    }

    @Test
    void records_areImmutableCopy() {
        List<DatasetRecord> rows = new ArrayList<>();
        rows.add(dataset(DatasetSource.DANDI, "000001", "Mouse Cortex"));
        CatalogSnapshot snapshot = CatalogSnapshot.of(rows, "unified_datasets");

        rows.clear();

        assertThat(snapshot.size()).isEqualTo(1);
        assertThat(snapshot.relation()).isEqualTo("unified_datasets");
        assertThatThrownBy(() -> snapshot.records().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void of_emptyInput() {
        assertThat(CatalogSnapshot.of(null).isEmpty()).isTrue();
    }
}
