package net.neurod3.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SortSelectionTest {

    @Test
    void defaultIsCitationsDescending() {
        assertThat(SortSelection.DEFAULT.column()).isEqualTo(SortColumn.CITATIONS);
        assertThat(SortSelection.DEFAULT.direction()).isEqualTo(SortDirection.DESC);
    }

    @Test
    void selectingActiveColumnTogglesDirection() {
        SortSelection once = SortSelection.DEFAULT.select(SortColumn.CITATIONS);
        SortSelection twice = once.select(SortColumn.CITATIONS);

        assertThat(once).isEqualTo(SortSelection.of(SortColumn.CITATIONS, SortDirection.ASC));
        assertThat(twice).isEqualTo(SortSelection.DEFAULT);
    }

    @ParameterizedTest
    @CsvSource({
        "TITLE, ASC, PUBLISHED",
        "PUBLISHED, DESC, SOURCE",
        "SOURCE, ASC, TITLE"
    })
    void selectingAnotherColumnStartsDescending(SortColumn current, SortDirection direction, SortColumn requested) {
        SortSelection next = SortSelection.of(current, direction).select(requested);

        assertThat(next.column()).isEqualTo(requested);
        assertThat(next.direction()).isEqualTo(SortDirection.DESC);
    }
}
