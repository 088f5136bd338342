package net.neurod3.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModalityTokensTest {

    @Test
    void splitTokens_splitsOnSemicolonAndCommaKeepingDuplicates() {
        assertThat(ModalityTokens.splitTokens(" EEG ;fMRI,, eeg ")).containsExactly("EEG", "fMRI", "eeg");
    }

    @Test
    void splitTokens_emptyForNullOrBlank() {
        assertThat(ModalityTokens.splitTokens(null)).isEmpty();
        assertThat(ModalityTokens.splitTokens("  ")).isEmpty();
        assertThat(ModalityTokens.splitTokens(";,;")).isEmpty();
    }

    @Test
    void canonicalTokens_deduplicatesCaseInsensitively() {
        assertThat(ModalityTokens.canonicalTokens("EEG; eeg, Clinical")).containsExactly("eeg", "clinical");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "EEG|EEG",
        "fMRI|fMRI",
        "iEEG|iEEG",
        "Clinical|clinical",
        "  Behavioral |behavioral",
        "X-ray|x-ray",
        "MRI|MRI"
    })
    void formatToken_keepsAcronymsAndLowercasesWords(String input, String expected) {
        assertThat(ModalityTokens.formatToken(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"EEG", "fMRI", "Clinical", "Calcium Imaging", "x-ray", "PETScan"})
    @DisplayName("formatToken is idempotent")
    void formatToken_isIdempotent(String token) {
        String once = ModalityTokens.formatToken(token);
        assertThat(ModalityTokens.formatToken(once)).isEqualTo(once);
    }

    @ParameterizedTest
    @ValueSource(strings = {"EEG", "fMRI", "Clinical", "Calcium Imaging"})
    @DisplayName("formatted labels compare equal to their source token")
    void formatToken_preservesCompareKey(String token) {
        assertThat(ModalityTokens.normalizeForCompare(ModalityTokens.formatToken(token)))
            .isEqualTo(ModalityTokens.normalizeForCompare(token));
    }

    @Test
    void parseSelection_acceptsRepeatedAndDelimitedValues() {
        List<String> raw = Arrays.asList("EEG,fMRI", "eeg", null, "Clinical");
        assertThat(ModalityTokens.parseSelection(raw)).containsExactly("eeg", "fmri", "clinical");
        assertThat(ModalityTokens.parseSelection(null)).isEmpty();
    }
}
