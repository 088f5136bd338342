package net.neurod3.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Single source of truth for splitting, comparing, and displaying modality tokens.
 *
 * <p>Sources report modality as one free-text field such as {@code "EEG; fMRI"} or
 * {@code "ecg,clinical"}. Every comparison (selection membership, filter matching and
 * facet bucketing) goes through {@link #normalizeForCompare(String)}; display casing from
 * {@link #formatToken(String)} is never compared.</p>
 */
public final class ModalityTokens {

    private static final Pattern DELIMITER = Pattern.compile("[;,]");
    private static final Pattern ACRONYM_RUN = Pattern.compile("\\p{Lu}{2,}");

    private ModalityTokens() {
        // Utility class - no instantiation
    }

    /**
     * Splits a delimited modality field on {@code ;} or {@code ,}.
     *
     * <p><strong>Example:</strong>
     * <pre>
     * Input:  " EEG ;fMRI,, eeg "
     * Output: ["EEG", "fMRI", "eeg"]
     * </pre>
     *
     * @param modalityField raw field, may be null
     * @return trimmed, non-empty tokens in original order; duplicates are kept
     */
    public static List<String> splitTokens(String modalityField) {
        if (modalityField == null || modalityField.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String piece : DELIMITER.split(modalityField)) {
            String trimmed = piece.trim();
            if (!trimmed.isEmpty()) {
                tokens.add(trimmed);
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Comparison key of a token: trimmed and lowercased.
     */
    public static String normalizeForCompare(String token) {
        if (token == null) {
            return "";
        }
        return token.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Distinct comparison keys of a modality field, in first-seen order.
     */
    public static Set<String> canonicalTokens(String modalityField) {
        List<String> tokens = splitTokens(modalityField);
        if (tokens.isEmpty()) {
            return Set.of();
        }
        Set<String> keys = new LinkedHashSet<>();
        for (String token : tokens) {
            keys.add(normalizeForCompare(token));
        }
        return Collections.unmodifiableSet(keys);
    }

    /**
     * Display casing of a token. Tokens containing two or more consecutive uppercase
     * letters are treated as acronyms and returned as-is ({@code EEG}, {@code fMRI},
     * {@code iEEG}); everything else is lowercased.
     *
     * <p>Camel-case words with adjacent capitals (e.g. {@code "PETScan"}) are kept verbatim
     * too; that is accepted behavior for display text.</p>
     *
     * @param token raw token, may be null
     * @return trimmed display string, empty for null input
     */
    public static String formatToken(String token) {
        if (token == null) {
            return "";
        }
        String trimmed = token.trim();
        if (ACRONYM_RUN.matcher(trimmed).find()) {
            return trimmed;
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses modality selections from request parameters. Each value may itself be a
     * delimited list, so {@code ?modality=EEG,fMRI} and {@code ?modality=EEG&modality=fMRI}
     * select the same keys.
     *
     * @param rawValues raw parameter values, may be null
     * @return ordered, distinct comparison keys
     */
    public static Set<String> parseSelection(Collection<String> rawValues) {
        if (rawValues == null || rawValues.isEmpty()) {
            return Set.of();
        }
        Set<String> keys = new LinkedHashSet<>();
        for (String raw : rawValues) {
            keys.addAll(canonicalTokens(raw));
        }
        return keys.isEmpty() ? Set.of() : Collections.unmodifiableSet(keys);
    }
}
