package net.neurod3.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces dataset titles to keyword sets so near-identical titles from different
 * catalogs can be compared cheaply.
 *
 * <p>Only tokens longer than {@value #MIN_KEYWORD_LENGTH_EXCLUSIVE} characters count as
 * keywords; short connective words ("the", "of", "and", "eeg") carry too little signal to
 * decide whether two titles describe the same dataset.</p>
 *
 * <p><strong>Example:</strong>
 * <pre>
 * Input:  "Intracranial EEG Recordings, During Sleep-Staging!"
 * Output: {"intracranial", "recordings", "during", "sleepstaging"}
 * </pre>
 */
public final class TitleNormalizer {

    /** Tokens must be strictly longer than this to be kept as keywords. */
    static final int MIN_KEYWORD_LENGTH_EXCLUSIVE = 4;

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TitleNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Lowercases the title, removes everything except ASCII letters, digits and whitespace,
     * and collapses whitespace runs to single spaces.
     *
     * @param title raw title, may be null
     * @return normalized title; empty string for null or blank input
     */
    public static String normalizeTitle(String title) {
        if (title == null || title.isEmpty()) {
            return "";
        }
        String lowered = title.toLowerCase(Locale.ROOT);
        String stripped = NON_ALPHANUMERIC.matcher(lowered).replaceAll("");
        return WHITESPACE_RUN.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Computes the keyword set of a title.
     *
     * @param title raw title, may be null
     * @return insertion-ordered, unmodifiable keyword set; empty when no token qualifies
     */
    public static Set<String> keywords(String title) {
        String normalized = normalizeTitle(title);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        Set<String> keywords = new LinkedHashSet<>();
        for (String token : normalized.split(" ")) {
            if (token.length() > MIN_KEYWORD_LENGTH_EXCLUSIVE) {
                keywords.add(token);
            }
        }
        return keywords.isEmpty() ? Set.of() : Collections.unmodifiableSet(keywords);
    }

    /**
     * Overlap coefficient of two keyword sets: shared keywords divided by the size of the
     * smaller set.
     *
     * @return similarity in {@code [0, 1]}; {@code 0} when either set is empty
     */
    public static double similarity(Set<String> left, Set<String> right) {
        if (left == null || right == null || left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = left.size() <= right.size() ? left : right;
        Set<String> larger = smaller == left ? right : left;
        int shared = 0;
        for (String keyword : smaller) {
            if (larger.contains(keyword)) {
                shared++;
            }
        }
        return (double) shared / Math.min(left.size(), right.size());
    }
}
