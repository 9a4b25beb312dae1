package net.findmyaisle.util;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Word-overlap scoring used to match loosely described products against each other.
 */
public final class NameSimilarity {

    /** Minimum score (exclusive) for two names to be considered the same product. */
    public static final double MATCH_THRESHOLD = 0.3;

    private static final Pattern WORD_SEPARATORS = Pattern.compile("[^a-z0-9]+");

    private NameSimilarity() {
    }

    /**
     * Common distinct words divided by the larger distinct word count.
     *
     * @return score in [0, 1]; 0 when either side has no words
     */
    public static double wordOverlap(String left, String right) {
        Set<String> leftWords = words(left);
        Set<String> rightWords = words(right);
        if (leftWords.isEmpty() || rightWords.isEmpty()) {
            return 0.0;
        }
        long common = leftWords.stream().filter(rightWords::contains).count();
        return (double) common / Math.max(leftWords.size(), rightWords.size());
    }

    static Set<String> words(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(WORD_SEPARATORS.split(value.toLowerCase(Locale.ROOT)))
            .filter(word -> !word.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
