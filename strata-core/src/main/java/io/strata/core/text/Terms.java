package io.strata.core.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class Terms {

    private Terms() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] raw = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        List<String> out = new ArrayList<>();
        for (String token : raw) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    /**
     * Fraction of the query's distinct terms found in {@code text}, in {@code [0, 1]}.
     */
    public static double overlap(String query, String text) {
        Set<String> queryTerms = new LinkedHashSet<>(tokenize(query));
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        Set<String> textTerms = new LinkedHashSet<>(tokenize(text));
        int hits = 0;
        for (String term : queryTerms) {
            if (textTerms.contains(term)) {
                hits++;
            }
        }
        return (double) hits / queryTerms.size();
    }

    public static String normalizeLabel(String label) {
        return label == null ? "" : label.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "being", "as", "if", "but",
        "not", "no", "you", "your", "we", "our", "they", "their", "he", "she", "his", "her", "my", "me", "i"
    );
}
