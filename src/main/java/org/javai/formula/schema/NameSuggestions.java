package org.javai.formula.schema;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Finds the column names closest to a misspelled one.
 */
final class NameSuggestions {

    private static final int MAX_DISTANCE = 2;
    private static final int MAX_SUGGESTIONS = 8;

    private NameSuggestions() {
    }

    /**
     * Names within edit distance 2 of {@code name}, ignoring case, nearest first. The
     * distance limit shrinks until no more than eight names qualify; names at
     * distance 0 are always kept.
     */
    static List<String> nearest(String name, List<String> candidates) {
        String target = name.toUpperCase(Locale.ROOT);
        record Scored(int distance, String name) {
        }
        List<Scored> scored = new ArrayList<>(candidates.size());
        for (String candidate : candidates) {
            scored.add(new Scored(levenshtein(candidate.toUpperCase(Locale.ROOT), target), candidate));
        }
        scored.sort(Comparator.comparingInt(Scored::distance).thenComparing(Scored::name));

        int maxDistance = 0;
        for (int d = MAX_DISTANCE; d > 0; d--) {
            int limit = d;
            if (scored.stream().filter(s -> s.distance() <= limit).count() <= MAX_SUGGESTIONS) {
                maxDistance = d;
                break;
            }
        }
        List<String> nearest = new ArrayList<>();
        for (Scored s : scored) {
            if (s.distance() <= maxDistance) {
                nearest.add(s.name());
            }
        }
        return nearest;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
