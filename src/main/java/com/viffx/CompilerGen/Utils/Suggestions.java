package com.viffx.CompilerGen.Utils;

import java.util.Collection;
import java.util.Locale;
import java.util.TreeSet;

/**
 * "Did you mean" hints for undeclared identifiers.
 */
public final class Suggestions {
    private Suggestions() {}

    /**
     * Returns the candidate closest to {@code name} by case-insensitive edit distance, or
     * {@code null} if none is within {@code maxDistance}. Ties go to the candidate seen first.
     */
    public static String closest(String name, Collection<String> candidates, int maxDistance) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        String target = name.toLowerCase(Locale.ROOT);
        for (String candidate : candidates) {
            int distance = levenshtein(target, candidate.toLowerCase(Locale.ROOT));
            if (distance <= maxDistance && distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }

    /**
     * Builds the hint for an undeclared {@code name}: the closest candidate, otherwise the
     * declared names in order, otherwise an empty string.
     */
    public static String hint(String name, Collection<String> declared, int maxDistance) {
        String closest = closest(name, declared, maxDistance);
        if (closest != null) return "did you mean '" + closest + "'?";
        if (declared.isEmpty()) return "";
        return "declared identifiers: " + String.join(", ", new TreeSet<>(declared));
    }

    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) previous[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
