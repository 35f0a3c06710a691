package com.sportsync.resolution.similarity;

/**
 * Levenshtein edit distance and the similarity ratio derived from it.
 */
public class EditDistance implements SimilarityAlgorithm {

    /**
     * Number of single-character insertions, deletions or substitutions turning {@code a} into {@code b}.
     */
    public static int between(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        int[] prev = new int[shorter.length() + 1];
        int[] curr = new int[shorter.length() + 1];
        for (int i = 0; i < prev.length; i++) {
            prev[i] = i;
        }
        for (int j = 1; j <= longer.length(); j++) {
            curr[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitute = prev[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                curr[i] = Math.min(substitute, Math.min(prev[i], curr[i - 1]) + 1);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[shorter.length()];
    }

    /**
     * True when the two strings are at most {@code maxDistance} edits apart.
     */
    public static boolean within(String a, String b, int maxDistance) {
        if (a == null || b == null) {
            return false;
        }
        if (Math.abs(a.length() - b.length()) > maxDistance) {
            return false;
        }
        return between(a, b) <= maxDistance;
    }

    @Override
    public double compute(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) between(a, b) / longest;
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }
}
