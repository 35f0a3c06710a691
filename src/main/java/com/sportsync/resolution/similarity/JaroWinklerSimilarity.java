package com.sportsync.resolution.similarity;

/**
 * Jaro-Winkler similarity. Rewards a shared prefix, which suits given-name-first player names.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final int PREFIX_CAP = 4;

    private final double prefixScale;

    public JaroWinklerSimilarity() {
        this(0.1);
    }

    public JaroWinklerSimilarity(double prefixScale) {
        if (prefixScale < 0 || prefixScale > 0.25) {
            throw new IllegalArgumentException("prefixScale must be in [0, 0.25]");
        }
        this.prefixScale = prefixScale;
    }

    @Override
    public double compute(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        double jaro = jaro(a, b);
        int prefix = 0;
        int limit = Math.min(PREFIX_CAP, Math.min(a.length(), b.length()));
        while (prefix < limit && a.charAt(prefix) == b.charAt(prefix)) {
            prefix++;
        }
        return jaro + prefix * prefixScale * (1.0 - jaro);
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    private static double jaro(String a, String b) {
        int window = Math.max(0, Math.max(a.length(), b.length()) / 2 - 1);
        boolean[] takenB = new boolean[b.length()];
        char[] matchedA = new char[Math.min(a.length(), b.length())];
        int matches = 0;

        for (int i = 0; i < a.length() && matches < matchedA.length; i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(b.length() - 1, i + window);
            for (int j = from; j <= to; j++) {
                if (!takenB[j] && a.charAt(i) == b.charAt(j)) {
                    takenB[j] = true;
                    matchedA[matches++] = a.charAt(i);
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int k = 0;
        for (int j = 0; j < b.length(); j++) {
            if (takenB[j]) {
                if (b.charAt(j) != matchedA[k]) {
                    halfTranspositions++;
                }
                k++;
            }
        }
        double m = matches;
        return (m / a.length() + m / b.length() + (m - halfTranspositions / 2.0) / m) / 3.0;
    }
}
