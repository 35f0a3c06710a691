package com.sportsync.resolution.similarity;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Jaccard overlap of whitespace-separated tokens. Insensitive to word order,
 * so "lakers los angeles" and "los angeles lakers" score 1.0.
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        long shared = left.stream().filter(right::contains).count();
        return (double) shared / (left.size() + right.size() - shared);
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    static Set<String> tokens(String s) {
        return Arrays.stream(s.trim().split("\\s+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }

    static String sortedTokens(String s) {
        return Arrays.stream(s.trim().split("\\s+"))
                .filter(t -> !t.isEmpty())
                .sorted()
                .collect(Collectors.joining(" "));
    }
}
