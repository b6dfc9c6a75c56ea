package io.threadkeep.core.summarize;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Symmetric word-overlap (Jaccard) matrix over text units. The diagonal is left at zero.
 */
public final class SimilarityGraph {
    static final String CODE_TOKEN = "__code_block__";
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_TOKEN_LENGTH = 3;

    private final double[][] weights;

    private SimilarityGraph(double[][] weights) {
        this.weights = weights;
    }

    public static SimilarityGraph build(List<TextUnit> units) {
        int n = units.size();
        List<Set<String>> tokens = units.stream().map(SimilarityGraph::tokenize).toList();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double similarity = jaccard(tokens.get(i), tokens.get(j));
                matrix[i][j] = similarity;
                matrix[j][i] = similarity;
            }
        }
        return new SimilarityGraph(matrix);
    }

    /**
     * Code units collapse to one shared sentinel token.
     */
    static Set<String> tokenize(TextUnit unit) {
        if (unit.code()) {
            return Set.of(CODE_TOKEN);
        }
        String cleaned = NON_ALPHANUMERIC.matcher(unit.text().toLowerCase(Locale.ROOT)).replaceAll(" ");
        Set<String> tokens = new HashSet<>();
        for (String token : WHITESPACE.split(cleaned)) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String token : left) {
            if (right.contains(token)) {
                intersection++;
            }
        }
        int union = left.size() + right.size() - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }

    public int size() {
        return weights.length;
    }

    public double weight(int from, int to) {
        return weights[from][to];
    }

    double[][] copyOfWeights() {
        double[][] copy = new double[weights.length][];
        for (int i = 0; i < weights.length; i++) {
            copy[i] = Arrays.copyOf(weights[i], weights[i].length);
        }
        return copy;
    }
}
