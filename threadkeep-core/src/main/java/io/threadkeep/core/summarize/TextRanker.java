package io.threadkeep.core.summarize;

import java.util.Arrays;

/**
 * PageRank-style scoring over a {@link SimilarityGraph}. The iteration count is fixed; there is
 * no convergence test, so cost depends only on the graph size.
 */
public final class TextRanker {
    public static final int DEFAULT_ITERATIONS = 50;
    public static final double DEFAULT_DAMPING = 0.85;

    private final int iterations;
    private final double damping;

    public TextRanker() {
        this(DEFAULT_ITERATIONS, DEFAULT_DAMPING);
    }

    public TextRanker(int iterations, double damping) {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must not be negative");
        }
        if (damping < 0.0 || damping > 1.0) {
            throw new IllegalArgumentException("damping must be within [0, 1]");
        }
        this.iterations = iterations;
        this.damping = damping;
    }

    public double[] rank(SimilarityGraph graph) {
        int n = graph.size();
        if (n == 0) {
            return new double[0];
        }

        double[][] normalized = graph.copyOfWeights();
        for (double[] row : normalized) {
            double sum = 0.0;
            for (double value : row) {
                sum += value;
            }
            if (sum != 0.0) {
                for (int j = 0; j < row.length; j++) {
                    row[j] = row[j] / sum;
                }
            }
        }

        double[] scores = new double[n];
        Arrays.fill(scores, 1.0 / n);
        double restart = (1.0 - damping) / n;
        for (int iteration = 0; iteration < iterations; iteration++) {
            double[] next = new double[n];
            for (int i = 0; i < n; i++) {
                double incoming = 0.0;
                for (int j = 0; j < n; j++) {
                    incoming += normalized[j][i] * scores[j];
                }
                next[i] = restart + damping * incoming;
            }
            scores = next;
        }
        return scores;
    }
}
