package com.spreadsheet.fgraph.engine;

import java.util.Properties;

/**
 * Evaluation settings. Immutable; build with {@link #builder()}.
 *
 * <p>
 * By default cycles are errors. With iterative solving enabled a cycle is
 * re-evaluated until every member changes by less than {@code tolerance} or
 * {@code maxIterations} sweeps (the first pass included) have run.
 */
public final class EvaluationConfig {
    public static final String CYCLES_ENABLED = "formulagraph.cycles.enabled";
    public static final String CYCLES_MAX_ITERATIONS = "formulagraph.cycles.maxIterations";
    public static final String CYCLES_TOLERANCE = "formulagraph.cycles.tolerance";

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 0.001;

    /** Cycles are errors. */
    public static final EvaluationConfig DEFAULT = builder().build();

    private final boolean iterative;
    private final int maxIterations;
    private final double tolerance;

    private EvaluationConfig(Builder b) {
        this.iterative = b.iterative;
        this.maxIterations = b.maxIterations;
        this.tolerance = b.tolerance;
    }

    /** Iterative solving enabled with the given limits. */
    public static EvaluationConfig cycles(int maxIterations, double tolerance) {
        return builder().iterative(true).maxIterations(maxIterations).tolerance(tolerance).build();
    }

    /**
     * Reads {@code formulagraph.cycles.*} keys; missing keys keep their
     * defaults.
     *
     * @throws IllegalArgumentException on unparseable or out of range values
     */
    public static EvaluationConfig fromProperties(Properties props) {
        Builder b = builder();
        String enabled = props.getProperty(CYCLES_ENABLED);
        if (enabled != null)
            b.iterative(Boolean.parseBoolean(enabled.trim()));
        String max = props.getProperty(CYCLES_MAX_ITERATIONS);
        try {
            if (max != null)
                b.maxIterations(Integer.parseInt(max.trim()));
            String tol = props.getProperty(CYCLES_TOLERANCE);
            if (tol != null)
                b.tolerance(Double.parseDouble(tol.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid formulagraph.cycles setting: " + e.getMessage(), e);
        }
        return b.build();
    }

    public boolean iterative() {
        return iterative;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public double tolerance() {
        return tolerance;
    }

    public Builder toBuilder() {
        return builder().iterative(iterative).maxIterations(maxIterations).tolerance(tolerance);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EvaluationConfig[iterative=" + iterative + ", maxIterations=" + maxIterations + ", tolerance="
                + tolerance + "]";
    }

    public static final class Builder {
        private boolean iterative;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double tolerance = DEFAULT_TOLERANCE;

        private Builder() {
        }

        public Builder iterative(boolean iterative) {
            this.iterative = iterative;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public EvaluationConfig build() {
            if (maxIterations < 1)
                throw new IllegalArgumentException("maxIterations must be >= 1, got " + maxIterations);
            if (!(tolerance >= 0.0))
                throw new IllegalArgumentException("tolerance must be >= 0, got " + tolerance);
            return new EvaluationConfig(this);
        }
    }
}
