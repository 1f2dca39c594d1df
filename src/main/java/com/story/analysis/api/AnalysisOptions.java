package com.story.analysis.api;

/**
 * Options for scenario analysis.
 * Bounds path selection and state-space exploration and switches the optional stages.
 */
public class AnalysisOptions {

    private static final int DEFAULT_MAX_PATHS = 100;
    private static final int DEFAULT_MAX_DEPTH = 50;

    private final int maxPaths;
    private final int maxDepth;
    private final boolean stateSpaceEnabled;
    private final boolean continuityCheckEnabled;

    private AnalysisOptions(Builder builder) {
        this.maxPaths = builder.maxPaths;
        this.maxDepth = builder.maxDepth;
        this.stateSpaceEnabled = builder.stateSpaceEnabled;
        this.continuityCheckEnabled = builder.continuityCheckEnabled;
    }

    /**
     * Maximum number of paths enumerated or selected for evaluation.
     */
    public int getMaxPaths() {
        return maxPaths;
    }

    /**
     * Maximum number of transitions explored from the start scene in the state space.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isStateSpaceEnabled() {
        return stateSpaceEnabled;
    }

    public boolean isContinuityCheckEnabled() {
        return continuityCheckEnabled;
    }

    /**
     * Creates default options.
     */
    public static AnalysisOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options for large scenarios where coverage matters more than cost.
     */
    public static AnalysisOptions exhaustive() {
        return builder()
                .maxPaths(10_000)
                .maxDepth(500)
                .build();
    }

    /**
     * Creates options that keep the number of evaluated paths small.
     */
    public static AnalysisOptions conservative() {
        return builder()
                .maxPaths(20)
                .maxDepth(25)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxPaths = DEFAULT_MAX_PATHS;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private boolean stateSpaceEnabled = true;
        private boolean continuityCheckEnabled = true;

        public Builder maxPaths(int maxPaths) {
            if (maxPaths <= 0) {
                throw new IllegalArgumentException("maxPaths must be positive");
            }
            this.maxPaths = maxPaths;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth <= 0) {
                throw new IllegalArgumentException("maxDepth must be positive");
            }
            this.maxDepth = maxDepth;
            return this;
        }

        /**
         * When disabled, selected paths come straight from the scene graph instead of the merged state graph.
         */
        public Builder stateSpaceEnabled(boolean stateSpaceEnabled) {
            this.stateSpaceEnabled = stateSpaceEnabled;
            return this;
        }

        public Builder continuityCheckEnabled(boolean continuityCheckEnabled) {
            this.continuityCheckEnabled = continuityCheckEnabled;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }

    @Override
    public String toString() {
        return "AnalysisOptions{" +
                "maxPaths=" + maxPaths +
                ", maxDepth=" + maxDepth +
                ", stateSpaceEnabled=" + stateSpaceEnabled +
                ", continuityCheckEnabled=" + continuityCheckEnabled +
                '}';
    }
}
