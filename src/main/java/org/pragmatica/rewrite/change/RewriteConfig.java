package org.pragmatica.rewrite.change;

/**
 * Options for running refactorings and rendering their diffs.
 *
 * @param contextLines    unchanged lines shown around each diff hunk
 * @param parallelism     worker threads used by {@link RefactorRunner}
 * @param includeUnchanged whether the runner reports files the pipeline left untouched
 */
public record RewriteConfig(
    int contextLines,
    int parallelism,
    boolean includeUnchanged
) {
    public static final RewriteConfig DEFAULT = new RewriteConfig(
        3,
        Runtime.getRuntime().availableProcessors(),
        false
    );

    public RewriteConfig {
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must not be negative: " + contextLines);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int contextLines = DEFAULT.contextLines();
        private int parallelism = DEFAULT.parallelism();
        private boolean includeUnchanged = DEFAULT.includeUnchanged();

        private Builder() {}

        public Builder contextLines(int contextLines) {
            this.contextLines = contextLines;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder includeUnchanged(boolean includeUnchanged) {
            this.includeUnchanged = includeUnchanged;
            return this;
        }

        public RewriteConfig build() {
            return new RewriteConfig(contextLines, parallelism, includeUnchanged);
        }
    }
}
