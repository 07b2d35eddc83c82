// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import phylox.util.annotation.Nullable;

/**
 * Settings of the run and its output files.
 *
 * @param chainLength      The number of MCMC iterations.
 * @param sampleFromPrior  Whether to ignore the data and sample from the prior only.
 * @param logEvery         The logging interval, in iterations.
 * @param screenLog        Whether to log progress to the screen.
 * @param logProbabilities Whether to log the prior, likelihood and posterior.
 * @param logParameters    Whether to log model parameters.
 * @param logTrees         Whether to log trees.
 * @param logPureTree      Whether to log a tree without branch rates when rates are logged with the trees.
 * @param logDecimalPlaces The number of decimal places of logged branch lengths.
 * @param embedData        Whether to embed data files in the document as comments.
 * @param basename         The base name of output files.
 * @param pathSampling     The path sampling settings, or {@code null} for a standard run.
 */
public record RunSettings(
    long chainLength,
    boolean sampleFromPrior,
    long logEvery,
    boolean screenLog,
    boolean logProbabilities,
    boolean logParameters,
    boolean logTrees,
    boolean logPureTree,
    int logDecimalPlaces,
    boolean embedData,
    String basename,
    @Nullable PathSampling pathSampling
) {
    public RunSettings {
        if (chainLength < 1) {
            throw new IllegalArgumentException("Chain length must be positive, got " + chainLength);
        }
        if (logEvery < 1) {
            throw new IllegalArgumentException("Logging interval must be positive, got " + logEvery);
        }
    }

    /**
     * Returns a builder initialized with the default settings.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default settings.
     */
    public static RunSettings defaults() {
        return builder().build();
    }

    /**
     * Returns the name of an output file with the given suffix, such as {@code ".log"}.
     */
    public String path(final String suffix) {
        return basename + suffix;
    }

    /**
     * Builds {@link RunSettings}. Unless set explicitly, the logging interval is derived from the chain length so
     * that every log holds about {@value #defaultSamples} samples.
     */
    public static final class Builder {
        private Builder() {
        }

        public Builder chainLength(final long chainLength) {
            this.chainLength = chainLength;
            return this;
        }

        @SuppressWarnings("BooleanParameter")
        public Builder sampleFromPrior(final boolean sampleFromPrior) {
            this.sampleFromPrior = sampleFromPrior;
            return this;
        }

        public Builder logEvery(final long logEvery) {
            this.logEvery = logEvery;
            return this;
        }

        @SuppressWarnings("BooleanParameter")
        public Builder screenLog(final boolean screenLog) {
            this.screenLog = screenLog;
            return this;
        }

        @SuppressWarnings("BooleanParameter")
        public Builder logProbabilities(final boolean logProbabilities) {
            this.logProbabilities = logProbabilities;
            return this;
        }

        @SuppressWarnings("BooleanParameter")
        public Builder logParameters(final boolean logParameters) {
            this.logParameters = logParameters;
            return this;
        }

        @SuppressWarnings("BooleanParameter")
        public Builder logTrees(final boolean logTrees) {
            this.logTrees = logTrees;
            return this;
        }

        @SuppressWarnings("BooleanParameter")
        public Builder logPureTree(final boolean logPureTree) {
            this.logPureTree = logPureTree;
            return this;
        }

        public Builder logDecimalPlaces(final int logDecimalPlaces) {
            this.logDecimalPlaces = logDecimalPlaces;
            return this;
        }

        @SuppressWarnings("BooleanParameter")
        public Builder embedData(final boolean embedData) {
            this.embedData = embedData;
            return this;
        }

        public Builder basename(final String basename) {
            this.basename = basename;
            return this;
        }

        public Builder pathSampling(final @Nullable PathSampling pathSampling) {
            this.pathSampling = pathSampling;
            return this;
        }

        public RunSettings build() {
            final var interval = (logEvery > 0) ? logEvery : Math.max(1, chainLength / defaultSamples);
            return new RunSettings(
                chainLength,
                sampleFromPrior,
                interval,
                screenLog,
                logProbabilities,
                logParameters,
                logTrees,
                logPureTree,
                logDecimalPlaces,
                embedData,
                basename,
                pathSampling
            );
        }

        private static final long defaultSamples = 10_000;

        private long chainLength = 10_000_000;
        private boolean sampleFromPrior = false;
        private long logEvery = 0;
        private boolean screenLog = true;
        private boolean logProbabilities = true;
        private boolean logParameters = true;
        private boolean logTrees = true;
        private boolean logPureTree = false;
        private int logDecimalPlaces = 4;
        private boolean embedData = false;
        private String basename = "beast";
        private @Nullable PathSampling pathSampling = null;
    }
}
