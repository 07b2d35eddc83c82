// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import java.util.HashMap;

/**
 * The mutable state of one document build: the taxon set cache and the counters behind generated identifiers.
 * <p>
 * Every contributor call receives the session of the build in progress. A session is used by a single thread and
 * never outlives its build, so independent builds never share anything.
 */
public final class BuildSession {
    /**
     * Initializes a new session for building the document described by the given configuration.
     */
    public BuildSession(final AnalysisConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Retrieves the configuration of the document being built.
     */
    public AnalysisConfiguration configuration() {
        return configuration;
    }

    /**
     * Retrieves the taxon set cache of this build.
     */
    public TaxonSetCache taxonSets() {
        return taxonSets;
    }

    /**
     * Returns a fresh identifier of the form {@code prefix.N}, where {@code N} counts from zero separately for each
     * prefix.
     */
    public String nextId(final String prefix) {
        final int index = idCounters.merge(prefix, 1, Integer::sum) - 1;
        return prefix + '.' + index;
    }

    /**
     * Retrieves the starting tree height estimated for this build, or {@code NaN} if none has been estimated.
     */
    public double treeHeight() {
        return treeHeight;
    }

    /**
     * Records the starting tree height estimated by the tree prior.
     */
    public void setTreeHeight(final double treeHeight) {
        this.treeHeight = treeHeight;
    }

    private final AnalysisConfiguration configuration;
    private final TaxonSetCache taxonSets = new TaxonSetCache();
    private final HashMap<String, Integer> idCounters = new HashMap<>();
    private double treeHeight = Double.NaN;
}
