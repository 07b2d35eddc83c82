// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import java.nio.file.Path;
import java.util.List;
import phylox.dom.Element;
import phylox.util.annotation.Nullable;

/**
 * A model of trait evolution contributing data, likelihoods and parameters to the document.
 * <p>
 * The {@code add*} methods are called exactly once per build, at the point of the skeleton their names describe;
 * the default implementations contribute nothing.
 */
public interface SubstitutionModel {
    /**
     * Retrieves the name of this model, unique among the models of an analysis.
     */
    String name();

    /**
     * Retrieves the clock governing the rates of this model.
     */
    ClockModel clock();

    /**
     * Retrieves the data file this model was read from, embedded in the document when requested, or {@code null}.
     */
    default @Nullable Path dataFile() {
        return null;
    }

    /**
     * Checks whether each feature evolves at its own rate, relative to the clock.
     * <p>
     * Rate-varying models must define a {@code featureClockRate:<name>:<rate>} parameter for each of
     * {@link #allRates()}, which the per-clock rate exchange operator refers to.
     */
    default boolean hasRateVariation() {
        return false;
    }

    /**
     * Retrieves the names of the per-feature rates, for rate-varying models.
     */
    default List<String> allRates() {
        return List.of();
    }

    /**
     * Retrieves the relative weight of each rate in {@link #allRates()}, for rate-varying models.
     */
    default List<Integer> weights() {
        return List.of();
    }

    /**
     * Retrieves the identifiers of per-generation values to write to the trait log.
     */
    default List<String> metadata() {
        return List.of();
    }

    /**
     * Retrieves the identifiers of per-node values to write to the reconstructed trait tree log.
     */
    default List<String> treeData() {
        return List.of();
    }

    default void addMasterData(final Element beast, final BuildSession session) {
    }

    default void addMisc(final Element beast, final BuildSession session) {
    }

    default void addState(final Element state, final BuildSession session) {
    }

    default void addPrior(final Element prior, final BuildSession session) {
    }

    default void addLikelihood(final Element likelihood, final BuildSession session) {
    }

    default void addOperators(final Element run, final BuildSession session) {
    }

    default void addParameterLogs(final Element logger, final BuildSession session) {
    }
}
