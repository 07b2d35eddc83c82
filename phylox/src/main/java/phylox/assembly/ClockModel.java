// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import phylox.dom.Element;

/**
 * A molecular clock contributing a branch rate model to the document.
 * <p>
 * Each method is called exactly once per build, at the point of the skeleton its name describes; the default
 * implementations contribute nothing.
 */
public interface ClockModel {
    /**
     * Retrieves the name of this clock, unique among the clocks of an analysis.
     */
    String name();

    /**
     * Checks whether rates are identical on all branches.
     */
    boolean isStrict();

    /**
     * Retrieves the identifier of the branch rate model element this clock defines.
     */
    String branchRateModelId();

    default void addBranchRateModel(final Element beast, final BuildSession session) {
    }

    default void addState(final Element state, final BuildSession session) {
    }

    default void addPrior(final Element prior, final BuildSession session) {
    }

    default void addOperators(final Element run, final BuildSession session) {
    }

    default void addParameterLogs(final Element logger, final BuildSession session) {
    }
}
