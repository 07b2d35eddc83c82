// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import phylox.dom.Element;

/**
 * The prior over trees, which owns the tree itself.
 */
public interface TreePrior {
    /**
     * Retrieves the identifier of the tree state node, which the rest of the document refers to.
     */
    String treeId();

    /**
     * Estimates a sensible starting height for the tree and records it in the session.
     */
    default void estimateHeight(final BuildSession session) {
    }

    /**
     * Adds the tree and its parameters to the state.
     */
    default void addStateNodes(final Element state, final BuildSession session) {
    }

    /**
     * Adds the initializers of the state nodes to the run.
     */
    default void addInit(final Element run, final BuildSession session) {
    }

    default void addPrior(final Element prior, final BuildSession session) {
    }

    default void addOperators(final Element run, final BuildSession session) {
    }

    default void addLogging(final Element logger, final BuildSession session) {
    }
}
