// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import phylox.util.condition.Condition;

/**
 * A condition type representing a request for a taxon set without any members.
 * <p>
 * There's no meaningful empty taxon set, so such a request always means a contributor computed its members wrong.
 */
public final class EmptyTaxonSetCondition extends Condition {
    EmptyTaxonSetCondition(final String label) {
        super("Attempted to create an empty taxon set '" + label + '\'');
        this.label = label;
    }

    /**
     * Retrieves the label the empty taxon set was requested under.
     */
    public String label() {
        return label;
    }

    private final String label;
}
