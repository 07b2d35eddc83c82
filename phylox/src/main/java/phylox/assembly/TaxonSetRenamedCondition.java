// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import phylox.util.condition.Condition;

/**
 * A condition type noting that a taxon set was given a different identifier than requested.
 * <p>
 * A single-language taxon set cannot be labeled with the name of its only language, because the language itself
 * already owns that identifier.
 */
public final class TaxonSetRenamedCondition extends Condition {
    TaxonSetRenamedCondition(final String requestedLabel, final String actualLabel) {
        super("Taxon set '" + requestedLabel + "' renamed to '" + actualLabel + '\'');
        this.requestedLabel = requestedLabel;
        this.actualLabel = actualLabel;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nA taxon set with the single member '" + requestedLabel
            + "' cannot share that member's identifier.";
    }

    public String requestedLabel() {
        return requestedLabel;
    }

    public String actualLabel() {
        return actualLabel;
    }

    private final String requestedLabel;
    private final String actualLabel;
}
