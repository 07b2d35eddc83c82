// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.model;

import phylox.util.condition.Condition;

/**
 * A condition type representing a notice that a feature was left out of a model because it doesn't vary.
 */
public final class ConstantFeatureCondition extends Condition {
    ConstantFeatureCondition(final String model, final String feature, final int stateCount) {
        super("Feature '" + feature + "' of model '" + model + "' has " + stateCount
            + " distinct value(s), leaving it out");
        this.feature = feature;
    }

    /**
     * Retrieves the name of the feature that was left out.
     */
    public String feature() {
        return feature;
    }

    private final String feature;
}
