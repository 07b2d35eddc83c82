// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.model;

import phylox.util.condition.Condition;

/**
 * A condition type indicating that none of the features of a model's data varies, leaving nothing to model.
 */
public final class NoVariableFeaturesCondition extends Condition {
    NoVariableFeaturesCondition(final String model) {
        super("Model '" + model + "' has no feature with at least two distinct values");
    }
}
