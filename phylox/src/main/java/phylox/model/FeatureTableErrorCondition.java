// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.model;

import phylox.util.condition.Condition;

/**
 * A condition type indicating that a feature table could not be parsed.
 */
public final class FeatureTableErrorCondition extends Condition {
    FeatureTableErrorCondition(final String rawMessage, final String sourceName, final int lineNumber) {
        super(rawMessage);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
    }

    /**
     * Retrieves the number of the line the error was found on, counting from 1.
     */
    public int lineNumber() {
        return lineNumber;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nat " + sourceName + ", line " + lineNumber;
    }

    private final String sourceName;
    private final int lineNumber;
}
