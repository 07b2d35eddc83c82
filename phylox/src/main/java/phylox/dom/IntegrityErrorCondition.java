// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import phylox.util.condition.Condition;
import org.jetbrains.annotations.NotNull;

/**
 * A condition type representing a failed integrity check of a document.
 * <p>
 * Carries every defect found in the pass, not just the first one; the detailed message lists duplicate identifiers
 * and dangling references separately.
 */
public final class IntegrityErrorCondition extends Condition {
    IntegrityErrorCondition(final @NotNull IntegrityReport report) {
        super("Document integrity check failed");
        this.report = report;
    }

    /**
     * Retrieves the defects found.
     */
    public @NotNull IntegrityReport report() {
        return report;
    }

    @Override
    public @NotNull String detailedMessage() {
        final var builder = new StringBuilder(message());
        final var duplicates = report.duplicateIdentifiers();
        if (!duplicates.isEmpty()) {
            builder.append("\nDuplicate identifiers found:");
            duplicates.forEach((identifier, count) ->
                builder.append("\n - '").append(identifier).append("', defined ").append(count).append(" times"));
        }
        final var dangling = report.danglingReferences();
        if (!dangling.isEmpty()) {
            builder.append("\nReferences to missing identifiers found:");
            for (final var identifier : dangling) {
                builder.append("\n - '").append(identifier).append('\'');
            }
        }
        return builder.toString();
    }

    private final @NotNull IntegrityReport report;
}
