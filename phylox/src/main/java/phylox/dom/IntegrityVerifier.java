// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;
import phylox.util.Trace;
import phylox.util.condition.ConditionContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The referential integrity verifier.
 * <p>
 * Checks that every identifier in a document is defined exactly once and that every reference resolves to a
 * defined identifier. Plates are taken into account: an identifier on a direct child of a plate defines one
 * identifier per range value, and so does an {@code idref} reference. Sigil references are never expanded; they name
 * a single, fully substituted identifier.
 */
public final class IntegrityVerifier {
    private IntegrityVerifier() {
    }

    /**
     * Verifies the document rooted at {@code root}.
     * <p>
     * If the document is consistent, this method simply returns. Otherwise, a fatal condition of type
     * {@link IntegrityErrorCondition} listing all defects is signaled.
     */
    public static void verify(final @NotNull Element root) {
        try (final var trace = new Trace("Verifying identifiers and references")) {
            trace.use();
            final var report = inspect(root);
            if (!report.isClean()) {
                throw ConditionContext.error(new IntegrityErrorCondition(report));
            }
        }
    }

    /**
     * Collects the defects of the document rooted at {@code root} without signaling anything.
     */
    public static @NotNull IntegrityReport inspect(final @NotNull Element root) {
        final var verifier = new IntegrityVerifier();
        root.traverse(node -> {
            if (node instanceof Element element) {
                verifier.collect(element);
            }
        });
        return verifier.report();
    }

    private void collect(final @NotNull Element element) {
        final var plate = element.enclosingPlate();
        for (final var attribute : element.attributes()) {
            if (attribute instanceof Attribute.Identifier identifier) {
                for (final var name : expand(plate, identifier.identifier())) {
                    definitionCounts.merge(name, 1, Integer::sum);
                }
            } else if (attribute instanceof Attribute.Reference reference) {
                if (reference.form() == Attribute.Reference.Form.IDREF) {
                    references.addAll(expand(plate, reference.target()));
                } else {
                    references.add(reference.target());
                }
            }
        }
    }

    private static @NotNull List<@NotNull String> expand(final @Nullable Plate plate, final @NotNull String value) {
        return (plate != null) ? plate.expand(value) : List.of(value);
    }

    private @NotNull IntegrityReport report() {
        final var duplicates = new TreeMap<@NotNull String, @NotNull Integer>();
        definitionCounts.forEach((identifier, count) -> {
            if (count > 1) {
                duplicates.put(identifier, count);
            }
        });
        final var dangling = new TreeSet<@NotNull String>(references);
        dangling.removeAll(definitionCounts.keySet());
        return new IntegrityReport(duplicates, dangling);
    }

    private final HashMap<@NotNull String, @NotNull Integer> definitionCounts = new HashMap<>();
    private final HashSet<@NotNull String> references = new HashSet<>();
}
