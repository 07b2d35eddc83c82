// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jetbrains.annotations.NotNull;

/**
 * The defects found by one pass of the {@link IntegrityVerifier}.
 *
 * @param duplicateIdentifiers Identifiers defined more than once, mapped to the number of definitions.
 * @param danglingReferences   Referenced identifiers that no element defines.
 */
public record IntegrityReport(
    @NotNull SortedMap<@NotNull String, @NotNull Integer> duplicateIdentifiers,
    @NotNull SortedSet<@NotNull String> danglingReferences
) {
    public IntegrityReport {
        duplicateIdentifiers = Collections.unmodifiableSortedMap(new TreeMap<>(duplicateIdentifiers));
        danglingReferences = Collections.unmodifiableSortedSet(new TreeSet<>(danglingReferences));
    }

    /**
     * Checks whether the verified document has no defects at all.
     */
    public boolean isClean() {
        return duplicateIdentifiers.isEmpty() && danglingReferences.isEmpty();
    }
}
