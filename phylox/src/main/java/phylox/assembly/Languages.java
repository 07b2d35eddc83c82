// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import java.util.List;
import phylox.util.annotation.Nullable;

/**
 * The languages an analysis covers, which become the taxa of the document.
 *
 * @param languages       The language identifiers, in no particular order.
 * @param monophylyNewick A Newick string of monophyly constraints on the languages, or {@code null} for none.
 */
public record Languages(List<String> languages, @Nullable String monophylyNewick) {
    public Languages {
        languages = List.copyOf(languages);
    }

    /**
     * Returns the given languages without monophyly constraints.
     */
    public static Languages of(final List<String> languages) {
        return new Languages(languages, null);
    }
}
