// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.TreeSet;
import phylox.dom.Attribute;
import phylox.dom.Attributes;
import phylox.dom.Element;
import phylox.dom.Plate;
import phylox.dom.Tag;
import phylox.util.annotation.Nullable;
import phylox.util.condition.ConditionContext;

/**
 * Creates taxon sets, reusing an existing one whenever the same set of languages is requested again.
 * <p>
 * Entries are keyed by the exact normalized member set: sorted, without duplicates. There is no subset or superset
 * matching. A cache belongs to one {@link BuildSession} and is discarded with it.
 */
public final class TaxonSetCache {
    /**
     * Initializes a new, empty cache.
     */
    public TaxonSetCache() {
    }

    /**
     * Appends a taxon set with the given members to {@code parent} and returns the appended element.
     * <p>
     * If a taxon set with exactly the same members was created before, the appended element is merely a
     * {@code <taxonset idref="…"/>} reference to it, and {@code label} is ignored. Otherwise a new taxon set with the
     * identifier {@code label} is created, except that a single-member set labeled with its own member's name is
     * renamed to {@code tx_<label>}, signaling a {@link TaxonSetRenamedCondition}.
     * <p>
     * Sets of more than {@value #plateThreshold} members are written as a single plate over the sorted members;
     * smaller sets list their members one by one, in sorted order. With {@code defineMembers}, the members are
     * defined as taxa, which must happen exactly once per document, where the canonical language list is declared;
     * otherwise they're referenced.
     * <p>
     * An empty member set signals a fatal {@link EmptyTaxonSetCondition} before anything is appended.
     */
    public Element add(
        final Element parent,
        final String label,
        final Collection<String> members,
        final boolean defineMembers
    ) {
        final var normalized = List.copyOf(new TreeSet<>(members));
        if (normalized.isEmpty()) {
            throw ConditionContext.error(new EmptyTaxonSetCondition(label));
        }

        final var existing = labelsByMembers.get(normalized);
        if (existing != null) {
            return parent.appendElement(Tag.TAXONSET, Attributes.of(Attribute.idref(existing)));
        }

        var actualLabel = label;
        if (normalized.size() == 1 && label.equals(normalized.get(0))) {
            actualLabel = renamedPrefix + label;
            ConditionContext.signal(new TaxonSetRenamedCondition(label, actualLabel));
        }

        final var taxonSet = parent.appendElement(
            Tag.TAXONSET,
            Attributes.builder().id(actualLabel).set("spec", "TaxonSet").build()
        );
        if (normalized.size() > plateThreshold) {
            final var plate = taxonSet.append(Plate.of(plateVariable, normalized));
            plate.appendElement(Tag.TAXON, Attributes.of(memberAttribute(plate.placeholder(), defineMembers)));
        } else {
            for (final var member : normalized) {
                taxonSet.appendElement(Tag.TAXON, Attributes.of(memberAttribute(member, defineMembers)));
            }
        }
        labelsByMembers.put(normalized, actualLabel);
        return taxonSet;
    }

    /**
     * Retrieves the identifier of the taxon set created for exactly the given members, or {@code null} if there is
     * none yet.
     */
    public @Nullable String lookup(final Collection<String> members) {
        return labelsByMembers.get(List.copyOf(new TreeSet<>(members)));
    }

    /**
     * Retrieves the number of distinct taxon sets created so far.
     */
    public int size() {
        return labelsByMembers.size();
    }

    @SuppressWarnings("BooleanParameter")
    private static Attribute memberAttribute(final String member, final boolean define) {
        return define ? Attribute.id(member) : Attribute.idref(member);
    }

    /**
     * Taxon sets with more members than this are written using plate notation.
     */
    public static final int plateThreshold = 3;
    private static final String plateVariable = "language";
    private static final String renamedPrefix = "tx_";

    private final HashMap<List<String>, String> labelsByMembers = new HashMap<>();
}
