// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * The plate construct: a compact notation for a repetition over a literal range of values.
 * <p>
 * A plate declares a substitution variable {@code var} and a comma-separated {@code range}. Attribute values of its
 * <em>direct</em> children may contain the placeholder {@code $(var)}; such a child stands for one instance per range
 * value, with the placeholder substituted. Grandchildren are not expanded, and neither are plates nested inside other
 * plates.
 */
public final class Plate extends Element {
    private Plate(final @NotNull String variable, final @NotNull List<@NotNull String> range) {
        super(Tag.PLATE.xmlName(), Attributes.of(
            Attribute.of(VARIABLE, variable),
            Attribute.of(RANGE, String.join(",", range))
        ));
        this.variable = variable;
        this.range = range;
    }

    /**
     * Returns a new detached plate over the given values, in the given order.
     *
     * @throws IllegalArgumentException if the variable is empty, the range is empty, or any value is empty or
     *                                  contains a comma.
     */
    public static @NotNull Plate of(final @NotNull String variable, final @NotNull Collection<@NotNull String> range) {
        if (variable.isEmpty()) {
            throw new IllegalArgumentException("Plate variable cannot be empty");
        }
        if (range.isEmpty()) {
            throw new IllegalArgumentException("Plate range cannot be empty");
        }
        for (final var value : range) {
            if (value.isEmpty() || value.indexOf(',') >= 0) {
                throw new IllegalArgumentException("Invalid plate range value: '" + value + '\'');
            }
        }
        return new Plate(variable, List.copyOf(range));
    }

    /**
     * Retrieves the substitution variable name.
     */
    public @NotNull String variable() {
        return variable;
    }

    /**
     * Retrieves the range values, in declaration order.
     */
    public @NotNull List<@NotNull String> range() {
        return range;
    }

    /**
     * Retrieves the placeholder token standing for the variable, {@code $(var)}.
     */
    public @NotNull String placeholder() {
        return "$(" + variable + ')';
    }

    /**
     * Expands the given attribute value: returns one string per range value, with every occurrence of the
     * placeholder replaced by that value.
     * <p>
     * A value without the placeholder yields the same string once per range value.
     */
    public @NotNull List<@NotNull String> expand(final @NotNull String template) {
        final var placeholder = placeholder();
        final var result = new ArrayList<@NotNull String>(range.size());
        for (final var value : range) {
            result.add(template.replace(placeholder, value));
        }
        return result;
    }

    /**
     * Sets the given attribute.
     *
     * @throws IllegalArgumentException if the attribute is the variable or the range, which are fixed at creation.
     */
    @Override
    public @NotNull Plate set(final @NotNull Attribute attribute) {
        final var name = attribute.name();
        if (VARIABLE.equals(name) || RANGE.equals(name)) {
            throw new IllegalArgumentException("The '" + name + "' attribute of a plate cannot be changed");
        }
        super.set(attribute);
        return this;
    }

    static final String VARIABLE = "var";
    static final String RANGE = "range";

    private final @NotNull String variable;
    private final @NotNull List<@NotNull String> range;
}
