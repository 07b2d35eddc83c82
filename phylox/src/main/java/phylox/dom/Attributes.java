// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The ordered attributes of an element.
 * <p>
 * Order is significant: attributes are serialized in the order they were added. Names are unique; setting an
 * attribute whose name is already present replaces the value in place, keeping its position.
 */
public final class Attributes implements Iterable<@NotNull Attribute> {
    private Attributes(final @NotNull List<@NotNull Attribute> attributes) {
        this.attributes = attributes;
    }

    /**
     * Returns a new, empty attribute collection.
     */
    public static @NotNull Attributes empty() {
        return new Attributes(new ArrayList<>());
    }

    /**
     * Returns a new attribute collection holding the given attributes in order.
     *
     * @throws IllegalArgumentException if two attributes share a name.
     */
    public static @NotNull Attributes of(final @NotNull Attribute... attributes) {
        final var builder = builder();
        for (final var attribute : attributes) {
            builder.add(attribute);
        }
        return builder.build();
    }

    /**
     * Returns a new builder.
     */
    @CheckReturnValue
    public static @NotNull Builder builder() {
        return new Builder();
    }

    /**
     * Retrieves the attribute with the given name, or {@code null} if no such attribute is present.
     */
    public @Nullable Attribute get(final @NotNull String name) {
        final var index = indexOf(name);
        return (index >= 0) ? attributes.get(index) : null;
    }

    /**
     * Retrieves the raw string value of the attribute with the given name, or {@code null} if it's not present.
     */
    public @Nullable String getEncoded(final @NotNull String name) {
        final var attribute = get(name);
        return (attribute != null) ? attribute.encodedValue() : null;
    }

    /**
     * Checks whether an attribute with the given name is present.
     */
    public boolean contains(final @NotNull String name) {
        return indexOf(name) >= 0;
    }

    public int size() {
        return attributes.size();
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    @Override
    public @NotNull Iterator<@NotNull Attribute> iterator() {
        return Collections.unmodifiableList(attributes).iterator();
    }

    @Override
    public @NotNull String toString() {
        return attributes.toString();
    }

    @NotNull Attributes copy() {
        return new Attributes(new ArrayList<>(attributes));
    }

    void set(final @NotNull Attribute attribute) {
        final var index = indexOf(attribute.name());
        if (index >= 0) {
            attributes.set(index, attribute);
        } else {
            attributes.add(attribute);
        }
    }

    private int indexOf(final @NotNull String name) {
        for (int i = 0; i < attributes.size(); i += 1) {
            if (name.equals(attributes.get(i).name())) {
                return i;
            }
        }
        return -1;
    }

    private final @NotNull List<@NotNull Attribute> attributes;

    /**
     * Builds an attribute collection, in the order attributes are added.
     * <p>
     * Adding two attributes with the same name is rejected immediately, since it's always a mistake in the code
     * building the element.
     */
    public static final class Builder {
        private Builder() {
        }

        /**
         * Adds the given attribute.
         *
         * @throws IllegalArgumentException if an attribute with the same name was already added.
         */
        public @NotNull Builder add(final @NotNull Attribute attribute) {
            for (final var existing : attributes) {
                if (existing.name().equals(attribute.name())) {
                    throw new IllegalArgumentException(
                        "Attribute '" + attribute.name() + "' added twice: " + existing + ", " + attribute);
                }
            }
            attributes.add(attribute);
            return this;
        }

        /**
         * Adds the given attribute if {@code condition} holds.
         */
        public @NotNull Builder addIf(final boolean condition, final @NotNull Attribute attribute) {
            return condition ? add(attribute) : this;
        }

        /**
         * Adds an {@code id} attribute defining the given identifier.
         */
        public @NotNull Builder id(final @NotNull String identifier) {
            return add(Attribute.id(identifier));
        }

        /**
         * Adds an {@code idref} attribute referring to the given identifier.
         */
        public @NotNull Builder idref(final @NotNull String target) {
            return add(Attribute.idref(target));
        }

        /**
         * Adds an attribute referring to the given identifier.
         */
        public @NotNull Builder ref(final @NotNull String name, final @NotNull String target) {
            return add(Attribute.ref(name, target));
        }

        public @NotNull Builder set(final @NotNull String name, final @NotNull String value) {
            return add(Attribute.of(name, value));
        }

        public @NotNull Builder set(final @NotNull String name, final long value) {
            return add(Attribute.of(name, value));
        }

        public @NotNull Builder set(final @NotNull String name, final double value) {
            return add(Attribute.of(name, value));
        }

        @SuppressWarnings("BooleanParameter")
        public @NotNull Builder set(final @NotNull String name, final boolean value) {
            return add(Attribute.of(name, value));
        }

        /**
         * Returns a collection holding the attributes added so far.
         */
        public @NotNull Attributes build() {
            return new Attributes(new ArrayList<>(attributes));
        }

        private final ArrayList<@NotNull Attribute> attributes = new ArrayList<>();
    }
}
