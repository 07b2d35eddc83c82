// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import org.jetbrains.annotations.NotNull;

/**
 * A typed representation of an element's attribute.
 * <p>
 * Identifiers and references are distinct types rather than strings following a naming convention. The raw string
 * form, where a reference is either a value prefixed with {@code '@'} or the value of an {@code idref} attribute, only
 * exists at the serialization boundary, see {@link #encodedValue()} and {@link #decode(String, String)}.
 */
public abstract sealed class Attribute {
    private Attribute(final @NotNull String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Attribute names cannot be empty");
        }
        this.name = name;
    }

    /**
     * Returns a new literal attribute with the given string value.
     *
     * @throws IllegalArgumentException if {@code name} is reserved for identifiers or references, or if the value
     *                                  would read back as a reference.
     */
    public static @NotNull Literal of(final @NotNull String name, final @NotNull String value) {
        return new Literal(name, value);
    }

    /**
     * Returns a new literal attribute with the given integer value.
     */
    public static @NotNull Literal of(final @NotNull String name, final long value) {
        return new Literal(name, Long.toString(value));
    }

    /**
     * Returns a new literal attribute with the given decimal value.
     */
    public static @NotNull Literal of(final @NotNull String name, final double value) {
        return new Literal(name, Double.toString(value));
    }

    /**
     * Returns a new literal attribute with the value {@code "true"} or {@code "false"}.
     */
    @SuppressWarnings("BooleanParameter")
    public static @NotNull Literal of(final @NotNull String name, final boolean value) {
        return new Literal(name, value ? "true" : "false");
    }

    /**
     * Returns a new {@code id} attribute defining the given identifier.
     */
    public static @NotNull Identifier id(final @NotNull String identifier) {
        return new Identifier(identifier);
    }

    /**
     * Returns a new attribute named {@code name} referring to the given identifier.
     * <p>
     * The reference is encoded with the {@code '@'} sigil, unless the attribute is named {@code idref}, whose value
     * is the bare identifier.
     */
    public static @NotNull Reference ref(final @NotNull String name, final @NotNull String target) {
        return new Reference(name, target, IDREF.equals(name) ? Reference.Form.IDREF : Reference.Form.SIGIL);
    }

    /**
     * Returns a new {@code idref} attribute referring to the given identifier.
     */
    public static @NotNull Reference idref(final @NotNull String target) {
        return new Reference(IDREF, target, Reference.Form.IDREF);
    }

    /**
     * Decodes the raw string form of an attribute, as found in a serialized document.
     */
    public static @NotNull Attribute decode(final @NotNull String name, final @NotNull String rawValue) {
        if (ID.equals(name)) {
            return id(rawValue);
        } else if (IDREF.equals(name)) {
            return idref(rawValue);
        } else if (rawValue.length() > 1 && rawValue.charAt(0) == SIGIL) {
            return new Reference(name, rawValue.substring(1), Reference.Form.SIGIL);
        } else {
            return new Literal(name, rawValue);
        }
    }

    /**
     * Retrieves the name of this attribute.
     */
    public final @NotNull String name() {
        return name;
    }

    /**
     * Retrieves the raw string form of this attribute's value, as written to a serialized document.
     */
    public abstract @NotNull String encodedValue();

    @Override
    public final @NotNull String toString() {
        return name + "=\"" + encodedValue() + '"';
    }

    static final String ID = "id";
    static final String IDREF = "idref";
    static final char SIGIL = '@';

    private final @NotNull String name;

    /**
     * An attribute with a plain value that neither defines nor refers to an identifier.
     */
    public static final class Literal extends Attribute {
        private Literal(final @NotNull String name, final @NotNull String value) {
            super(name);
            if (ID.equals(name) || IDREF.equals(name)) {
                throw new IllegalArgumentException("Attribute '" + name + "' cannot hold a literal value");
            }
            if (value.length() > 1 && value.charAt(0) == SIGIL) {
                throw new IllegalArgumentException(
                    "Literal value of attribute '" + name + "' would read back as a reference: " + value);
            }
            this.value = value;
        }

        /**
         * Retrieves the value of this attribute.
         */
        public @NotNull String value() {
            return value;
        }

        @Override
        public @NotNull String encodedValue() {
            return value;
        }

        private final @NotNull String value;
    }

    /**
     * The {@code id} attribute, defining an identifier that must be unique within a document.
     */
    public static final class Identifier extends Attribute {
        private Identifier(final @NotNull String identifier) {
            super(ID);
            if (identifier.isEmpty()) {
                throw new IllegalArgumentException("Identifiers cannot be empty");
            }
            this.identifier = identifier;
        }

        /**
         * Retrieves the defined identifier. Inside a plate, it may contain the plate's placeholder.
         */
        public @NotNull String identifier() {
            return identifier;
        }

        @Override
        public @NotNull String encodedValue() {
            return identifier;
        }

        private final @NotNull String identifier;
    }

    /**
     * An attribute referring to an identifier defined elsewhere in the document.
     */
    public static final class Reference extends Attribute {
        private Reference(final @NotNull String name, final @NotNull String target, final @NotNull Form form) {
            super(name);
            if (ID.equals(name)) {
                throw new IllegalArgumentException("Attribute 'id' cannot hold a reference");
            }
            if (target.isEmpty()) {
                throw new IllegalArgumentException("Reference targets cannot be empty");
            }
            this.target = target;
            this.form = form;
        }

        /**
         * Retrieves the identifier this reference points to.
         */
        public @NotNull String target() {
            return target;
        }

        /**
         * Retrieves the way this reference is encoded.
         */
        public @NotNull Form form() {
            return form;
        }

        @Override
        public @NotNull String encodedValue() {
            return (form == Form.SIGIL) ? SIGIL + target : target;
        }

        private final @NotNull String target;
        private final @NotNull Form form;

        /**
         * The two ways a reference appears in a serialized document.
         */
        public enum Form {
            /**
             * The value of an arbitrary attribute, prefixed with {@code '@'}.
             */
            SIGIL,
            /**
             * The bare value of an {@code idref} attribute. Inside a plate, such references are expanded like
             * identifiers are.
             */
            IDREF,
        }
    }
}
