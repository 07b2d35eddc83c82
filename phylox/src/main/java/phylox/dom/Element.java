// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An element node: a name, ordered attributes, ordered children and optional inline text.
 * <p>
 * Elements are built incrementally. The order in which attributes and children are added is the order in which they
 * are serialized, and is considered part of the content.
 */
public sealed class Element extends Node permits Plate {
    Element(final @NotNull String name, final @NotNull Attributes attributes) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Element names cannot be empty");
        }
        this.name = name;
        this.attributes = attributes.copy();
    }

    /**
     * Returns a new detached element with the given name and attributes, and no children.
     * <p>
     * Use this for elements whose structure the document skeleton doesn't prescribe.
     */
    public static @NotNull Element of(final @NotNull String name, final @NotNull Attributes attributes) {
        if (Tag.PLATE.xmlName().equals(name)) {
            throw new IllegalArgumentException("Plates must be created with Plate.of");
        }
        return new Element(name, attributes);
    }

    /**
     * Returns a new detached element representing the given tag.
     *
     * @throws IllegalArgumentException if any of the tag's required attributes is missing.
     */
    public static @NotNull Element of(final @NotNull Tag tag, final @NotNull Attributes attributes) {
        tag.checkRequiredAttributes(attributes);
        return of(tag.xmlName(), attributes);
    }

    /**
     * Retrieves the name of this element.
     */
    public final @NotNull String name() {
        return name;
    }

    /**
     * Retrieves the attributes of this element. Elements own a private copy of the attributes they were created
     * with; use {@link #set(Attribute)} to change them.
     */
    public final @NotNull Attributes attributes() {
        return attributes;
    }

    /**
     * Retrieves the children of this element, in order. The returned list cannot be modified.
     */
    public final @NotNull List<@NotNull Node> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Retrieves the inline text of this element, or {@code null} if it has none.
     * <p>
     * Inline text always precedes the children.
     */
    public final @Nullable String text() {
        return text;
    }

    /**
     * Sets or, if {@code text} is {@code null} or empty, clears the inline text of this element.
     *
     * @throws IllegalArgumentException if {@code text} is whitespace-only and this element has children, since such
     *                                  text cannot be told apart from indentation once serialized.
     */
    public final @NotNull Element setText(final @Nullable String text) {
        if (text != null && !text.isEmpty() && text.isBlank() && !children.isEmpty()) {
            throw new IllegalArgumentException(
                "Element " + describe() + " has children and cannot hold whitespace-only text");
        }
        this.text = (text == null || text.isEmpty()) ? null : text;
        return this;
    }

    /**
     * Sets the given attribute, replacing the value of an attribute with the same name in place, or appending it
     * otherwise.
     */
    public @NotNull Element set(final @NotNull Attribute attribute) {
        attributes.set(attribute);
        return this;
    }

    /**
     * Retrieves the attribute with the given name, or {@code null} if it's not present.
     */
    public final @Nullable Attribute get(final @NotNull String attributeName) {
        return attributes.get(attributeName);
    }

    /**
     * Retrieves the identifier defined by this element, or {@code null} if it has none.
     */
    public final @Nullable String id() {
        return (attributes.get(Attribute.ID) instanceof Attribute.Identifier identifier)
            ? identifier.identifier()
            : null;
    }

    /**
     * Appends the given detached node as the last child of this element and returns it.
     *
     * @throws IllegalStateException    if the node already has a parent.
     * @throws IllegalArgumentException if the node is this element or one of its ancestors, or if this element holds
     *                                  whitespace-only text.
     */
    public final <N extends Node> @NotNull N append(final @NotNull N child) {
        if (text != null && text.isBlank()) {
            throw new IllegalArgumentException(
                "Element " + describe() + " holds whitespace-only text and cannot have children");
        }
        for (Element ancestor = this; ancestor != null; ancestor = ancestor.parent()) {
            if (ancestor == child) {
                throw new IllegalArgumentException("Element " + child.describe() + " cannot become its own descendant");
            }
        }
        child.attachTo(this);
        children.add(child);
        return child;
    }

    /**
     * Appends a new element with the given name and attributes and returns it.
     */
    public final @NotNull Element appendElement(final @NotNull String name, final @NotNull Attributes attributes) {
        return append(of(name, attributes));
    }

    /**
     * Appends a new element representing the given tag and returns it.
     */
    public final @NotNull Element appendElement(final @NotNull Tag tag, final @NotNull Attributes attributes) {
        return append(of(tag, attributes));
    }

    /**
     * Appends a new comment with the given text and returns it.
     */
    public final @NotNull Comment appendComment(final @NotNull String text) {
        return append(new Comment(text));
    }

    /**
     * Returns the child elements of this element with the given name, in order.
     */
    public final @NotNull List<@NotNull Element> childElements(final @NotNull String elementName) {
        final var result = new ArrayList<@NotNull Element>();
        for (final var child : children) {
            if (child instanceof Element element && element.name.equals(elementName)) {
                result.add(element);
            }
        }
        return result;
    }

    @Override
    public final void traverse(final @NotNull Consumer<? super Node> action) {
        action.accept(this);
        for (final var child : children) {
            child.traverse(action);
        }
    }

    @Override
    final @NotNull String describe() {
        final var id = id();
        return (id != null) ? '<' + name + " id=\"" + id + "\">" : '<' + name + '>';
    }

    private final @NotNull String name;
    private final @NotNull Attributes attributes;
    private final ArrayList<@NotNull Node> children = new ArrayList<>();
    private @Nullable String text = null;
}
