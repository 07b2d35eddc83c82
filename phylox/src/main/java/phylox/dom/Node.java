// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The base class for document tree nodes.
 * <p>
 * Nodes are owned by exactly one parent, except for the root, which has none. Ownership is established by
 * {@link Element#append(Node)} and cannot be transferred: attaching a node that already has a parent is a
 * programming error.
 * <p>
 * Currently, only elements and comments are supported.
 */
public abstract sealed class Node permits Element, Comment {
    Node() {
    }

    /**
     * Retrieves the element owning this node, or {@code null} if this node is a root or hasn't been attached yet.
     */
    public final @Nullable Element parent() {
        return parent;
    }

    /**
     * Retrieves the plate this node is a direct child of, or {@code null} if its parent isn't a plate.
     * <p>
     * Recorded when the node is attached, so finding plate membership never requires looking at the parent chain.
     */
    public final @Nullable Plate enclosingPlate() {
        return enclosingPlate;
    }

    /**
     * Visits this node and all of its descendants in depth-first pre-order, exactly once each.
     */
    public abstract void traverse(@NotNull Consumer<? super Node> action);

    final void attachTo(final @NotNull Element newParent) {
        if (parent != null) {
            throw new IllegalStateException(
                "Node " + describe() + " is already attached to " + parent.describe());
        }
        parent = newParent;
        enclosingPlate = (newParent instanceof Plate plate) ? plate : null;
    }

    abstract @NotNull String describe();

    private @Nullable Element parent = null;
    private @Nullable Plate enclosingPlate = null;
}
