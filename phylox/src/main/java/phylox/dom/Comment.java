// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import java.util.function.Consumer;
import org.jetbrains.annotations.NotNull;

/**
 * A comment node.
 * <p>
 * Comment text must be representable in XML as is: it may neither contain {@code "--"} nor end with {@code '-'}.
 */
public final class Comment extends Node {
    /**
     * Initializes a new detached comment with the given text.
     *
     * @throws IllegalArgumentException if the text cannot appear inside an XML comment.
     */
    public Comment(final @NotNull String text) {
        if (text.contains("--") || text.endsWith("-")) {
            throw new IllegalArgumentException("Comment text may not contain \"--\" nor end with '-': " + text);
        }
        this.text = text;
    }

    /**
     * Retrieves the text of this comment.
     */
    public @NotNull String text() {
        return text;
    }

    @Override
    public void traverse(final @NotNull Consumer<? super Node> action) {
        action.accept(this);
    }

    @Override
    @NotNull String describe() {
        return "<!-- comment -->";
    }

    private final @NotNull String text;
}
