// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes an occurrence that code further up the call stack may care about. It can be a mere notice,
 * signaled with {@link ConditionContext#signal(Condition)}, or a fatal problem, signaled with
 * {@link ConditionContext#error(Condition)}. Unlike exceptions, handlers run before anything is unwound.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given short user-readable message.
     */
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Retrieves the short user-readable message of this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable description of this condition, which may span several lines.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
