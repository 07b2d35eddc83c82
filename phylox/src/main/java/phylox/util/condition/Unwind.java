// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable that carries control from {@link Restart#unwindTo()} to its restart point.
 * <p>
 * Public only so that methods can declare it. Do not throw or catch it by hand.
 * <p>
 * Unwinding is neither an error nor an ordinary exceptional situation, so this extends {@link Throwable} directly,
 * which keeps it out of reach of {@code catch (Exception e)} blocks on the way.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
