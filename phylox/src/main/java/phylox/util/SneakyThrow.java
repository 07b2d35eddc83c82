// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.util;

import org.jetbrains.annotations.NotNull;

/**
 * Facilities for throwing checked throwables without declaring them.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as if it were unchecked, regardless of its static and dynamic type.
     * <p>
     * Reserved for throwables that cross many frames that have no business declaring them, namely
     * {@link phylox.util.condition.Unwind} and {@link InterruptedException}.
     * <p>
     * Never returns normally; the declared return type lets call sites write {@code throw SneakyThrow.doThrow(t)} so
     * that the compiler sees the control flow end there.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is inferred as RuntimeException at the call site, while the cast itself is erased.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
