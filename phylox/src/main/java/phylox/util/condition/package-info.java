// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Condition and restart system modeled after Common Lisp's.
 * <p>
 * Document assembly reports both notices and fatal problems as conditions. Handlers run before the stack unwinds,
 * so a top-level handler sees the operation {@link phylox.util.Trace traces} that were active at the point of
 * failure, and decides which {@link phylox.util.condition.Restart restart} to unwind to.
 */
@NonNullByDefault
package phylox.util.condition;

import phylox.util.annotation.NonNullByDefault;
