// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.cli;

import java.io.PrintStream;
import phylox.util.Trace;
import phylox.util.condition.Condition;
import phylox.util.condition.ConditionContext;
import phylox.util.condition.HandlerProcedure;
import phylox.util.condition.SignaledCondition;

/**
 * The handler of last resort: reports every condition on standard error, and aborts on fatal ones by unwinding to
 * the outermost restart.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        final var err = standardError();
        if (!condition.isFatal()) {
            err.println("Note: " + condition.condition().message());
            return;
        }
        final var restarts = ConditionContext.restarts();
        showCondition(err, condition.condition());
        if (restarts.isEmpty()) {
            throw new IllegalStateException("No restarts available");
        }
        restarts.get(restarts.size() - 1).unwindTo();
    }

    private static void showCondition(final PrintStream err, final Condition condition) {
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    private static PrintStream standardError() {
        return System.err;
    }

    private static final FallbackHandler instance = new FallbackHandler();
}
