// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.test;

import java.util.ArrayList;
import java.util.List;
import phylox.util.condition.Condition;
import phylox.util.condition.ConditionContext;
import phylox.util.condition.Handler;
import org.assertj.core.api.Assertions;

/**
 * Runs code under a handler that records the conditions it signals, aborting on the first fatal one.
 */
final class ConditionCapture {
    private ConditionCapture() {
    }

    /**
     * Runs {@code body}, which must signal a fatal condition of the given type, and returns that condition.
     */
    static <C extends Condition> C expectFatal(final Class<C> type, final Runnable body) {
        final var capture = new ConditionCapture();
        final var completed = capture.run(body);
        Assertions.assertThat(completed).as("body completed without a fatal condition").isFalse();
        Assertions.assertThat(capture.fatal).isInstanceOf(type);
        return type.cast(capture.fatal);
    }

    /**
     * Runs {@code body}, which must not signal any fatal condition, and returns the notices it signaled.
     */
    static List<Condition> notices(final Runnable body) {
        final var capture = new ConditionCapture();
        final var completed = capture.run(body);
        Assertions.assertThat(completed)
            .as("unexpected fatal condition %s", capture.fatal)
            .isTrue();
        return capture.notices;
    }

    private boolean run(final Runnable body) {
        final var result = ConditionContext.withRestart("abort-test", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal()) {
                    fatal = signaled.condition();
                    restart.unwindTo();
                } else {
                    notices.add(signaled.condition());
                }
            })) {
                handler.use();
                body.run();
            }
            return Boolean.TRUE;
        });
        return result != null;
    }

    private final List<Condition> notices = new ArrayList<>();
    private Condition fatal = null;
}
