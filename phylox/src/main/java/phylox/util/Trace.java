// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import phylox.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable description of the operation in progress, established with try-with-resources.
 * <p>
 * Traces describe <em>what the program was doing</em> when something went wrong, for example "Adding calibration
 * priors" or "Reading document from model.xml"; they are reported alongside fatal conditions and are not a machine
 * stack trace.
 * <p>
 * A trace belongs to the thread that created it and must be closed by that thread.
 */
public final class Trace implements AutoCloseable {
    /**
     * Establishes a new trace whose message is computed on demand, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Establishes a new trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var chain = localChain();
        next = chain.innermost;
        this.messageOrSupplier = messageOrSupplier;
        owner = chain;
        chain.innermost = this;
    }

    /**
     * Returns the messages of the calling thread's open traces, innermost first.
     */
    public static Iterable<String> activeTraces() {
        return () -> new MessageIterator(localChain().innermost);
    }

    /**
     * Does nothing; referencing the resource silences warnings about unused try-with-resources variables.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Removes this trace from the calling thread's chain. Called by try-with-resources only.
     */
    @Override
    public void close() {
        assert owner == localChain() : "Trace closed by a different thread";
        assert owner.innermost == this : "Trace chain corrupt";
        owner.innermost = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var computed = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = computed;
        return computed;
    }

    private static Chain localChain() {
        return chains.get();
    }

    @SuppressWarnings("nullness:type.argument") // Never null, CF doesn't understand withInitial.
    private static final ThreadLocal<Chain> chains = ThreadLocal.withInitial(Chain::new);

    private final @Nullable Trace next;
    // Either the message itself or the MessageSupplier producing it.
    private Object messageOrSupplier;
    private final Chain owner;

    private static final class Chain {
        private @Nullable Trace innermost = null;
    }

    private static final class MessageIterator implements Iterator<String> {
        private MessageIterator(final @Nullable Trace first) {
            current = first;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NonNull String next() {
            final var trace = current;
            if (trace == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = trace.next;
            return trace.message();
        }

        private @Nullable Trace current;
    }
}
