/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.framing;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A FIFO queue which holds a single element in a field and only allocates a deque once a
 * second element is appended. Unary calls never have more than one pending message, so they
 * never pay for the deque.
 *
 * <p>Once promoted to the deque the queue stays there.</p>
 */
final class OneOrManyQueue<E> implements Iterable<E> {

    private static final int INITIAL_MANY_CAPACITY = 16;

    private @Nullable E one;
    private @Nullable ArrayDeque<E> many;

    boolean isEmpty() {
        if (many != null) {
            return many.isEmpty();
        }
        return one == null;
    }

    int size() {
        if (many != null) {
            return many.size();
        }
        return one == null ? 0 : 1;
    }

    void append(E element) {
        Objects.requireNonNull(element);
        if (many != null) {
            many.addLast(element);
        }
        else if (one == null) {
            one = element;
        }
        else {
            many = new ArrayDeque<>(INITIAL_MANY_CAPACITY);
            many.addLast(one);
            many.addLast(element);
            one = null;
        }
    }

    @Nullable
    E pop() {
        if (many != null) {
            return many.pollFirst();
        }
        E element = one;
        one = null;
        return element;
    }

    @Override
    public Iterator<E> iterator() {
        if (many != null) {
            return many.iterator();
        }
        return one == null ? Collections.emptyIterator() : Collections.singletonList(one).iterator();
    }

    @Override
    public String toString() {
        if (many != null) {
            return "OneOrManyQueue.many" + many;
        }
        return one == null ? "OneOrManyQueue.none" : "OneOrManyQueue.one[" + one + "]";
    }
}
