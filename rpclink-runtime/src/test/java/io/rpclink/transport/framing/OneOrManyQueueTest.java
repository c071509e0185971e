/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.framing;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OneOrManyQueueTest {

    private final OneOrManyQueue<String> queue = new OneOrManyQueue<>();

    private static List<String> contents(OneOrManyQueue<String> queue) {
        List<String> result = new ArrayList<>();
        queue.forEach(result::add);
        return result;
    }

    @Test
    @DisplayName("New queue is empty")
    void emptyQueue() {
        assertTrue(queue.isEmpty());
        assertEquals(0, queue.size());
        assertNull(queue.pop());
        assertEquals(List.of(), contents(queue));
    }

    @Test
    @DisplayName("Single element is held and popped")
    void singleElement() {
        queue.append("a");

        assertFalse(queue.isEmpty());
        assertEquals(1, queue.size());
        assertEquals(List.of("a"), contents(queue));
        assertEquals("a", queue.pop());
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Elements come out in insertion order across promotion")
    void fifoAcrossPromotion() {
        queue.append("a");
        queue.append("b");
        queue.append("c");

        assertEquals(3, queue.size());
        assertEquals(List.of("a", "b", "c"), contents(queue));
        assertEquals("a", queue.pop());
        assertEquals("b", queue.pop());
        assertEquals("c", queue.pop());
        assertNull(queue.pop());
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Queue keeps working after draining a promoted queue")
    void reuseAfterDrain() {
        queue.append("a");
        queue.append("b");
        queue.pop();
        queue.pop();

        queue.append("c");
        assertEquals(1, queue.size());
        queue.append("d");
        assertEquals(List.of("c", "d"), contents(queue));
    }

    @Test
    @DisplayName("Null elements are rejected")
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> queue.append(null));
    }
}
