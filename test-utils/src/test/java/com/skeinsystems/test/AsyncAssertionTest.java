package com.skeinsystems.test;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncAssertionTest {

    @Test
    void eventuallyReturnsOnceConditionHolds() {
        AtomicInteger counter = new AtomicInteger();
        Thread incrementer = new Thread(() -> {
            for (int i = 0; i < 5; i++) {
                counter.incrementAndGet();
            }
        });
        incrementer.start();

        AsyncAssertion.eventually(() -> counter.get() == 5, Duration.ofSeconds(2));
    }

    @Test
    void eventuallyFailsAfterTimeout() {
        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.eventually(() -> false, Duration.ofMillis(50)));

        assertTrue(error.getMessage().contains("did not become true"));
    }

    @Test
    void eventuallyReportsLastError() {
        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.eventually(() -> {
                    throw new IllegalStateException("boom");
                }, Duration.ofMillis(50)));

        assertTrue(error.getMessage().contains("boom"));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void consistentlyPassesWhileConditionHolds() {
        AsyncAssertion.consistently(() -> true, Duration.ofMillis(50));
    }

    @Test
    void consistentlyFailsWhenConditionBreaks() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(AssertionError.class,
                () -> AsyncAssertion.consistently(() -> calls.incrementAndGet() < 3, Duration.ofSeconds(2)));
        assertEquals(3, calls.get());
    }

    @Test
    void awaitValueReturnsExpected() {
        AtomicInteger value = new AtomicInteger();
        new Thread(() -> value.set(42)).start();

        assertEquals(42, AsyncAssertion.awaitValue(value::get, 42, Duration.ofSeconds(2)));
    }

    @Test
    void awaitValueFailsWithHistory() {
        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.awaitValue(() -> "a", "b", Duration.ofMillis(50)));

        assertTrue(error.getMessage().contains("Value history: [a]"));
    }
}
