package com.skeinsystems.test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Utilities for async assertions in component tests.
 * Provides better alternatives to Thread.sleep() for waiting on async conditions.
 *
 * <p>Usage:
 * <pre>{@code
 * // Wait for a condition to become true
 * AsyncAssertion.eventually(() -> capture.size() == 5, Duration.ofSeconds(2));
 *
 * // Check that something does NOT happen for a while
 * AsyncAssertion.consistently(() -> fired.get() == 0, Duration.ofMillis(200));
 * }</pre>
 */
public class AsyncAssertion {

    private static final long DEFAULT_POLL_INTERVAL_MS = 10;

    /**
     * Waits until the condition becomes true or timeout is reached.
     *
     * @param condition the condition to check
     * @param timeout the maximum time to wait
     * @throws AssertionError if condition doesn't become true within timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout) {
        eventually(condition, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Waits until the condition becomes true or timeout is reached.
     *
     * @param condition the condition to check
     * @param timeout the maximum time to wait
     * @param pollIntervalMs the interval between checks in milliseconds
     * @throws AssertionError if condition doesn't become true within timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long endTime = System.currentTimeMillis() + timeout.toMillis();
        Throwable lastError = null;

        while (System.currentTimeMillis() < endTime) {
            try {
                if (condition.getAsBoolean()) {
                    return;
                }
            } catch (Throwable e) {
                lastError = e;
            }
            sleep(pollIntervalMs, "condition");
        }

        String message = "Condition did not become true within " + timeout;
        if (lastError != null) {
            throw new AssertionError(message + ". Last error: " + lastError.getMessage(), lastError);
        }
        throw new AssertionError(message);
    }

    /**
     * Checks that the condition stays true for the whole duration.
     *
     * @param condition the condition to check
     * @param duration how long the condition must hold
     * @throws AssertionError as soon as the condition is false
     */
    public static void consistently(BooleanSupplier condition, Duration duration) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Objects.requireNonNull(duration, "duration cannot be null");
        long endTime = System.currentTimeMillis() + duration.toMillis();

        do {
            if (!condition.getAsBoolean()) {
                throw new AssertionError("Condition became false before " + duration + " elapsed");
            }
            sleep(DEFAULT_POLL_INTERVAL_MS, "condition");
        } while (System.currentTimeMillis() < endTime);
    }

    /**
     * Waits until the supplier returns the expected value or timeout is reached.
     *
     * @param <T> the value type
     * @param supplier the value supplier
     * @param expected the expected value
     * @param timeout the maximum time to wait
     * @return the actual value (which equals expected)
     * @throws AssertionError if value doesn't match within timeout
     */
    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout) {
        Objects.requireNonNull(supplier, "supplier cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");

        long endTime = System.currentTimeMillis() + timeout.toMillis();
        T lastValue = null;
        List<T> valueHistory = new ArrayList<>();

        while (System.currentTimeMillis() < endTime) {
            lastValue = supplier.get();
            // Track value changes only
            if (valueHistory.isEmpty() || !Objects.equals(lastValue, valueHistory.get(valueHistory.size() - 1))) {
                valueHistory.add(lastValue);
            }
            if (Objects.equals(expected, lastValue)) {
                return lastValue;
            }
            sleep(DEFAULT_POLL_INTERVAL_MS, "value");
        }

        throw new AssertionError(String.format(
            "Value did not become %s within %s. Value history: %s. Final value: %s",
            expected, timeout, valueHistory, lastValue
        ));
    }

    private static void sleep(long millis, String what) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for " + what, e);
        }
    }
}
