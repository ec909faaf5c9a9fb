package com.skeinsystems;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks which component's message loop occupies each thread.
 * <p>
 * Entries are pushed when a loop starts and popped when it ends, so a synchronous
 * component run from inside another component's handler restores the outer one afterwards.
 */
final class ActiveComponentRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ActiveComponentRegistry.class);

    private static final ThreadLocal<Deque<ComponentRef>> ACTIVE = new ThreadLocal<>();

    private ActiveComponentRegistry() {
    }

    static void enter(ComponentRef ref) {
        Deque<ComponentRef> stack = ACTIVE.get();
        if (stack == null) {
            stack = new ArrayDeque<>();
            ACTIVE.set(stack);
        }
        stack.push(ref);
    }

    static void exit(ComponentRef ref) {
        Deque<ComponentRef> stack = ACTIVE.get();
        if (stack == null) {
            logger.warn("No active component registered on thread {} while leaving {}",
                    Thread.currentThread().getName(), ref);
            return;
        }
        if (stack.peek() == ref) {
            stack.pop();
        } else {
            logger.warn("Unbalanced exit of {} on thread {}", ref, Thread.currentThread().getName());
            stack.remove(ref);
        }
        if (stack.isEmpty()) {
            ACTIVE.remove();
        }
    }

    static ComponentRef current() {
        Deque<ComponentRef> stack = ACTIVE.get();
        if (stack == null || stack.isEmpty()) {
            return ComponentRef.empty();
        }
        return stack.peek();
    }
}
