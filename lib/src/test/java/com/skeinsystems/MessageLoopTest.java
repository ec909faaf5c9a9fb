package com.skeinsystems;

import com.skeinsystems.config.ThreadPoolFactory;
import com.skeinsystems.queue.LinkedMessageQueue;
import com.skeinsystems.test.AsyncAssertion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@Timeout(5)
class MessageLoopTest {

    @Mock
    private ComponentLifecycle<String> lifecycle;

    @Mock
    private BiConsumer<String, Throwable> exceptionHandler;

    private MessageLoop<String> loop;

    @BeforeEach
    void setUp() {
        loop = new MessageLoop<>(() -> "loop-test", new LinkedMessageQueue<>(), exceptionHandler,
                lifecycle, new ThreadPoolFactory());
    }

    @Test
    void testSyncLoopRunsLifecycleInOrder() {
        doAnswer(invocation -> "last".equals(invocation.getArgument(0)) && loop.close())
                .when(lifecycle).dispatch(any());
        loop.post("first");
        loop.post("last");

        loop.start(LaunchMode.SYNC);

        InOrder inOrder = inOrder(lifecycle);
        inOrder.verify(lifecycle).onEntry();
        inOrder.verify(lifecycle).dispatch("first");
        inOrder.verify(lifecycle).dispatch("last");
        inOrder.verify(lifecycle).onExit();
        verifyNoInteractions(exceptionHandler);
        assertFalse(loop.isRunning());
        assertTrue(loop.isClosed());
    }

    @Test
    void testDispatchFailureGoesToExceptionHandler() {
        RuntimeException failure = new IllegalStateException("bad message");
        doAnswer(invocation -> {
            if ("bad".equals(invocation.getArgument(0))) {
                throw failure;
            }
            return loop.close();
        }).when(lifecycle).dispatch(any());
        loop.post("bad");
        loop.post("stop");

        loop.start(LaunchMode.SYNC);

        verify(exceptionHandler).accept("bad", failure);
        verify(lifecycle).dispatch("stop");
        verify(lifecycle).onExit();
    }

    @Test
    void testLoopThreadIsKnownWhileDispatching() {
        boolean[] onLoopThread = new boolean[1];
        doAnswer(invocation -> {
            onLoopThread[0] = loop.isLoopThread() && loop.isRunning();
            return loop.close();
        }).when(lifecycle).dispatch(any());
        loop.post("probe");

        loop.start(LaunchMode.SYNC);

        assertTrue(onLoopThread[0]);
        assertFalse(loop.isLoopThread());
    }

    @Test
    void testAsyncLoopFinishesAfterClose() {
        loop.start(LaunchMode.ASYNC);
        loop.post("one");

        assertTrue(loop.close());
        assertFalse(loop.close());
        loop.awaitTermination();

        verify(lifecycle).dispatch("one");
        verify(lifecycle).onExit();
        assertFalse(loop.post("two"));
    }

    @Test
    void testInterruptedWorkerClosesTheLoop() {
        AtomicReference<Thread> worker = new AtomicReference<>();
        doAnswer(invocation -> {
            worker.set(Thread.currentThread());
            return null;
        }).when(lifecycle).onEntry();
        loop.start(LaunchMode.ASYNC);
        AsyncAssertion.eventually(() -> worker.get() != null, Duration.ofSeconds(2));

        worker.get().interrupt();

        AsyncAssertion.eventually(loop::isClosed, Duration.ofSeconds(2));
        loop.awaitTermination();
        assertFalse(loop.post("ignored"));
        verify(lifecycle).onExit();
    }

    @Test
    void testInterruptFlagIsClearedAfterDispatch() {
        boolean[] interruptedOnNext = new boolean[1];
        doAnswer(invocation -> {
            if ("interrupt".equals(invocation.getArgument(0))) {
                Thread.currentThread().interrupt();
                return null;
            }
            interruptedOnNext[0] = Thread.currentThread().isInterrupted();
            return loop.close();
        }).when(lifecycle).dispatch(any());
        loop.post("interrupt");
        loop.post("next");

        loop.start(LaunchMode.SYNC);

        verify(lifecycle).dispatch("next");
        assertFalse(interruptedOnNext[0]);
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    void testCannotStartTwiceOrAfterClose() {
        loop.start(LaunchMode.ASYNC);
        ComponentException exception = assertThrows(ComponentException.class, () -> loop.start(LaunchMode.ASYNC));
        assertEquals("loop-test", exception.getComponentName());

        loop.close();
        loop.awaitTermination();
        assertThrows(ComponentException.class, () -> loop.start(LaunchMode.SYNC));
    }

    @Test
    void testCurrentSizeReflectsQueuedMessages() {
        loop.post("a");
        loop.post("b");

        assertEquals(2, loop.getCurrentSize());
        assertFalse(loop.isStarted());
        verifyNoInteractions(lifecycle);
    }
}
