package com.questrail.runner.exec;

import com.questrail.runner.config.Configuration;
import com.questrail.runner.context.ContextScope;
import com.questrail.runner.context.RunContext;
import com.questrail.runner.event.EventBus;
import com.questrail.runner.event.EventContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MainExecutionContextTests {

    @Test
    void runsWorkOnTheDedicatedThread() throws Exception {
        assertFalse(MainExecutionContext.isCurrent());

        boolean onMain = MainExecutionContext.shared().call(MainExecutionContext::isCurrent);

        assertTrue(onMain);
    }

    @Test
    void reentrantCallsRunInline() throws Exception {
        int value = MainExecutionContext.shared().call(() ->
                MainExecutionContext.shared().call(() -> 42));

        assertEquals(42, value);
    }

    @Test
    void rethrowsTheWorkFailureUnchanged() {
        IOException failure = new IOException("disk");

        IOException thrown = assertThrows(IOException.class,
                () -> MainExecutionContext.shared().call(() -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
    }

    @Test
    void carriesTheCallersRunContext() throws Exception {
        RunContext context = new RunContext(new EventBus(Configuration.defaults()), EventContext.empty());

        RunContext seen;
        try (ContextScope ignored = context.attach()) {
            seen = MainExecutionContext.shared().call(() -> RunContext.current().orElse(null));
        }

        assertSame(context, seen);
    }

    @Test
    void interruptedCallerWaitsForTheWorkAndKeepsTheFlag() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger result = new AtomicInteger();
        AtomicBoolean flagAfterCall = new AtomicBoolean();
        AtomicBoolean failed = new AtomicBoolean();

        Thread caller = new Thread(() -> {
            try {
                result.set(MainExecutionContext.shared().call(() -> {
                    started.countDown();
                    assertTrue(release.await(10, TimeUnit.SECONDS));
                    return 7;
                }));
            } catch (Exception e) {
                failed.set(true);
            }
            flagAfterCall.set(Thread.currentThread().isInterrupted());
        });
        caller.start();

        assertTrue(started.await(10, TimeUnit.SECONDS));
        caller.interrupt();
        Thread.sleep(50);
        assertTrue(caller.isAlive());
        release.countDown();
        caller.join(10_000);

        assertFalse(failed.get());
        assertEquals(7, result.get());
        assertTrue(flagAfterCall.get());
    }

    @Test
    void executesOneUnitAtATime() throws InterruptedException {
        int callers = 6;
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(callers);

        for (int i = 0; i < callers; i++) {
            new Thread(() -> {
                try {
                    MainExecutionContext.shared().call(() -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.sleep(10);
                        inside.decrementAndGet();
                        return null;
                    });
                } catch (Exception e) {
                    fail(e);
                } finally {
                    done.countDown();
                }
            }).start();
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertEquals(1, maxInside.get());
    }
}
