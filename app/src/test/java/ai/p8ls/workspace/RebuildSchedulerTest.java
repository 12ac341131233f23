package ai.p8ls.workspace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.util.concurrent.Uninterruptibles;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RebuildSchedulerTest {

    @Test
    void testRebuildRuns() throws Exception {
        try (var scheduler = new RebuildScheduler("test")) {
            var runs = new AtomicInteger();
            assertTrue(scheduler.submit("only", runs::incrementAndGet).get(5, TimeUnit.SECONDS));
            assertEquals(1, runs.get());
        }
    }

    @Test
    void testWaitingRebuildIsSuperseded() throws Exception {
        try (var scheduler = new RebuildScheduler("test")) {
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var first = scheduler.submit("first", () -> {
                started.countDown();
                Uninterruptibles.awaitUninterruptibly(release);
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));

            var secondRuns = new AtomicInteger();
            var thirdRuns = new AtomicInteger();
            var second = scheduler.submit("second", secondRuns::incrementAndGet);
            var third = scheduler.submit("third", thirdRuns::incrementAndGet);
            assertFalse(second.get(5, TimeUnit.SECONDS));

            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS));
            assertTrue(third.get(5, TimeUnit.SECONDS));
            assertEquals(0, secondRuns.get());
            assertEquals(1, thirdRuns.get());
        }
    }

    @Test
    void testFailingRebuildCompletesExceptionally() throws Exception {
        try (var scheduler = new RebuildScheduler("test")) {
            var failed = scheduler.submit("broken", () -> {
                throw new IllegalStateException("boom");
            });
            var e = assertThrows(ExecutionException.class, () -> failed.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, e.getCause());

            // the worker survives a failed rebuild
            assertTrue(scheduler.submit("next", () -> {}).get(5, TimeUnit.SECONDS));
        }
    }
}
