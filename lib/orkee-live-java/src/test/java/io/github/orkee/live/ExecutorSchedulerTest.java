package io.github.orkee.live;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ExecutorSchedulerTest {

    @Test
    void tasksRunOnNamedDaemonThread() throws InterruptedException {
        try (ExecutorScheduler scheduler = new ExecutorScheduler("test-loop")) {
            AtomicReference<Thread> thread = new AtomicReference<>();
            CountDownLatch done = new CountDownLatch(1);

            scheduler.execute(() -> {
                thread.set(Thread.currentThread());
                done.countDown();
            });

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(thread.get().getName()).isEqualTo("test-loop");
            assertThat(thread.get().isDaemon()).isTrue();
        }
    }

    @Test
    void cancelledTimerDoesNotFire() throws InterruptedException {
        try (ExecutorScheduler scheduler = new ExecutorScheduler()) {
            AtomicInteger fired = new AtomicInteger();

            Cancellable timer = scheduler.schedule(fired::incrementAndGet, Duration.ofMillis(100));
            timer.cancel();

            Thread.sleep(300);
            assertThat(fired.get()).isZero();
        }
    }

    @Test
    void periodicTaskSurvivesFailures() {
        try (ExecutorScheduler scheduler = new ExecutorScheduler()) {
            AtomicInteger runs = new AtomicInteger();

            Cancellable timer = scheduler.scheduleAtFixedRate(() -> {
                runs.incrementAndGet();
                throw new IllegalStateException("boom");
            }, Duration.ofMillis(5), Duration.ofMillis(10));

            await().atMost(5, TimeUnit.SECONDS).until(() -> runs.get() >= 3);
            timer.cancel();
        }
    }

    @Test
    void closedSchedulerDropsTasks() {
        ExecutorScheduler scheduler = new ExecutorScheduler();
        scheduler.close();

        AtomicInteger runs = new AtomicInteger();
        scheduler.execute(runs::incrementAndGet);
        Cancellable timer = scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(1));

        assertThat(timer).isSameAs(Cancellable.NONE);
        assertThat(runs.get()).isZero();
    }
}
