package com.mockgen.generator.watch;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CoalescingRunnerTest {

    /** Holds submitted work until the test runs it. */
    private static final class ManualExecutor implements Executor {
        private final Queue<Runnable> queue = new ArrayDeque<>();

        @Override
        public void execute(Runnable command) {
            queue.add(command);
        }

        void runAll() {
            Runnable next;
            while ((next = queue.poll()) != null) {
                next.run();
            }
        }
    }

    @Test
    void testTriggersWhileQueuedCollapse() {
        ManualExecutor executor = new ManualExecutor();
        AtomicInteger runs = new AtomicInteger();
        CoalescingRunner runner = new CoalescingRunner("dir", executor, runs::incrementAndGet);

        runner.trigger();
        runner.trigger();
        runner.trigger();

        assertThat(executor.queue).hasSize(1);
        assertThat(runner.isIdle()).isFalse();
        executor.runAll();
        assertThat(runs).hasValue(1);
        assertThat(runner.isIdle()).isTrue();
    }

    @Test
    void testTriggerDuringRunCausesExactlyOneMoreRun() {
        ManualExecutor executor = new ManualExecutor();
        AtomicInteger runs = new AtomicInteger();
        CoalescingRunner[] holder = new CoalescingRunner[1];
        holder[0] = new CoalescingRunner("dir", executor, () -> {
            if (runs.incrementAndGet() == 1) {
                holder[0].trigger();
                holder[0].trigger();
            }
        });

        holder[0].trigger();
        executor.runAll();

        assertThat(runs).hasValue(2);
        assertThat(holder[0].isIdle()).isTrue();
    }

    @Test
    void testFailingRunDoesNotStopLaterRuns() {
        AtomicInteger runs = new AtomicInteger();
        CoalescingRunner runner = new CoalescingRunner("dir", Runnable::run, () -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        });

        runner.trigger();
        runner.trigger();

        assertThat(runs).hasValue(2);
        assertThat(runner.isIdle()).isTrue();
    }

    @Test
    void testRejectedExecutionLeavesRunnerUsable() {
        AtomicInteger runs = new AtomicInteger();
        boolean[] reject = { true };
        Executor executor = command -> {
            if (reject[0]) {
                throw new java.util.concurrent.RejectedExecutionException("shut down");
            }
            command.run();
        };
        CoalescingRunner runner = new CoalescingRunner("dir", executor, runs::incrementAndGet);

        runner.trigger();
        assertThat(runs).hasValue(0);

        reject[0] = false;
        runner.trigger();
        assertThat(runs).hasValue(1);
    }
}
