package com.github.anirbanmu.wisp.util;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

// timer source for heartbeats, watchdogs and delayed reconnects
public interface Scheduler {

    Task schedule(Runnable task, long delayMs);

    Task scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs);

    interface Task {
        void cancel();
    }

    static Scheduler create(String name, int threads) {
        return new ExecutorScheduler(name, threads);
    }

    final class ExecutorScheduler implements Scheduler, AutoCloseable {
        private final ScheduledExecutorService executor;

        ExecutorScheduler(String name, int threads) {
            AtomicInteger counter = new AtomicInteger();
            this.executor = Executors.newScheduledThreadPool(threads, r -> {
                Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        @Override
        public Task schedule(Runnable task, long delayMs) {
            ScheduledFuture<?> future = executor.schedule(task, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        }

        @Override
        public Task scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs) {
            ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                task, Math.max(0, initialDelayMs), periodMs, TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        }

        @Override
        public void close() {
            executor.shutdownNow();
        }
    }
}
