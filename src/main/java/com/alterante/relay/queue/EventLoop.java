package com.alterante.relay.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * The single serialized context: every queue and transfer-state mutation runs here.
 *
 * Blocking I/O never runs on this thread. I/O tasks post their results back
 * via {@link #execute}, which keeps FIFO order per posting thread.
 */
public class EventLoop implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    private final ScheduledThreadPoolExecutor scheduler;
    private volatile Thread loopThread;

    public EventLoop(String name) {
        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(() -> {
                loopThread = Thread.currentThread();
                r.run();
            }, name);
            t.setDaemon(true);
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    /** Run a task on the loop thread. Exceptions are logged, never propagated. */
    @Override
    public void execute(Runnable task) {
        try {
            scheduler.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop closed, dropping task");
        }
    }

    /** Run inline when already on the loop, otherwise post it. */
    public void dispatch(Runnable task) {
        if (inLoop()) {
            task.run();
        } else {
            execute(task);
        }
    }

    /** Run a task on the loop thread after a delay. Returns null once the loop is closed. */
    public ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        try {
            return scheduler.schedule(guarded(task), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop closed, dropping scheduled task");
            return null;
        }
    }

    /** Returns null once the loop is closed. */
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs) {
        try {
            return scheduler.scheduleAtFixedRate(guarded(task), initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop closed, dropping periodic task");
            return null;
        }
    }

    /**
     * Run a task on the loop and wait for its result. Runs inline when already on the loop.
     */
    public <T> T call(Callable<T> task) {
        if (inLoop()) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        try {
            return scheduler.submit(task).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for event loop", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException(cause);
        }
    }

    /** Convenience for {@link #call} with no result. */
    public void run(Runnable task) {
        call(() -> {
            task.run();
            return null;
        });
    }

    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Unexpected error on event loop: {}", e.getMessage(), e);
            }
        };
    }
}
