package com.alterante.relay.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serial command executor with bounded retry.
 *
 * At most one command executes at a time. Commands only start while the queue is
 * enabled. A failed, retryable command is put back at the head and retried after a fixed
 * delay until the retry budget is spent; terminal failures go to the {@link ErrorReporter}.
 *
 * Thread model: all state lives on the {@link EventLoop}. Public methods may be called
 * from any thread and are marshalled onto the loop.
 */
public class CommandQueue {

    private static final Logger log = LoggerFactory.getLogger(CommandQueue.class);

    public static final int DEFAULT_RETRIES = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 1000;

    private final String name;
    private final EventLoop loop;
    private final ErrorReporter reporter;
    private final int maxRetries;
    private final long retryDelayMs;

    private final Deque<Command> queue = new ArrayDeque<>();
    private boolean executing;
    private boolean enabled;
    private int currentRetryCount;
    private long totalRetries;

    public CommandQueue(String name, EventLoop loop, ErrorReporter reporter, int maxRetries, long retryDelayMs) {
        this.name = name;
        this.loop = loop;
        this.reporter = reporter;
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
    }

    public CommandQueue(String name, EventLoop loop, ErrorReporter reporter) {
        this(name, loop, reporter, DEFAULT_RETRIES, DEFAULT_RETRY_DELAY_MS);
    }

    /** Append a command; starts execution when idle and enabled. */
    public void push(Command command) {
        loop.dispatch(() -> {
            queue.addLast(command);
            kick();
        });
    }

    /** Append only if no queued command has the same concrete class. */
    public void pushOnce(Command command) {
        loop.dispatch(() -> {
            for (Command queued : queue) {
                if (queued.getClass() == command.getClass()) {
                    log.debug("[{}] {} already queued, skipping", name, command.getClass().getSimpleName());
                    return;
                }
            }
            queue.addLast(command);
            kick();
        });
    }

    /** Insert a command at the head so it runs before everything already queued. */
    public void prepend(Command command) {
        loop.dispatch(() -> {
            queue.addFirst(command);
            kick();
        });
    }

    public void setEnabled(boolean enabled) {
        loop.dispatch(() -> {
            if (this.enabled == enabled) return;
            this.enabled = enabled;
            log.debug("[{}] command execution {}", name, enabled ? "enabled" : "disabled");
            kick();
        });
    }

    public void clear() {
        loop.dispatch(queue::clear);
    }

    public int size() {
        return loop.call(queue::size);
    }

    public boolean isEnabled() {
        return loop.call(() -> enabled);
    }

    public boolean isExecuting() {
        return loop.call(() -> executing);
    }

    /** Number of retries scheduled since creation. */
    public long totalRetries() {
        return loop.call(() -> totalRetries);
    }

    public String name() { return name; }

    private void kick() {
        if (!executing && enabled && !queue.isEmpty()) {
            executing = true;
            loop.execute(this::processNext);
        }
    }

    private void processNext() {
        if (queue.isEmpty() || !enabled) {
            executing = false;
            return;
        }

        executing = true;
        Command command = queue.removeFirst();
        AtomicBoolean reported = new AtomicBoolean();
        log.debug("[{}] executing {}", name, command.getClass().getSimpleName());

        try {
            command.execute(result -> {
                if (!reported.compareAndSet(false, true)) {
                    log.warn("[{}] {} reported more than once, ignoring", name, command.getClass().getSimpleName());
                    return;
                }
                loop.execute(() -> onResult(command, result));
            });
        } catch (RuntimeException e) {
            log.error("[{}] {} threw instead of reporting: {}", name, command.getClass().getSimpleName(), e.getMessage(), e);
            if (reported.compareAndSet(false, true)) {
                onResult(command, CommandResult.fail(null));
            }
        }
    }

    private void onResult(Command command, CommandResult result) {
        // Disabled mid-execution: discard the result and run the command again later
        if (!enabled) {
            queue.addFirst(command);
            executing = false;
            return;
        }

        if (result.success()) {
            currentRetryCount = 0;
        } else {
            currentRetryCount++;
            if (currentRetryCount > maxRetries || !result.retryable()) {
                UserError error = result.error() != null ? result.error() : UserError.UNDEFINED;
                log.warn("[{}] dropping {} after {} attempt(s): {}",
                        name, command.getClass().getSimpleName(), currentRetryCount, error);
                currentRetryCount = 0;
                command.onAbandoned(error);
                reporter.report(error);
            } else {
                log.info("[{}] {} failed (attempt {}/{}), retrying in {}ms",
                        name, command.getClass().getSimpleName(), currentRetryCount, maxRetries + 1, retryDelayMs);
                totalRetries++;
                queue.addFirst(command);
                loop.schedule(this::processNext, retryDelayMs);
                return;
            }
        }
        loop.execute(this::processNext);
    }
}
