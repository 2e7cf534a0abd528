package com.sky.association.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Compensating transaction spanning the writes of one image stage.
 * Every write is registered with the action that undoes it; if a step fails or
 * the transaction is closed without {@link #markSuccess()}, the compensations run
 * in reverse order so counters and the rows they count stay consistent.
 *
 * <pre>
 * try (StageTransaction tx = new StageTransaction("associate image 7")) {
 *     tx.execute("merge detection", () -> sources.save(updated), () -> sources.save(snapshot));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class StageTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StageTransaction.class);

    private final String name;
    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    public StageTransaction(String name) {
        this.name = name;
    }

    /**
     * Runs a write and registers its compensation.
     * On failure every previously registered compensation runs and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        call(description, () -> {
            operation.run();
            return null;
        }, compensation);
    }

    /**
     * Runs a write that yields a value and registers its compensation.
     */
    public <T> T call(String description, Supplier<T> operation, Runnable compensation) {
        ensureOpen();
        try {
            log.debug("Executing stage step: {}", description);
            T result = operation.get();
            compensationStack.push(new CompensatingAction(description, compensation));
            return result;
        } catch (RuntimeException e) {
            log.warn("Stage step '{}' of '{}' failed: {}. Running compensations.", description, name, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    public int pendingCompensations() {
        return compensationStack.size();
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("StageTransaction '{}' closed without success - running compensations", name);
            runCompensations();
        }
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction '" + name + "' is already closed");
        }
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("Running compensation: {}", action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                // Remaining compensations still run
                log.error("Compensation '{}' failed (best-effort): {}", action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
