package com.game.metadata.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating transaction for platform merges.
 * Each step registers an undo action. Undo actions run in reverse order when a step
 * fails, or when the transaction is closed without {@link #markSuccess()}.
 *
 * <pre>
 * try (PlatformMergeTransaction tx = new PlatformMergeTransaction()) {
 *     tx.execute("update target aliases", () -> save(updated), () -> save(original));
 *     tx.execute("delete source", () -> delete(source), () -> save(source));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class PlatformMergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PlatformMergeTransaction.class);

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    /**
     * Runs a step and registers its undo action. If the step fails, every earlier step is
     * undone and the failure is rethrown, carrying any undo failures as suppressed exceptions.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        try {
            log.debug("platform.merge.step {}", description);
            operation.run();
            compensationStack.push(new CompensatingAction(description, compensation));
        } catch (RuntimeException e) {
            log.warn("platform.merge.step_failed step='{}' error={}", description, e.getMessage());
            runCompensations(e);
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Number of steps that would be undone on rollback.
     */
    public int pendingCompensations() {
        return compensationStack.size();
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("platform.merge.rollback steps={}", compensationStack.size());
            runCompensations(null);
        }
        closed = true;
    }

    private void runCompensations(RuntimeException failure) {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("platform.merge.compensate {}", action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                log.error("platform.merge.compensation_failed step='{}'", action.description, e);
                if (failure != null) {
                    failure.addSuppressed(e);
                }
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
