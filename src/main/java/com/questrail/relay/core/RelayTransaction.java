package com.questrail.relay.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * RelayTransaction
 * -----------------------------------------------------------------------------
 * Unit of work for one relay operation.
 *
 * <p>Every public relay operation must take effect completely or not at all.
 * The asset ledger is an external collaborator with no transactions of its
 * own, so atomicity is provided here by compensation: each state change made
 * through a component registers the action that undoes it, and
 * {@link #rollback(Throwable)} runs those actions newest-first.</p>
 *
 * <p>Observability events are published only after {@link #commit()}, so a
 * failed operation never reports an effect it did not have.</p>
 *
 * <h2>Threading</h2>
 * A transaction is confined to the thread running its operation. It is not
 * thread-safe and must not be reused.
 */
public final class RelayTransaction
{
    private static final Logger log = LoggerFactory.getLogger(RelayTransaction.class);

    private enum Status { ACTIVE, COMMITTED, ROLLED_BACK }

    private final Deque<Runnable> compensations = new ArrayDeque<>();
    private final List<Runnable> afterCommit = new ArrayList<>();
    private Status status = Status.ACTIVE;

    /**
     * Registers the action that undoes a state change just made.
     */
    public void onRollback(Runnable compensation) {
        Objects.requireNonNull(compensation, "compensation");
        requireActive();
        compensations.push(compensation);
    }

    /**
     * Registers an action to run once the operation has committed.
     */
    public void afterCommit(Runnable action) {
        Objects.requireNonNull(action, "action");
        requireActive();
        afterCommit.add(action);
    }

    /**
     * Makes every change final and runs the after-commit actions in
     * registration order.
     * <p>
     * The operation has already taken effect when these actions run, so a
     * failing action is logged and does not stop the others.
     */
    public void commit() {
        requireActive();
        status = Status.COMMITTED;
        compensations.clear();
        for (Runnable action : afterCommit) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("After-commit action failed", e);
            }
        }
        afterCommit.clear();
    }

    /**
     * Undoes every registered change, newest first.
     * <p>
     * A compensation that fails is attached to {@code cause} as a suppressed
     * exception and the remaining compensations still run.
     *
     * @param cause the failure that aborted the operation
     */
    public void rollback(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        requireActive();
        status = Status.ROLLED_BACK;
        afterCommit.clear();
        while (!compensations.isEmpty()) {
            Runnable compensation = compensations.pop();
            try {
                compensation.run();
            } catch (RuntimeException e) {
                log.error("Compensation failed while rolling back: {}", e.getMessage());
                cause.addSuppressed(e);
            }
        }
    }

    /**
     * Number of changes that would be undone by a rollback.
     */
    public int pendingCompensations() {
        return compensations.size();
    }

    private void requireActive() {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Transaction already " + status);
        }
    }
}
