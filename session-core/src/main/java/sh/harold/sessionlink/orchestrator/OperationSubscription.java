package sh.harold.sessionlink.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.sessionlink.api.session.BackendSubscription;
import sh.harold.sessionlink.api.session.OperationKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Subscription slot for one operation kind. At most one operation per kind is
 * pending; every pending operation is finished exactly once, identified by the
 * generation handed out when it began.
 *
 * @author Harold
 * @since 1.0.0
 */
public final class OperationSubscription {
    private static final Logger LOGGER = LoggerFactory.getLogger(OperationSubscription.class);

    private final OperationKind kind;

    private OperationState state = OperationState.IDLE;
    private OperationState lastOutcome;
    private long generation;
    private Instant pendingSince;
    private PendingOperation<?> pending;

    OperationSubscription(OperationKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public OperationKind getKind() {
        return kind;
    }

    public synchronized OperationState getState() {
        return state;
    }

    /**
     * @return true while a backend completion subscription is registered for this kind
     */
    public synchronized boolean isActive() {
        return state == OperationState.PENDING;
    }

    /**
     * @return the outcome of the last finished operation, empty if none finished yet
     */
    public synchronized Optional<OperationState> getLastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    /**
     * @return the backend subscription token while pending
     */
    public synchronized Optional<BackendSubscription> getHandle() {
        return pending == null ? Optional.empty() : Optional.ofNullable(pending.getSubscription());
    }

    public synchronized Duration getTimePending() {
        return pendingSince == null ? Duration.ZERO : Duration.between(pendingSince, Instant.now());
    }

    /**
     * Claims the slot for a new operation.
     *
     * @return the generation of the claimed slot, or -1 if an operation is already pending
     */
    synchronized long begin(PendingOperation<?> operation) {
        if (!state.canTransitionTo(OperationState.PENDING)) {
            LOGGER.debug("Refusing to begin {} operation: slot is {}", kind, state);
            return -1;
        }
        state = OperationState.PENDING;
        pending = operation;
        pendingSince = Instant.now();
        generation++;
        LOGGER.debug("Slot {} pending (generation {})", kind, generation);
        return generation;
    }

    /**
     * Releases the slot if it still belongs to the given generation.
     *
     * @return the finished operation, or null if the generation is stale
     */
    synchronized PendingOperation<?> finish(long expectedGeneration, boolean success) {
        if (state != OperationState.PENDING || generation != expectedGeneration) {
            return null;
        }
        OperationState outcome = success ? OperationState.SUCCEEDED : OperationState.FAILED;
        lastOutcome = outcome;
        state = outcome.canTransitionTo(OperationState.IDLE) ? OperationState.IDLE : outcome;

        PendingOperation<?> finished = pending;
        pending = null;
        pendingSince = null;
        LOGGER.debug("Slot {} finished generation {} as {}", kind, expectedGeneration, outcome);
        return finished;
    }

    synchronized long currentGeneration() {
        return generation;
    }

    /**
     * @return the pending operation, or null when idle
     */
    synchronized PendingOperation<?> peek() {
        return pending;
    }

    @Override
    public synchronized String toString() {
        return "OperationSubscription{kind=" + kind + ", state=" + state + ", generation=" + generation + '}';
    }
}
