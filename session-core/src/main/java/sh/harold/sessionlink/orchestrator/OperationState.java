package sh.harold.sessionlink.orchestrator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * States of one operation kind's subscription slot.
 * <p>
 * {@code IDLE -> PENDING -> (SUCCEEDED | FAILED) -> IDLE}. Entering
 * {@code PENDING} while already pending is the forbidden transition.
 */
public enum OperationState {

    /**
     * No operation of this kind is in flight.
     * Valid transitions: PENDING
     */
    IDLE("No operation in flight"),

    /**
     * A backend call was issued and its completion subscription is active.
     * Valid transitions: SUCCEEDED, FAILED
     */
    PENDING("Awaiting backend completion"),

    /**
     * Terminal success, immediately followed by IDLE.
     */
    SUCCEEDED("Completed successfully"),

    /**
     * Terminal failure, immediately followed by IDLE.
     */
    FAILED("Completed with failure");

    private static final Map<OperationState, Set<OperationState>> VALID_TRANSITIONS;

    static {
        Map<OperationState, Set<OperationState>> transitions = new EnumMap<>(OperationState.class);
        transitions.put(IDLE, EnumSet.of(PENDING));
        transitions.put(PENDING, EnumSet.of(SUCCEEDED, FAILED));
        transitions.put(SUCCEEDED, EnumSet.of(IDLE));
        transitions.put(FAILED, EnumSet.of(IDLE));
        VALID_TRANSITIONS = Collections.unmodifiableMap(transitions);
    }

    private final String description;

    OperationState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean canTransitionTo(OperationState target) {
        return VALID_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
    }
}
