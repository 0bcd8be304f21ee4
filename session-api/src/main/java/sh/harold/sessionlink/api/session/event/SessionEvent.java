package sh.harold.sessionlink.api.session.event;

import sh.harold.sessionlink.api.session.FailureCause;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.SessionException;

import java.util.Objects;
import java.util.Optional;

/**
 * Base type of the completion events published on the notification bus.
 * Exactly one event is published per issued operation.
 */
public abstract class SessionEvent {

    private final OperationKind kind;
    private final String sessionName;
    private final boolean success;
    private final FailureCause failureCause;
    private final SessionException error;
    private final long timestamp;

    protected SessionEvent(OperationKind kind,
                           String sessionName,
                           boolean success,
                           FailureCause failureCause,
                           SessionException error) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sessionName = sessionName;
        this.success = success;
        this.failureCause = success ? FailureCause.NONE : Objects.requireNonNull(failureCause, "failureCause");
        this.error = error;
        this.timestamp = System.currentTimeMillis();
    }

    public OperationKind getKind() {
        return kind;
    }

    /**
     * @return the session the event refers to, or null when not applicable
     */
    public String getSessionName() {
        return sessionName;
    }

    public boolean isSuccess() {
        return success;
    }

    public FailureCause getFailureCause() {
        return failureCause;
    }

    public Optional<SessionException> getError() {
        return Optional.ofNullable(error);
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{session=" + sessionName + ", success=" + success
                + (success ? "" : ", cause=" + failureCause) + '}';
    }
}
