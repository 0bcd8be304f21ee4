package sh.harold.sessionlink.api.session;

/**
 * Exception describing why a session operation could not complete.
 * Carried by failure events rather than thrown from orchestrator entry points.
 */
public class SessionException extends RuntimeException {

    private final OperationKind kind;
    private final FailureCause failureCause;

    public SessionException(OperationKind kind, FailureCause cause, String message) {
        super(message);
        this.kind = kind;
        this.failureCause = cause;
    }

    public SessionException(OperationKind kind, FailureCause cause, String message, Throwable throwable) {
        super(message, throwable);
        this.kind = kind;
        this.failureCause = cause;
    }

    public OperationKind getKind() {
        return kind;
    }

    public FailureCause getFailureCause() {
        return failureCause;
    }

    public static SessionException backendUnavailable(OperationKind kind) {
        return new SessionException(kind, FailureCause.BACKEND_UNAVAILABLE,
                "Cannot " + kind.getId() + " session: no session backend available");
    }

    public static SessionException dispatchRejected(OperationKind kind, String sessionName) {
        return new SessionException(kind, FailureCause.DISPATCH_REJECTED,
                "Backend rejected " + kind.getId() + " for session " + sessionName);
    }

    public static SessionException dispatchFailed(OperationKind kind, String sessionName, Throwable error) {
        return new SessionException(kind, FailureCause.DISPATCH_REJECTED,
                "Backend failed to dispatch " + kind.getId() + " for session " + sessionName, error);
    }

    public static SessionException asyncFailure(OperationKind kind, String sessionName) {
        return new SessionException(kind, FailureCause.ASYNC_FAILURE,
                "Backend reported " + kind.getId() + " failure for session " + sessionName);
    }

    public static SessionException emptyResults() {
        return new SessionException(OperationKind.FIND, FailureCause.EMPTY_RESULTS,
                "Session search completed without any results");
    }

    public static SessionException operationInProgress(OperationKind kind) {
        return new SessionException(kind, FailureCause.OPERATION_IN_PROGRESS,
                "A " + kind.getId() + " operation is already pending");
    }

    public static SessionException notImplemented(OperationKind kind, Throwable error) {
        return new SessionException(kind, FailureCause.NOT_IMPLEMENTED,
                "Operation " + kind.getId() + " is not implemented by the backend", error);
    }

    public static SessionException noActiveSession(OperationKind kind) {
        return new SessionException(kind, FailureCause.NO_ACTIVE_SESSION,
                "Cannot " + kind.getId() + " session: no session is active");
    }

    public static SessionException shutdown(OperationKind kind) {
        return new SessionException(kind, FailureCause.ASYNC_FAILURE,
                "Orchestrator shut down before " + kind.getId() + " completed");
    }
}
