package sh.harold.sessionlink.api.session;

/**
 * Why a session operation ended in failure.
 */
public enum FailureCause {
    NONE("Operation succeeded"),
    BACKEND_UNAVAILABLE("No session backend could be resolved"),
    DISPATCH_REJECTED("Backend rejected the call synchronously"),
    ASYNC_FAILURE("Backend reported failure on completion"),
    EMPTY_RESULTS("Search completed without any results"),
    NOT_IMPLEMENTED("Operation is not supported by the backend"),
    OPERATION_IN_PROGRESS("An operation of the same kind is still pending"),
    NO_ACTIVE_SESSION("No session is active");

    private final String description;

    FailureCause(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
