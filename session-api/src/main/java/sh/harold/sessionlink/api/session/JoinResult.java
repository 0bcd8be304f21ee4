package sh.harold.sessionlink.api.session;

/**
 * Result codes reported by a backend when a join attempt finishes.
 * The orchestrator forwards these unchanged.
 */
public enum JoinResult {
    SUCCESS,
    SESSION_IS_FULL,
    SESSION_DOES_NOT_EXIST,
    COULD_NOT_RETRIEVE_ADDRESS,
    ALREADY_IN_SESSION,
    UNKNOWN_ERROR;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
