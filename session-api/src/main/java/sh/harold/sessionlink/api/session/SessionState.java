package sh.harold.sessionlink.api.session;

/**
 * Lifecycle of a named session as tracked by a backend.
 */
public enum SessionState {
    /**
     * Created and accepting players in the lobby.
     */
    PENDING,
    /**
     * Started; late joins depend on the session's join-in-progress flag.
     */
    IN_PROGRESS,
    /**
     * Teardown requested, resources are being released.
     */
    DESTROYING
}
