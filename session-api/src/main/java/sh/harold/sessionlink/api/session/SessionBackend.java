package sh.harold.sessionlink.api.session;

import java.util.Optional;

/**
 * Network-session provider consumed by the orchestrator.
 * <p>
 * Dispatch methods return immediately: {@code false} means the call was
 * rejected synchronously and no completion will follow, {@code true} means
 * exactly one completion will later be delivered to the listeners subscribed
 * for that operation kind.
 */
public interface SessionBackend {

    /**
     * Gets the provider identity. The local/offline provider reports
     * {@link SessionConstants#LAN_BACKEND_IDENTITY}.
     *
     * @return the backend identity name
     */
    String getIdentity();

    /**
     * Looks up the session currently held under a name.
     *
     * @param sessionName the session name
     * @return the session snapshot, or empty if none exists
     */
    Optional<NamedSession> getNamedSession(String sessionName);

    /**
     * Registers a completion listener for one operation kind.
     *
     * @param kind the operation kind to listen for
     * @param listener the listener to invoke
     * @return a token that unregisters the listener
     */
    BackendSubscription subscribe(OperationKind kind, CompletionListener listener);

    /**
     * Unregisters a completion listener.
     *
     * @param subscription the token returned by {@link #subscribe}
     * @return true if the listener was registered and has been removed
     */
    boolean unsubscribe(BackendSubscription subscription);

    boolean createSession(PlayerIdentity host, String sessionName, SessionConfig config);

    boolean findSessions(PlayerIdentity searcher, SessionSearchQuery query);

    boolean joinSession(PlayerIdentity joiner, String sessionName, SessionSearchResult result);

    /**
     * Tears a named session down.
     *
     * @throws UnsupportedOperationException if the backend cannot destroy sessions
     */
    default boolean destroySession(String sessionName) {
        throw new UnsupportedOperationException(getIdentity() + " backend does not support destroySession");
    }

    /**
     * Marks a named session as started.
     *
     * @throws UnsupportedOperationException if the backend cannot start sessions
     */
    default boolean startSession(String sessionName) {
        throw new UnsupportedOperationException(getIdentity() + " backend does not support startSession");
    }

    /**
     * Resolves the address used to physically connect to a joined session.
     *
     * @param sessionName the joined session
     * @return the connect address, or empty if it could not be resolved
     */
    Optional<String> getResolvedConnectAddress(String sessionName);
}
