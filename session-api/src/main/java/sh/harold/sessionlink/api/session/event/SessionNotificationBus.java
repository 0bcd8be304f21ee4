package sh.harold.sessionlink.api.session.event;

import sh.harold.sessionlink.api.session.OperationKind;

/**
 * Typed completion channels, one per operation kind.
 * <p>
 * The orchestrator publishes; UI and gameplay layers subscribe. Delivery order
 * across channels is not defined.
 *
 * <pre>{@code
 * bus.createComplete().subscribe(event -> {
 *     if (event.isSuccess()) {
 *         travel.travelToLobby(lobbyPath + "?listen");
 *     }
 * });
 * }</pre>
 */
public interface SessionNotificationBus {

    SessionEventChannel<CreateSessionCompleteEvent> createComplete();

    SessionEventChannel<FindSessionsCompleteEvent> findComplete();

    SessionEventChannel<JoinSessionCompleteEvent> joinComplete();

    SessionEventChannel<DestroySessionCompleteEvent> destroyComplete();

    SessionEventChannel<StartSessionCompleteEvent> startComplete();

    /**
     * Publishes an event on the channel matching its kind.
     *
     * @param event the event to publish
     * @return the number of listeners that handled the event
     */
    int publish(SessionEvent event);

    /**
     * Gets the channel for an operation kind.
     *
     * @param kind the operation kind
     * @return the channel carrying that kind's events
     */
    SessionEventChannel<? extends SessionEvent> channel(OperationKind kind);

    /**
     * Removes every listener from every channel. Typically only used on shutdown.
     */
    void clear();
}
