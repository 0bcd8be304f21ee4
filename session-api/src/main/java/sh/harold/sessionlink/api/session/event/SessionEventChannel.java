package sh.harold.sessionlink.api.session.event;

/**
 * Multicast channel for one operation kind.
 * <p>
 * Zero subscribers is valid. Events are not buffered: a listener added after
 * an event was published never receives it.
 *
 * @param <E> the event type carried by the channel
 */
public interface SessionEventChannel<E extends SessionEvent> {

    EventRegistration subscribe(SessionEventListener<? super E> listener);

    boolean unsubscribe(EventRegistration registration);

    /**
     * Delivers an event synchronously to every current subscriber.
     *
     * @param event the event to deliver
     * @return the number of listeners that handled the event without error
     */
    int publish(E event);

    int getSubscriberCount();

    long getPublishedCount();

    void clear();
}
