package sh.harold.sessionlink.api.session.event;

/**
 * Receives events from one notification channel.
 *
 * @param <E> the event type of the channel
 */
@FunctionalInterface
public interface SessionEventListener<E extends SessionEvent> {

    void onEvent(E event);
}
