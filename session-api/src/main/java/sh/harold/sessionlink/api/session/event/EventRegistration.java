package sh.harold.sessionlink.api.session.event;

import java.util.UUID;

/**
 * Token representing a listener registration on a channel.
 */
public interface EventRegistration {

    UUID getId();

    /**
     * Gets the timestamp when this registration was created.
     *
     * @return the registration timestamp in milliseconds
     */
    long getTimestamp();

    /**
     * @return true until the listener is unregistered
     */
    boolean isActive();

    /**
     * Unregisters this listener.
     *
     * @return true if successfully unregistered, false if already unregistered
     */
    boolean unregister();
}
