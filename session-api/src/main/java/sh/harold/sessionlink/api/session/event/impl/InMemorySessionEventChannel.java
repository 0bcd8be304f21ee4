package sh.harold.sessionlink.api.session.event.impl;

import sh.harold.sessionlink.api.session.event.EventRegistration;
import sh.harold.sessionlink.api.session.event.SessionEvent;
import sh.harold.sessionlink.api.session.event.SessionEventChannel;
import sh.harold.sessionlink.api.session.event.SessionEventListener;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process channel that delivers events synchronously in the publisher's thread.
 *
 * @param <E> the event type carried by the channel
 */
public class InMemorySessionEventChannel<E extends SessionEvent> implements SessionEventChannel<E> {

    private static final Logger LOGGER = Logger.getLogger(InMemorySessionEventChannel.class.getName());

    private final String name;
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicLong published = new AtomicLong();

    public InMemorySessionEventChannel(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public EventRegistration subscribe(SessionEventListener<? super E> listener) {
        Registration registration = new Registration(Objects.requireNonNull(listener, "listener"));
        registrations.add(registration);
        LOGGER.fine("Subscribed listener " + registration.getId() + " to channel " + name);
        return registration;
    }

    @Override
    public boolean unsubscribe(EventRegistration registration) {
        if (registration == null) {
            return false;
        }
        return registration.unregister();
    }

    @Override
    public int publish(E event) {
        Objects.requireNonNull(event, "event");
        published.incrementAndGet();

        int delivered = 0;
        for (Registration registration : registrations) {
            if (!registration.isActive()) {
                continue;
            }
            try {
                registration.listener.onEvent(event);
                delivered++;
            } catch (Exception e) {
                LOGGER.log(Level.SEVERE, "Listener " + registration.getId() + " failed handling " + event
                        + " on channel " + name, e);
            }
        }
        LOGGER.fine("Published " + event + " on channel " + name + " to " + delivered + " listener(s)");
        return delivered;
    }

    @Override
    public int getSubscriberCount() {
        return registrations.size();
    }

    @Override
    public long getPublishedCount() {
        return published.get();
    }

    @Override
    public void clear() {
        for (Registration registration : registrations) {
            registration.unregister();
        }
    }

    public String getName() {
        return name;
    }

    private final class Registration implements EventRegistration {
        private final UUID id = UUID.randomUUID();
        private final long timestamp = System.currentTimeMillis();
        private final SessionEventListener<? super E> listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(SessionEventListener<? super E> listener) {
            this.listener = listener;
        }

        @Override
        public UUID getId() {
            return id;
        }

        @Override
        public long getTimestamp() {
            return timestamp;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public boolean unregister() {
            if (!active.compareAndSet(true, false)) {
                return false;
            }
            registrations.remove(this);
            LOGGER.fine("Unsubscribed listener " + id + " from channel " + name);
            return true;
        }
    }
}
