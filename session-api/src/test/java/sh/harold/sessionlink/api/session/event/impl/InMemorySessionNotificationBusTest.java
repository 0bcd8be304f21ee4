package sh.harold.sessionlink.api.session.event.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.event.CreateSessionCompleteEvent;
import sh.harold.sessionlink.api.session.event.DestroySessionCompleteEvent;
import sh.harold.sessionlink.api.session.event.EventRegistration;
import sh.harold.sessionlink.api.session.event.SessionEvent;
import sh.harold.sessionlink.api.session.event.StartSessionCompleteEvent;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySessionNotificationBusTest {

    private InMemorySessionNotificationBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemorySessionNotificationBus();
    }

    @Test
    void deliversToEverySubscriberInOrder() {
        List<String> seen = new ArrayList<>();
        bus.createComplete().subscribe(event -> seen.add("first:" + event.getSessionName()));
        bus.createComplete().subscribe(event -> seen.add("second:" + event.getSessionName()));

        int delivered = bus.publish(CreateSessionCompleteEvent.success("GameSession"));

        assertThat(delivered).isEqualTo(2);
        assertThat(seen).containsExactly("first:GameSession", "second:GameSession");
    }

    @Test
    void eventsPublishedBeforeSubscribingAreNotReplayed() {
        bus.publish(CreateSessionCompleteEvent.success("GameSession"));
        List<CreateSessionCompleteEvent> seen = new ArrayList<>();

        bus.createComplete().subscribe(seen::add);

        assertThat(seen).isEmpty();
        assertThat(bus.createComplete().getPublishedCount()).isEqualTo(1);
    }

    @Test
    void routesEventsToTheirOwnChannel() {
        List<SessionEvent> destroyed = new ArrayList<>();
        List<SessionEvent> started = new ArrayList<>();
        bus.destroyComplete().subscribe(destroyed::add);
        bus.startComplete().subscribe(started::add);

        bus.publish(DestroySessionCompleteEvent.success("GameSession"));

        assertThat(destroyed).hasSize(1);
        assertThat(started).isEmpty();
        assertThat(bus.channel(OperationKind.DESTROY)).isSameAs(bus.destroyComplete());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        List<StartSessionCompleteEvent> seen = new ArrayList<>();
        bus.startComplete().subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });
        bus.startComplete().subscribe(seen::add);

        int delivered = bus.publish(StartSessionCompleteEvent.success("GameSession"));

        assertThat(delivered).isEqualTo(1);
        assertThat(seen).hasSize(1);
    }

    @Test
    void unregisteredListenerStopsReceiving() {
        List<CreateSessionCompleteEvent> seen = new ArrayList<>();
        EventRegistration registration = bus.createComplete().subscribe(seen::add);

        assertThat(registration.unregister()).isTrue();
        assertThat(registration.unregister()).isFalse();
        assertThat(registration.isActive()).isFalse();
        bus.publish(CreateSessionCompleteEvent.success("GameSession"));

        assertThat(seen).isEmpty();
        assertThat(bus.createComplete().getSubscriberCount()).isZero();
        assertThat(bus.createComplete().unsubscribe(null)).isFalse();
    }

    @Test
    void clearRemovesAllSubscribers() {
        bus.createComplete().subscribe(event -> { });
        bus.findComplete().subscribe(event -> { });

        bus.clear();

        assertThat(bus.createComplete().getSubscriberCount()).isZero();
        assertThat(bus.findComplete().getSubscriberCount()).isZero();
    }

    @Test
    void rejectsNullEvents() {
        assertThatThrownBy(() -> bus.createComplete().publish(null)).isInstanceOf(NullPointerException.class);
    }
}
