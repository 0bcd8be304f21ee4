package sh.harold.sessionlink.api.session.event.impl;

import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.event.CreateSessionCompleteEvent;
import sh.harold.sessionlink.api.session.event.DestroySessionCompleteEvent;
import sh.harold.sessionlink.api.session.event.FindSessionsCompleteEvent;
import sh.harold.sessionlink.api.session.event.JoinSessionCompleteEvent;
import sh.harold.sessionlink.api.session.event.SessionEvent;
import sh.harold.sessionlink.api.session.event.SessionEventChannel;
import sh.harold.sessionlink.api.session.event.SessionNotificationBus;
import sh.harold.sessionlink.api.session.event.StartSessionCompleteEvent;

/**
 * Notification bus backed by five in-process channels.
 */
public class InMemorySessionNotificationBus implements SessionNotificationBus {

    private final InMemorySessionEventChannel<CreateSessionCompleteEvent> createComplete =
            new InMemorySessionEventChannel<>("session.create.complete");
    private final InMemorySessionEventChannel<FindSessionsCompleteEvent> findComplete =
            new InMemorySessionEventChannel<>("session.find.complete");
    private final InMemorySessionEventChannel<JoinSessionCompleteEvent> joinComplete =
            new InMemorySessionEventChannel<>("session.join.complete");
    private final InMemorySessionEventChannel<DestroySessionCompleteEvent> destroyComplete =
            new InMemorySessionEventChannel<>("session.destroy.complete");
    private final InMemorySessionEventChannel<StartSessionCompleteEvent> startComplete =
            new InMemorySessionEventChannel<>("session.start.complete");

    @Override
    public SessionEventChannel<CreateSessionCompleteEvent> createComplete() {
        return createComplete;
    }

    @Override
    public SessionEventChannel<FindSessionsCompleteEvent> findComplete() {
        return findComplete;
    }

    @Override
    public SessionEventChannel<JoinSessionCompleteEvent> joinComplete() {
        return joinComplete;
    }

    @Override
    public SessionEventChannel<DestroySessionCompleteEvent> destroyComplete() {
        return destroyComplete;
    }

    @Override
    public SessionEventChannel<StartSessionCompleteEvent> startComplete() {
        return startComplete;
    }

    @Override
    public int publish(SessionEvent event) {
        if (event instanceof CreateSessionCompleteEvent created) {
            return createComplete.publish(created);
        }
        if (event instanceof FindSessionsCompleteEvent found) {
            return findComplete.publish(found);
        }
        if (event instanceof JoinSessionCompleteEvent joined) {
            return joinComplete.publish(joined);
        }
        if (event instanceof DestroySessionCompleteEvent destroyed) {
            return destroyComplete.publish(destroyed);
        }
        if (event instanceof StartSessionCompleteEvent started) {
            return startComplete.publish(started);
        }
        throw new IllegalArgumentException("Unsupported session event: " + event);
    }

    @Override
    public SessionEventChannel<? extends SessionEvent> channel(OperationKind kind) {
        switch (kind) {
            case CREATE:
                return createComplete;
            case FIND:
                return findComplete;
            case JOIN:
                return joinComplete;
            case DESTROY:
                return destroyComplete;
            case START:
                return startComplete;
            default:
                throw new IllegalArgumentException("Unsupported operation kind: " + kind);
        }
    }

    @Override
    public void clear() {
        createComplete.clear();
        findComplete.clear();
        joinComplete.clear();
        destroyComplete.clear();
        startComplete.clear();
    }
}
