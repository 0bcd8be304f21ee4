package sh.harold.sessionlink.orchestrator;

import sh.harold.sessionlink.api.session.BackendCompletion;
import sh.harold.sessionlink.api.session.BackendSubscription;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.SessionBackend;
import sh.harold.sessionlink.api.session.SessionException;
import sh.harold.sessionlink.api.session.event.SessionEvent;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One issued backend call: how to dispatch it, how to turn its completion or
 * failure into an event, and the future the caller awaits.
 *
 * @param <E> the event type published for this operation
 */
final class PendingOperation<E extends SessionEvent> {

    private final OperationKind kind;
    private final String sessionName;
    private final Predicate<SessionBackend> dispatcher;
    private final Function<BackendCompletion, E> completionMapper;
    private final Function<SessionException, E> failureMapper;
    private final CompletableFuture<E> future = new CompletableFuture<>();

    private SessionBackend backend;
    private BackendSubscription subscription;

    PendingOperation(OperationKind kind,
                     String sessionName,
                     Predicate<SessionBackend> dispatcher,
                     Function<BackendCompletion, E> completionMapper,
                     Function<SessionException, E> failureMapper) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sessionName = sessionName;
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.completionMapper = Objects.requireNonNull(completionMapper, "completionMapper");
        this.failureMapper = Objects.requireNonNull(failureMapper, "failureMapper");
    }

    OperationKind getKind() {
        return kind;
    }

    String getSessionName() {
        return sessionName;
    }

    CompletableFuture<E> getFuture() {
        return future;
    }

    SessionBackend getBackend() {
        return backend;
    }

    BackendSubscription getSubscription() {
        return subscription;
    }

    void bind(SessionBackend backend, BackendSubscription subscription) {
        this.backend = backend;
        this.subscription = subscription;
    }

    boolean dispatch(SessionBackend target) {
        return dispatcher.test(target);
    }

    E toEvent(BackendCompletion completion) {
        return completionMapper.apply(completion);
    }

    E toFailure(SessionException error) {
        return failureMapper.apply(error);
    }

    @Override
    public String toString() {
        return "PendingOperation{kind=" + kind + ", session=" + sessionName + '}';
    }
}
