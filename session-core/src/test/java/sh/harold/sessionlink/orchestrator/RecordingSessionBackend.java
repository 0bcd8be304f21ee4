package sh.harold.sessionlink.orchestrator;

import sh.harold.sessionlink.api.session.BackendCompletion;
import sh.harold.sessionlink.api.session.BackendSubscription;
import sh.harold.sessionlink.api.session.CompletionListener;
import sh.harold.sessionlink.api.session.NamedSession;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.PlayerIdentity;
import sh.harold.sessionlink.api.session.SessionBackend;
import sh.harold.sessionlink.api.session.SessionConfig;
import sh.harold.sessionlink.api.session.SessionSearchQuery;
import sh.harold.sessionlink.api.session.SessionSearchResult;
import sh.harold.sessionlink.api.session.SessionState;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scriptable backend that records calls and completes only when told to.
 */
class RecordingSessionBackend implements SessionBackend {

    private final String identity;
    private final Map<OperationKind, List<Subscription>> listeners = new EnumMap<>(OperationKind.class);
    private final Map<String, NamedSession> sessions = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<Subscription> history = new CopyOnWriteArrayList<>();

    private volatile boolean acceptCalls = true;
    private volatile RuntimeException dispatchFailure;
    private volatile RuntimeException lookupFailure;
    private volatile RuntimeException teardownFailure;
    private volatile boolean lifecycleSupported = true;
    private volatile String connectAddress;
    private volatile SessionConfig lastConfig;
    private volatile SessionSearchQuery lastQuery;
    private volatile SessionSearchResult lastJoinTarget;

    RecordingSessionBackend(String identity) {
        this.identity = identity;
        for (OperationKind kind : OperationKind.values()) {
            listeners.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    void setAcceptCalls(boolean acceptCalls) {
        this.acceptCalls = acceptCalls;
    }

    void setDispatchFailure(RuntimeException dispatchFailure) {
        this.dispatchFailure = dispatchFailure;
    }

    void setLookupFailure(RuntimeException lookupFailure) {
        this.lookupFailure = lookupFailure;
    }

    void setTeardownFailure(RuntimeException teardownFailure) {
        this.teardownFailure = teardownFailure;
    }

    void setLifecycleSupported(boolean lifecycleSupported) {
        this.lifecycleSupported = lifecycleSupported;
    }

    void setConnectAddress(String connectAddress) {
        this.connectAddress = connectAddress;
    }

    void putSession(String name) {
        SessionConfig config = SessionConfig.builder().matchTag("existing").build();
        sessions.put(name, new NamedSession(name, "host", config, SessionState.PENDING, Set.of("host")));
    }

    void removeSession(String name) {
        sessions.remove(name);
    }

    /**
     * Delivers a completion to every listener currently registered for its kind.
     *
     * @return the number of listeners invoked
     */
    int complete(BackendCompletion completion) {
        int invoked = 0;
        for (Subscription subscription : listeners.get(completion.getKind())) {
            if (subscription.active) {
                subscription.listener.onComplete(completion);
                invoked++;
            }
        }
        return invoked;
    }

    /**
     * Invokes the listener of the n-th subscription ever registered, even if it
     * was unsubscribed since. Simulates a provider firing a late callback.
     */
    void replayTo(int subscriptionIndex, BackendCompletion completion) {
        history.get(subscriptionIndex).listener.onComplete(completion);
    }

    int activeSubscriptions(OperationKind kind) {
        return (int) listeners.get(kind).stream().filter(subscription -> subscription.active).count();
    }

    int totalActiveSubscriptions() {
        int total = 0;
        for (OperationKind kind : OperationKind.values()) {
            total += activeSubscriptions(kind);
        }
        return total;
    }

    List<String> getCalls() {
        return new ArrayList<>(calls);
    }

    SessionConfig getLastConfig() {
        return lastConfig;
    }

    SessionSearchQuery getLastQuery() {
        return lastQuery;
    }

    SessionSearchResult getLastJoinTarget() {
        return lastJoinTarget;
    }

    @Override
    public String getIdentity() {
        return identity;
    }

    @Override
    public Optional<NamedSession> getNamedSession(String sessionName) {
        if (lookupFailure != null) {
            throw lookupFailure;
        }
        return Optional.ofNullable(sessions.get(sessionName));
    }

    @Override
    public BackendSubscription subscribe(OperationKind kind, CompletionListener listener) {
        Subscription subscription = new Subscription(kind, listener);
        listeners.get(kind).add(subscription);
        history.add(subscription);
        return subscription;
    }

    @Override
    public boolean unsubscribe(BackendSubscription subscription) {
        if (!(subscription instanceof Subscription recorded) || !recorded.active) {
            return false;
        }
        recorded.active = false;
        return listeners.get(recorded.kind).remove(recorded);
    }

    @Override
    public boolean createSession(PlayerIdentity host, String sessionName, SessionConfig config) {
        calls.add("create:" + sessionName);
        lastConfig = config;
        return dispatch();
    }

    @Override
    public boolean findSessions(PlayerIdentity searcher, SessionSearchQuery query) {
        calls.add("find");
        lastQuery = query;
        return dispatch();
    }

    @Override
    public boolean joinSession(PlayerIdentity joiner, String sessionName, SessionSearchResult result) {
        calls.add("join:" + result.handle());
        lastJoinTarget = result;
        return dispatch();
    }

    @Override
    public boolean destroySession(String sessionName) {
        if (!lifecycleSupported) {
            return SessionBackend.super.destroySession(sessionName);
        }
        calls.add("destroy:" + sessionName);
        if (teardownFailure != null) {
            throw teardownFailure;
        }
        sessions.remove(sessionName);
        return dispatch();
    }

    @Override
    public boolean startSession(String sessionName) {
        if (!lifecycleSupported) {
            return SessionBackend.super.startSession(sessionName);
        }
        calls.add("start:" + sessionName);
        return dispatch();
    }

    @Override
    public Optional<String> getResolvedConnectAddress(String sessionName) {
        return Optional.ofNullable(connectAddress);
    }

    private boolean dispatch() {
        if (dispatchFailure != null) {
            throw dispatchFailure;
        }
        return acceptCalls;
    }

    private static final class Subscription implements BackendSubscription {
        private final UUID id = UUID.randomUUID();
        private final OperationKind kind;
        private final CompletionListener listener;
        private volatile boolean active = true;

        private Subscription(OperationKind kind, CompletionListener listener) {
            this.kind = kind;
            this.listener = listener;
        }

        @Override
        public UUID getId() {
            return id;
        }

        @Override
        public OperationKind getKind() {
            return kind;
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
