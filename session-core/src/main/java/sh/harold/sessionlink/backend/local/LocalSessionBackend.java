package sh.harold.sessionlink.backend.local;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.sessionlink.api.session.BackendCompletion;
import sh.harold.sessionlink.api.session.BackendSubscription;
import sh.harold.sessionlink.api.session.CompletionListener;
import sh.harold.sessionlink.api.session.JoinResult;
import sh.harold.sessionlink.api.session.NamedSession;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.PlayerIdentity;
import sh.harold.sessionlink.api.session.SessionBackend;
import sh.harold.sessionlink.api.session.SessionConfig;
import sh.harold.sessionlink.api.session.SessionConstants;
import sh.harold.sessionlink.api.session.SessionSearchQuery;
import sh.harold.sessionlink.api.session.SessionSearchResult;
import sh.harold.sessionlink.api.session.SessionState;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process LAN session provider. One instance plays the role of one
 * machine; instances sharing a {@link LocalSessionNetwork} discover each
 * other's sessions.
 *
 * <p>Calls are validated synchronously and completed later on the
 * scheduler, mirroring a real provider's out-of-band completion.
 */
public class LocalSessionBackend implements SessionBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalSessionBackend.class);

    private final String identity;
    private final String hostAddress;
    private final LocalSessionNetwork network;
    private final ScheduledExecutorService scheduler;
    private final Duration completionDelay;
    private final Map<OperationKind, List<LocalSubscription>> listeners = new EnumMap<>(OperationKind.class);
    private final Map<String, Membership> localSessions = new ConcurrentHashMap<>();

    public LocalSessionBackend(String identity,
                               String hostAddress,
                               LocalSessionNetwork network,
                               ScheduledExecutorService scheduler,
                               Duration completionDelay) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.hostAddress = Objects.requireNonNull(hostAddress, "hostAddress");
        this.network = Objects.requireNonNull(network, "network");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.completionDelay = completionDelay == null ? Duration.ZERO : completionDelay;
        for (OperationKind kind : OperationKind.values()) {
            listeners.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    public LocalSessionBackend(String hostAddress, LocalSessionNetwork network, ScheduledExecutorService scheduler) {
        this(SessionConstants.LAN_BACKEND_IDENTITY, hostAddress, network, scheduler, Duration.ZERO);
    }

    @Override
    public String getIdentity() {
        return identity;
    }

    @Override
    public Optional<NamedSession> getNamedSession(String sessionName) {
        Membership membership = localSessions.get(sessionName);
        return membership == null ? Optional.empty() : Optional.of(membership.session.snapshot());
    }

    @Override
    public BackendSubscription subscribe(OperationKind kind, CompletionListener listener) {
        LocalSubscription subscription = new LocalSubscription(kind, Objects.requireNonNull(listener, "listener"));
        listeners.get(kind).add(subscription);
        return subscription;
    }

    @Override
    public boolean unsubscribe(BackendSubscription subscription) {
        if (!(subscription instanceof LocalSubscription local) || !local.active.compareAndSet(true, false)) {
            return false;
        }
        return listeners.get(local.kind).remove(local);
    }

    @Override
    public boolean createSession(PlayerIdentity host, String sessionName, SessionConfig config) {
        if (localSessions.containsKey(sessionName)) {
            LOGGER.warn("Cannot create session {}: this machine is already in a session with that name", sessionName);
            return false;
        }
        LocalAdvertisedSession session = new LocalAdvertisedSession(
                LocalSessionNetwork.handleFor(host.uniqueId(), sessionName),
                sessionName,
                host.uniqueId(),
                host.displayName(),
                hostAddress,
                config);
        localSessions.put(sessionName, new Membership(session, host.uniqueId(), true));
        if (config.isShouldAdvertise()) {
            network.advertise(session);
        }
        LOGGER.debug("{} hosting session {} with {} public slots", host.displayName(), sessionName,
                config.getMaxPublicSlots());
        deliver(BackendCompletion.created(sessionName, true));
        return true;
    }

    @Override
    public boolean findSessions(PlayerIdentity searcher, SessionSearchQuery query) {
        List<SessionSearchResult> results = network.browse(searcher.uniqueId(), query);
        LOGGER.debug("{} found {} session(s)", searcher.displayName(), results.size());
        deliver(BackendCompletion.found(results, true));
        return true;
    }

    @Override
    public boolean joinSession(PlayerIdentity joiner, String sessionName, SessionSearchResult result) {
        deliver(BackendCompletion.joined(sessionName, admit(joiner, sessionName, result)));
        return true;
    }

    @Override
    public boolean destroySession(String sessionName) {
        Membership membership = localSessions.remove(sessionName);
        if (membership == null) {
            return false;
        }
        if (membership.host) {
            membership.session.setState(SessionState.DESTROYING);
            network.withdraw(membership.session);
        } else {
            membership.session.removePlayer(membership.playerId);
        }
        deliver(BackendCompletion.destroyed(sessionName, true));
        return true;
    }

    @Override
    public boolean startSession(String sessionName) {
        Membership membership = localSessions.get(sessionName);
        if (membership == null || !membership.host) {
            return false;
        }
        boolean started = membership.session.getState() == SessionState.PENDING;
        if (started) {
            membership.session.setState(SessionState.IN_PROGRESS);
        }
        deliver(BackendCompletion.started(sessionName, started));
        return true;
    }

    @Override
    public Optional<String> getResolvedConnectAddress(String sessionName) {
        Membership membership = localSessions.get(sessionName);
        return membership == null ? Optional.empty() : Optional.of(membership.session.getHostAddress());
    }

    public String getHostAddress() {
        return hostAddress;
    }

    private JoinResult admit(PlayerIdentity joiner, String sessionName, SessionSearchResult result) {
        if (localSessions.containsKey(sessionName)) {
            return JoinResult.ALREADY_IN_SESSION;
        }
        Optional<LocalAdvertisedSession> found = network.lookup(result.handle());
        if (found.isEmpty() || !found.get().isJoinable()) {
            return JoinResult.SESSION_DOES_NOT_EXIST;
        }
        LocalAdvertisedSession session = found.get();
        if (session.hasPlayer(joiner.uniqueId())) {
            return JoinResult.ALREADY_IN_SESSION;
        }
        if (!session.addPlayer(joiner.uniqueId())) {
            return JoinResult.SESSION_IS_FULL;
        }
        localSessions.put(sessionName, new Membership(session, joiner.uniqueId(), false));
        return JoinResult.SUCCESS;
    }

    private void deliver(BackendCompletion completion) {
        scheduler.schedule(() -> notifyListeners(completion), completionDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void notifyListeners(BackendCompletion completion) {
        for (LocalSubscription subscription : listeners.get(completion.getKind())) {
            if (!subscription.isActive()) {
                continue;
            }
            try {
                subscription.listener.onComplete(completion);
            } catch (Exception e) {
                LOGGER.error("Completion listener {} failed handling {}", subscription.id, completion, e);
            }
        }
    }

    private static final class Membership {
        private final LocalAdvertisedSession session;
        private final String playerId;
        private final boolean host;

        private Membership(LocalAdvertisedSession session, String playerId, boolean host) {
            this.session = session;
            this.playerId = playerId;
            this.host = host;
        }
    }

    private static final class LocalSubscription implements BackendSubscription {
        private final UUID id = UUID.randomUUID();
        private final OperationKind kind;
        private final CompletionListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private LocalSubscription(OperationKind kind, CompletionListener listener) {
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
            return active.get();
        }
    }
}
