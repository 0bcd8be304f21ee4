package sh.harold.sessionlink.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.sessionlink.api.session.BackendCompletion;
import sh.harold.sessionlink.api.session.BackendSubscription;
import sh.harold.sessionlink.api.session.FailureCause;
import sh.harold.sessionlink.api.session.JoinResult;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.PlayerIdentity;
import sh.harold.sessionlink.api.session.SessionBackend;
import sh.harold.sessionlink.api.session.SessionBackendLocator;
import sh.harold.sessionlink.api.session.SessionConfig;
import sh.harold.sessionlink.api.session.SessionConstants;
import sh.harold.sessionlink.api.session.SessionException;
import sh.harold.sessionlink.api.session.SessionSearchQuery;
import sh.harold.sessionlink.api.session.SessionSearchResult;
import sh.harold.sessionlink.api.session.event.CreateSessionCompleteEvent;
import sh.harold.sessionlink.api.session.event.DestroySessionCompleteEvent;
import sh.harold.sessionlink.api.session.event.FindSessionsCompleteEvent;
import sh.harold.sessionlink.api.session.event.JoinSessionCompleteEvent;
import sh.harold.sessionlink.api.session.event.SessionEvent;
import sh.harold.sessionlink.api.session.event.SessionNotificationBus;
import sh.harold.sessionlink.api.session.event.StartSessionCompleteEvent;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Issues session operations against the backend and turns their out-of-band
 * completions into exactly one notification per operation.
 *
 * <p>Every entry point follows the same protocol: check the kind's slot is
 * idle, resolve the backend, register a completion subscription, dispatch the
 * call. A synchronous rejection clears the subscription and publishes a
 * failure at once; an accepted call is finished by the backend's completion,
 * which clears the subscription and publishes the real outcome.
 *
 * <p>A call issued while the same kind is still pending is rejected: the
 * returned future carries an {@link FailureCause#OPERATION_IN_PROGRESS}
 * failure, nothing is published and the backend is not touched.
 *
 * <p>Backend completions are handed to the callback executor before any state
 * is touched, so a backend completing on a worker thread is fenced back onto
 * the host application's main context.
 *
 * @author Harold
 * @since 1.0.0
 */
public class SessionOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionOrchestrator.class);

    private final SessionBackendLocator backendLocator;
    private final SessionNotificationBus notificationBus;
    private final PlayerIdentity localPlayer;
    private final String sessionName;
    private final SessionConfigFactory configFactory;
    private final Executor callbackExecutor;
    private final Map<OperationKind, OperationSubscription> slots = new EnumMap<>(OperationKind.class);

    private volatile String activeSessionName;
    private volatile SessionConfig lastSessionConfig;
    private volatile SessionSearchQuery lastSearchQuery;
    private volatile List<SessionSearchResult> lastSearchResults = List.of();

    public SessionOrchestrator(SessionBackendLocator backendLocator,
                               SessionNotificationBus notificationBus,
                               PlayerIdentity localPlayer,
                               String sessionName,
                               SessionConfigFactory configFactory,
                               Executor callbackExecutor) {
        this.backendLocator = Objects.requireNonNull(backendLocator, "Backend locator cannot be null");
        this.notificationBus = Objects.requireNonNull(notificationBus, "Notification bus cannot be null");
        this.localPlayer = Objects.requireNonNull(localPlayer, "Local player cannot be null");
        this.sessionName = Objects.requireNonNull(sessionName, "Session name cannot be null");
        this.configFactory = Objects.requireNonNull(configFactory, "Config factory cannot be null");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "Callback executor cannot be null");
        for (OperationKind kind : OperationKind.values()) {
            slots.put(kind, new OperationSubscription(kind));
        }
    }

    /**
     * Creates an orchestrator for the default session name, completing
     * callbacks on whichever thread the backend delivers them.
     */
    public SessionOrchestrator(SessionBackendLocator backendLocator,
                               SessionNotificationBus notificationBus,
                               PlayerIdentity localPlayer) {
        this(backendLocator, notificationBus, localPlayer, SessionConstants.GAME_SESSION,
                new SessionConfigFactory(SessionConstants.LAN_BACKEND_IDENTITY), Runnable::run);
    }

    /**
     * Hosts a new session under the well-known name. An existing session under
     * that name is destroyed first.
     *
     * @param maxPublicSlots public slots to advertise
     * @param matchTag match tag advertised with the session
     * @return a future completing with the published create event
     */
    public CompletableFuture<CreateSessionCompleteEvent> createSession(int maxPublicSlots, String matchTag) {
        if (maxPublicSlots < 0) {
            throw new IllegalArgumentException("Public slots must not be negative: " + maxPublicSlots);
        }
        Objects.requireNonNull(matchTag, "Match tag cannot be null");

        Function<SessionException, CreateSessionCompleteEvent> failure =
                error -> CreateSessionCompleteEvent.failure(sessionName, error.getFailureCause(), error);

        OperationSubscription slot = slot(OperationKind.CREATE);
        if (slot.isActive()) {
            return rejectInProgress(OperationKind.CREATE, failure);
        }
        Optional<SessionBackend> resolved = locateBackend(OperationKind.CREATE);
        if (resolved.isEmpty()) {
            return publishImmediately(failure.apply(SessionException.backendUnavailable(OperationKind.CREATE)));
        }
        SessionBackend backend = resolved.get();

        destroyExistingSession(backend);

        SessionConfig config = configFactory.createConfig(backend, maxPublicSlots, matchTag);
        lastSessionConfig = config;
        LOGGER.debug("Creating session {} with {}", sessionName, config);

        PendingOperation<CreateSessionCompleteEvent> operation = new PendingOperation<>(
                OperationKind.CREATE,
                sessionName,
                target -> target.createSession(localPlayer, sessionName, config),
                completion -> completion.isSuccess()
                        ? CreateSessionCompleteEvent.success(sessionName)
                        : failure.apply(SessionException.asyncFailure(OperationKind.CREATE, sessionName)),
                failure);
        return execute(slot, backend, operation);
    }

    /**
     * Searches for joinable lobby sessions. A search that yields no results is
     * reported as a failure even when the backend reports success.
     *
     * @param maxResults upper bound on results
     * @return a future completing with the published find event
     */
    public CompletableFuture<FindSessionsCompleteEvent> findSessions(int maxResults) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("Max results must be positive: " + maxResults);
        }
        Function<SessionException, FindSessionsCompleteEvent> failure =
                error -> FindSessionsCompleteEvent.failure(List.of(), error.getFailureCause(), error);

        OperationSubscription slot = slot(OperationKind.FIND);
        if (slot.isActive()) {
            return rejectInProgress(OperationKind.FIND, failure);
        }
        Optional<SessionBackend> resolved = locateBackend(OperationKind.FIND);
        if (resolved.isEmpty()) {
            return publishImmediately(failure.apply(SessionException.backendUnavailable(OperationKind.FIND)));
        }
        SessionBackend backend = resolved.get();

        SessionSearchQuery query = configFactory.createSearchQuery(backend, maxResults);
        lastSearchQuery = query;

        PendingOperation<FindSessionsCompleteEvent> operation = new PendingOperation<>(
                OperationKind.FIND,
                null,
                target -> target.findSessions(localPlayer, query),
                this::toFindEvent,
                failure);
        return execute(slot, backend, operation);
    }

    /**
     * Joins a session found by a previous search. The published event carries
     * the backend's result code unchanged.
     *
     * @param result the search result to join
     * @return a future completing with the published join event
     */
    public CompletableFuture<JoinSessionCompleteEvent> joinSession(SessionSearchResult result) {
        Objects.requireNonNull(result, "Search result cannot be null");

        Function<SessionException, JoinSessionCompleteEvent> failure =
                error -> JoinSessionCompleteEvent.failure(sessionName, error.getFailureCause(), error);

        OperationSubscription slot = slot(OperationKind.JOIN);
        if (slot.isActive()) {
            return rejectInProgress(OperationKind.JOIN, failure);
        }
        Optional<SessionBackend> resolved = locateBackend(OperationKind.JOIN);
        if (resolved.isEmpty()) {
            return publishImmediately(failure.apply(SessionException.backendUnavailable(OperationKind.JOIN)));
        }

        PendingOperation<JoinSessionCompleteEvent> operation = new PendingOperation<>(
                OperationKind.JOIN,
                sessionName,
                target -> target.joinSession(localPlayer, sessionName, result),
                completion -> JoinSessionCompleteEvent.completed(sessionName,
                        completion.getJoinResult() != null ? completion.getJoinResult() : JoinResult.UNKNOWN_ERROR),
                failure);
        return execute(slot, resolved.get(), operation);
    }

    /**
     * Tears down the active session. With no session active this is a no-op
     * that publishes a single successful destroy event.
     *
     * @return a future completing with the published destroy event
     */
    public CompletableFuture<DestroySessionCompleteEvent> destroySession() {
        String target = activeSessionName != null ? activeSessionName : sessionName;
        Function<SessionException, DestroySessionCompleteEvent> failure =
                error -> DestroySessionCompleteEvent.failure(target, error.getFailureCause(), error);

        OperationSubscription slot = slot(OperationKind.DESTROY);
        if (slot.isActive()) {
            return rejectInProgress(OperationKind.DESTROY, failure);
        }
        Optional<SessionBackend> resolved = locateBackend(OperationKind.DESTROY);
        if (resolved.isEmpty()) {
            return publishImmediately(failure.apply(SessionException.backendUnavailable(OperationKind.DESTROY)));
        }
        SessionBackend backend = resolved.get();

        boolean exists;
        try {
            exists = hasSession(backend, target);
        } catch (RuntimeException e) {
            LOGGER.warn("Backend {} failed looking up session {} to destroy", backend.getIdentity(), target, e);
            return publishImmediately(failure.apply(SessionException.dispatchFailed(OperationKind.DESTROY, target, e)));
        }
        if (!exists) {
            LOGGER.info("No active session {} to destroy", target);
            activeSessionName = null;
            return publishImmediately(DestroySessionCompleteEvent.success(target));
        }

        PendingOperation<DestroySessionCompleteEvent> operation = new PendingOperation<>(
                OperationKind.DESTROY,
                target,
                backendTarget -> backendTarget.destroySession(target),
                completion -> completion.isSuccess()
                        ? DestroySessionCompleteEvent.success(target)
                        : failure.apply(SessionException.asyncFailure(OperationKind.DESTROY, target)),
                failure);
        return execute(slot, backend, operation);
    }

    /**
     * Marks the active session as started. Fails with
     * {@link FailureCause#NO_ACTIVE_SESSION} when there is nothing to start.
     *
     * @return a future completing with the published start event
     */
    public CompletableFuture<StartSessionCompleteEvent> startSession() {
        String target = activeSessionName != null ? activeSessionName : sessionName;
        Function<SessionException, StartSessionCompleteEvent> failure =
                error -> StartSessionCompleteEvent.failure(target, error.getFailureCause(), error);

        OperationSubscription slot = slot(OperationKind.START);
        if (slot.isActive()) {
            return rejectInProgress(OperationKind.START, failure);
        }
        Optional<SessionBackend> resolved = locateBackend(OperationKind.START);
        if (resolved.isEmpty()) {
            return publishImmediately(failure.apply(SessionException.backendUnavailable(OperationKind.START)));
        }
        SessionBackend backend = resolved.get();

        boolean exists;
        try {
            exists = hasSession(backend, target);
        } catch (RuntimeException e) {
            LOGGER.warn("Backend {} failed looking up session {} to start", backend.getIdentity(), target, e);
            return publishImmediately(failure.apply(SessionException.dispatchFailed(OperationKind.START, target, e)));
        }
        if (!exists) {
            LOGGER.warn("Cannot start session {}: no session is active", target);
            return publishImmediately(failure.apply(SessionException.noActiveSession(OperationKind.START)));
        }

        PendingOperation<StartSessionCompleteEvent> operation = new PendingOperation<>(
                OperationKind.START,
                target,
                backendTarget -> backendTarget.startSession(target),
                completion -> completion.isSuccess()
                        ? StartSessionCompleteEvent.success(target)
                        : failure.apply(SessionException.asyncFailure(OperationKind.START, target)),
                failure);
        return execute(slot, backend, operation);
    }

    /**
     * Resolves the address to connect to for the active session.
     *
     * @return the connect address, or empty if there is no active session or
     *         the backend cannot resolve it
     */
    public Optional<String> getResolvedConnectAddress() {
        String active = activeSessionName;
        if (active == null) {
            return Optional.empty();
        }
        return backendLocator.locate().flatMap(backend -> backend.getResolvedConnectAddress(active));
    }

    /**
     * Fails every pending operation and releases its backend subscription.
     * The orchestrator stays usable afterwards.
     */
    public void shutdown() {
        for (OperationSubscription slot : slots.values()) {
            PendingOperation<?> pending = slot.peek();
            if (pending != null) {
                abort(slot, pending);
            }
        }
        activeSessionName = null;
        LOGGER.info("Session orchestrator for {} shut down", localPlayer.displayName());
    }

    public OperationState getOperationState(OperationKind kind) {
        return slot(kind).getState();
    }

    public boolean isPending(OperationKind kind) {
        return slot(kind).isActive();
    }

    /**
     * Gets the subscription slot for a kind. The slot is read-only outside
     * this package.
     */
    public OperationSubscription getSubscription(OperationKind kind) {
        return slot(kind);
    }

    public Optional<String> getActiveSessionName() {
        return Optional.ofNullable(activeSessionName);
    }

    public Optional<SessionConfig> getLastSessionConfig() {
        return Optional.ofNullable(lastSessionConfig);
    }

    public Optional<SessionSearchQuery> getLastSearchQuery() {
        return Optional.ofNullable(lastSearchQuery);
    }

    public List<SessionSearchResult> getLastSearchResults() {
        return Collections.unmodifiableList(lastSearchResults);
    }

    public String getSessionName() {
        return sessionName;
    }

    public PlayerIdentity getLocalPlayer() {
        return localPlayer;
    }

    public SessionNotificationBus getNotificationBus() {
        return notificationBus;
    }

    private <E extends SessionEvent> CompletableFuture<E> execute(OperationSubscription slot,
                                                                   SessionBackend backend,
                                                                   PendingOperation<E> operation) {
        OperationKind kind = operation.getKind();
        long generation = slot.begin(operation);
        if (generation < 0) {
            return rejectInProgress(kind, operation::toFailure);
        }

        BackendSubscription subscription;
        try {
            subscription = backend.subscribe(kind,
                    completion -> callbackExecutor.execute(() -> onCompletion(slot, generation, operation, completion)));
        } catch (RuntimeException e) {
            LOGGER.warn("Backend {} refused a {} completion subscription", backend.getIdentity(), kind, e);
            operation.bind(backend, null);
            terminate(slot, generation, operation,
                    operation.toFailure(SessionException.dispatchFailed(kind, operation.getSessionName(), e)));
            return operation.getFuture();
        }
        operation.bind(backend, subscription);
        LOGGER.debug("Registered {} subscription {} on backend {}", kind, subscription.getId(), backend.getIdentity());

        boolean accepted;
        try {
            accepted = operation.dispatch(backend);
        } catch (UnsupportedOperationException e) {
            LOGGER.error("Backend {} does not implement {}", backend.getIdentity(), kind, e);
            terminate(slot, generation, operation, operation.toFailure(SessionException.notImplemented(kind, e)));
            return operation.getFuture();
        } catch (RuntimeException e) {
            LOGGER.warn("Backend {} failed dispatching {} for session {}",
                    backend.getIdentity(), kind, operation.getSessionName(), e);
            terminate(slot, generation, operation,
                    operation.toFailure(SessionException.dispatchFailed(kind, operation.getSessionName(), e)));
            return operation.getFuture();
        }

        if (!accepted) {
            LOGGER.warn("Couldn't {} session {}: backend {} rejected the call",
                    kind.getId(), operation.getSessionName(), backend.getIdentity());
            terminate(slot, generation, operation,
                    operation.toFailure(SessionException.dispatchRejected(kind, operation.getSessionName())));
        }
        return operation.getFuture();
    }

    private <E extends SessionEvent> void onCompletion(OperationSubscription slot,
                                                       long generation,
                                                       PendingOperation<E> operation,
                                                       BackendCompletion completion) {
        if (completion.getKind() != operation.getKind()) {
            LOGGER.debug("Ignoring {} delivered to a {} subscription", completion, operation.getKind());
            return;
        }
        if (operation.getSessionName() != null && completion.getSessionName() != null
                && !operation.getSessionName().equals(completion.getSessionName())) {
            LOGGER.debug("Ignoring {} for a different session than {}", completion, operation.getSessionName());
            return;
        }

        E event;
        try {
            event = operation.toEvent(completion);
        } catch (RuntimeException e) {
            LOGGER.error("Failed to interpret {}", completion, e);
            event = operation.toFailure(new SessionException(operation.getKind(), FailureCause.ASYNC_FAILURE,
                    "Malformed " + operation.getKind().getId() + " completion", e));
        }
        terminate(slot, generation, operation, event);
    }

    private <E extends SessionEvent> boolean terminate(OperationSubscription slot,
                                                       long generation,
                                                       PendingOperation<E> operation,
                                                       E event) {
        if (slot.finish(generation, event.isSuccess()) == null) {
            LOGGER.debug("Ignoring stale {} completion for generation {}", operation.getKind(), generation);
            return false;
        }

        releaseSubscription(operation);
        applyOutcome(event);

        if (event.isSuccess()) {
            LOGGER.info("{} completed for session {}", operation.getKind(), event.getSessionName());
        } else {
            LOGGER.info("{} failed for session {}: {}", operation.getKind(), event.getSessionName(),
                    event.getFailureCause().getDescription());
        }

        notificationBus.publish(event);
        operation.getFuture().complete(event);
        return true;
    }

    private <E extends SessionEvent> void abort(OperationSubscription slot, PendingOperation<E> operation) {
        terminate(slot, slot.currentGeneration(), operation,
                operation.toFailure(SessionException.shutdown(operation.getKind())));
    }

    private void releaseSubscription(PendingOperation<?> operation) {
        BackendSubscription subscription = operation.getSubscription();
        if (subscription == null) {
            return;
        }
        try {
            if (!operation.getBackend().unsubscribe(subscription)) {
                LOGGER.debug("{} subscription {} was already unregistered", operation.getKind(), subscription.getId());
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to unregister {} subscription {}", operation.getKind(), subscription.getId(), e);
        }
    }

    private void applyOutcome(SessionEvent event) {
        if (!event.isSuccess()) {
            return;
        }
        switch (event.getKind()) {
            case CREATE:
            case JOIN:
                activeSessionName = event.getSessionName();
                break;
            case DESTROY:
                activeSessionName = null;
                break;
            case FIND:
                lastSearchResults = ((FindSessionsCompleteEvent) event).getResults();
                break;
            default:
                break;
        }
    }

    private FindSessionsCompleteEvent toFindEvent(BackendCompletion completion) {
        List<SessionSearchResult> results = completion.getResults();
        if (results.isEmpty()) {
            return FindSessionsCompleteEvent.failure(results, FailureCause.EMPTY_RESULTS, SessionException.emptyResults());
        }
        if (!completion.isSuccess()) {
            return FindSessionsCompleteEvent.failure(results, FailureCause.ASYNC_FAILURE,
                    SessionException.asyncFailure(OperationKind.FIND, null));
        }
        return FindSessionsCompleteEvent.success(results);
    }

    private void destroyExistingSession(SessionBackend backend) {
        try {
            if (backend.getNamedSession(sessionName).isEmpty()) {
                return;
            }
            LOGGER.info("Destroying existing session {} before creating a new one", sessionName);
            if (!backend.destroySession(sessionName)) {
                LOGGER.warn("Backend {} rejected teardown of existing session {}", backend.getIdentity(), sessionName);
            }
        } catch (UnsupportedOperationException e) {
            LOGGER.warn("Backend {} cannot destroy existing session {}; creating anyway",
                    backend.getIdentity(), sessionName, e);
        } catch (RuntimeException e) {
            LOGGER.warn("Backend {} failed tearing down existing session {}; creating anyway",
                    backend.getIdentity(), sessionName, e);
        }
        activeSessionName = null;
    }

    private boolean hasSession(SessionBackend backend, String target) {
        return backend.getNamedSession(target).isPresent();
    }

    private Optional<SessionBackend> locateBackend(OperationKind kind) {
        Optional<SessionBackend> backend = backendLocator.locate();
        if (backend.isEmpty()) {
            LOGGER.warn("No session backend available to {} session {}", kind.getId(), sessionName);
        }
        return backend;
    }

    private <E extends SessionEvent> CompletableFuture<E> rejectInProgress(OperationKind kind,
                                                                            Function<SessionException, E> failure) {
        LOGGER.warn("Rejected {} request: a {} operation has been pending for {} ms",
                kind.getId(), kind.getId(), slot(kind).getTimePending().toMillis());
        return CompletableFuture.completedFuture(failure.apply(SessionException.operationInProgress(kind)));
    }

    private <E extends SessionEvent> CompletableFuture<E> publishImmediately(E event) {
        notificationBus.publish(event);
        return CompletableFuture.completedFuture(event);
    }

    private OperationSubscription slot(OperationKind kind) {
        return slots.get(Objects.requireNonNull(kind, "kind"));
    }
}
