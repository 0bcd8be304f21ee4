package sh.harold.sessionlink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.sessionlink.api.session.PlayerIdentity;
import sh.harold.sessionlink.api.session.SessionBackend;
import sh.harold.sessionlink.api.session.SessionBackendLocator;
import sh.harold.sessionlink.api.session.TravelService;
import sh.harold.sessionlink.api.session.event.SessionNotificationBus;
import sh.harold.sessionlink.api.session.event.impl.InMemorySessionNotificationBus;
import sh.harold.sessionlink.backend.SessionBackendFactory;
import sh.harold.sessionlink.backend.local.LocalSessionNetwork;
import sh.harold.sessionlink.config.SessionLinkSettings;
import sh.harold.sessionlink.config.SessionLinkSettingsLoader;
import sh.harold.sessionlink.menu.MenuSettings;
import sh.harold.sessionlink.menu.SessionMenuController;
import sh.harold.sessionlink.orchestrator.SessionConfigFactory;
import sh.harold.sessionlink.orchestrator.SessionOrchestrator;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Owns the session components for one run of the host application: the
 * settings, the backend, the notification bus and the orchestrator. Menus are
 * created from the context instead of looking the orchestrator up.
 */
public class SessionLinkContext implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionLinkContext.class);

    private final SessionLinkSettings settings;
    private final ScheduledExecutorService scheduler;
    private final SessionBackend backend;
    private final SessionNotificationBus notificationBus;
    private final SessionOrchestrator orchestrator;
    private final List<SessionMenuController> menus = new CopyOnWriteArrayList<>();

    public SessionLinkContext(SessionLinkSettings settings, LocalSessionNetwork network, Executor callbackExecutor) {
        this.settings = Objects.requireNonNull(settings, "settings");
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "SessionLink-Backend-" + settings.getPlayer().getId());
            t.setDaemon(true);
            return t;
        });
        // completions still queued at close belong to operations the orchestrator already failed
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.scheduler = executor;
        this.backend = SessionBackendFactory.create(settings, network, scheduler).orElse(null);
        this.notificationBus = new InMemorySessionNotificationBus();

        SessionLinkSettings.SessionSection session = settings.getSession();
        PlayerIdentity player = new PlayerIdentity(settings.getPlayer().getId(), settings.getPlayer().getDisplayName());
        SessionBackendLocator locator = backend != null ? SessionBackendLocator.of(backend) : SessionBackendLocator.none();
        this.orchestrator = new SessionOrchestrator(
                locator,
                notificationBus,
                player,
                session.getName(),
                new SessionConfigFactory(session.getLanIdentity()),
                callbackExecutor);

        LOGGER.info("SessionLink context ready for {} (backend: {})", player.displayName(),
                backend != null ? backend.getIdentity() : "none");
    }

    /**
     * Creates a context from {@code sessionlink.yml} on a private network
     * segment, completing callbacks on the backend thread.
     */
    public static SessionLinkContext create() {
        return new SessionLinkContext(new SessionLinkSettingsLoader().load(), new LocalSessionNetwork(), Runnable::run);
    }

    /**
     * Creates a menu bound to this context's orchestrator.
     *
     * @param travelService the gameplay transition mechanism
     * @return a menu already bound to the notification bus
     */
    public SessionMenuController createMenu(TravelService travelService) {
        SessionMenuController menu = new SessionMenuController(orchestrator, notificationBus, travelService,
                MenuSettings.from(settings));
        menu.setup();
        menus.add(menu);
        return menu;
    }

    public SessionLinkSettings getSettings() {
        return settings;
    }

    public Optional<SessionBackend> getBackend() {
        return Optional.ofNullable(backend);
    }

    public SessionNotificationBus getNotificationBus() {
        return notificationBus;
    }

    public SessionOrchestrator getOrchestrator() {
        return orchestrator;
    }

    @Override
    public void close() {
        menus.forEach(SessionMenuController::teardown);
        menus.clear();
        orchestrator.shutdown();
        releaseSession();
        notificationBus.clear();
        shutdownScheduler(scheduler);
        LOGGER.info("SessionLink context closed");
    }

    /**
     * Leaves or withdraws the session this context still holds so other
     * players on the network stop seeing it.
     */
    private void releaseSession() {
        if (backend == null) {
            return;
        }
        String sessionName = settings.getSession().getName();
        try {
            if (backend.getNamedSession(sessionName).isPresent()) {
                backend.destroySession(sessionName);
                LOGGER.info("Released session {} on close", sessionName);
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to release session {} on close", sessionName, e);
        }
    }

    private static void shutdownScheduler(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
