package sh.harold.sessionlink.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.sessionlink.api.session.SessionBackend;
import sh.harold.sessionlink.backend.local.LocalSessionBackend;
import sh.harold.sessionlink.backend.local.LocalSessionNetwork;
import sh.harold.sessionlink.config.SessionLinkSettings;

import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Creates the session backend selected by configuration.
 */
public final class SessionBackendFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionBackendFactory.class);

    private SessionBackendFactory() {
    }

    /**
     * Creates the configured backend.
     *
     * @param settings the loaded settings
     * @param network the local segment LAN backends attach to
     * @param scheduler the scheduler completions are delivered on
     * @return the backend, or empty when none is configured
     */
    public static Optional<SessionBackend> create(SessionLinkSettings settings,
                                                  LocalSessionNetwork network,
                                                  ScheduledExecutorService scheduler) {
        SessionLinkSettings.BackendType type = settings.getBackend().getType();
        LOGGER.info("Creating session backend of type: {}", type);

        switch (type) {
            case LOCAL:
                return Optional.of(new LocalSessionBackend(
                        settings.getSession().getLanIdentity(),
                        settings.getBackend().getHostAddress(),
                        network,
                        scheduler,
                        settings.getBackend().getCompletionDelay()));
            case NONE:
                LOGGER.warn("No session backend configured; session operations will fail as unavailable");
                return Optional.empty();
            default:
                throw new IllegalArgumentException("Unsupported session backend type: " + type);
        }
    }
}
