package sh.harold.sessionlink.api.session;

import java.util.Optional;

/**
 * Resolves the session backend at the moment an operation is issued.
 * An empty result means no backend is configured or it has gone away.
 */
@FunctionalInterface
public interface SessionBackendLocator {

    Optional<SessionBackend> locate();

    static SessionBackendLocator of(SessionBackend backend) {
        Optional<SessionBackend> resolved = Optional.of(backend);
        return () -> resolved;
    }

    static SessionBackendLocator none() {
        return Optional::empty;
    }
}
