package sh.harold.sessionlink.api.session;

import java.util.UUID;

/**
 * Token returned when registering a {@link CompletionListener} with a backend.
 * Used to unregister the listener once its completion has arrived.
 */
public interface BackendSubscription {

    UUID getId();

    OperationKind getKind();

    /**
     * @return true while the listener is still registered with the backend
     */
    boolean isActive();
}
