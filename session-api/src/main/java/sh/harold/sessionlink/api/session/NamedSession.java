package sh.harold.sessionlink.api.session;

import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of a session a backend currently holds under a well-known name.
 *
 * @param name the session name
 * @param ownerId unique id of the hosting participant
 * @param config the settings the session was created with
 * @param state current lifecycle state
 * @param registeredPlayers unique ids of participants in the session
 */
public record NamedSession(String name,
                           String ownerId,
                           SessionConfig config,
                           SessionState state,
                           Set<String> registeredPlayers) {

    public NamedSession {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(state, "state");
        registeredPlayers = registeredPlayers == null ? Set.of() : Set.copyOf(registeredPlayers);
    }

    public int getOpenPublicSlots() {
        return Math.max(0, config.getMaxPublicSlots() - registeredPlayers.size());
    }
}
