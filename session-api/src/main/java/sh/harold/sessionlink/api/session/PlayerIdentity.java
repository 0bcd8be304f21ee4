package sh.harold.sessionlink.api.session;

import java.util.Objects;

/**
 * Identity of the local participant issuing session calls.
 *
 * @param uniqueId stable backend-specific identifier
 * @param displayName name shown to other participants
 */
public record PlayerIdentity(String uniqueId, String displayName) {

    public PlayerIdentity {
        Objects.requireNonNull(uniqueId, "uniqueId");
        if (uniqueId.isBlank()) {
            throw new IllegalArgumentException("Player id must not be blank");
        }
        displayName = displayName == null || displayName.isBlank() ? uniqueId : displayName;
    }

    public static PlayerIdentity of(String uniqueId) {
        return new PlayerIdentity(uniqueId, uniqueId);
    }
}
