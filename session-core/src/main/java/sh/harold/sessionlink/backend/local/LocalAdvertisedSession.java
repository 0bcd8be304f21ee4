package sh.harold.sessionlink.backend.local;

import sh.harold.sessionlink.api.session.NamedSession;
import sh.harold.sessionlink.api.session.SessionConfig;
import sh.harold.sessionlink.api.session.SessionSearchResult;
import sh.harold.sessionlink.api.session.SessionState;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A session hosted by one participant on the local segment. Mutated only
 * under its own monitor.
 */
final class LocalAdvertisedSession {

    private final String handle;
    private final String name;
    private final String ownerId;
    private final String ownerName;
    private final String hostAddress;
    private final SessionConfig config;
    private final Set<String> players = new LinkedHashSet<>();
    private SessionState state = SessionState.PENDING;

    LocalAdvertisedSession(String handle, String name, String ownerId, String ownerName,
                           String hostAddress, SessionConfig config) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.name = Objects.requireNonNull(name, "name");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.ownerName = Objects.requireNonNull(ownerName, "ownerName");
        this.hostAddress = Objects.requireNonNull(hostAddress, "hostAddress");
        this.config = Objects.requireNonNull(config, "config");
        this.players.add(ownerId);
    }

    String getHandle() {
        return handle;
    }

    String getName() {
        return name;
    }

    String getOwnerId() {
        return ownerId;
    }

    String getHostAddress() {
        return hostAddress;
    }

    SessionConfig getConfig() {
        return config;
    }

    synchronized SessionState getState() {
        return state;
    }

    synchronized void setState(SessionState state) {
        this.state = state;
    }

    synchronized boolean hasPlayer(String playerId) {
        return players.contains(playerId);
    }

    synchronized int getOpenPublicSlots() {
        return Math.max(0, config.getMaxPublicSlots() - players.size());
    }

    /**
     * Whether a new participant could currently enter the session.
     */
    synchronized boolean isJoinable() {
        if (state == SessionState.DESTROYING) {
            return false;
        }
        return state == SessionState.PENDING || config.isJoinInProgressAllowed();
    }

    synchronized boolean addPlayer(String playerId) {
        if (getOpenPublicSlots() <= 0) {
            return false;
        }
        return players.add(playerId);
    }

    synchronized void removePlayer(String playerId) {
        players.remove(playerId);
    }

    synchronized NamedSession snapshot() {
        return new NamedSession(name, ownerId, config, state, players);
    }

    synchronized SessionSearchResult toSearchResult() {
        return new SessionSearchResult(handle, ownerName, 0, getOpenPublicSlots(), config.getAttributes());
    }
}
