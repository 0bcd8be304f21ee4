package sh.harold.sessionlink.backend.local;

import sh.harold.sessionlink.api.session.SessionSearchQuery;
import sh.harold.sessionlink.api.session.SessionSearchResult;
import sh.harold.sessionlink.api.session.SessionState;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Simulated local network segment shared by every {@link LocalSessionBackend}
 * in the process. Sessions advertised here are discoverable by the others.
 */
public class LocalSessionNetwork {

    private final Map<String, LocalAdvertisedSession> advertised = new ConcurrentHashMap<>();

    void advertise(LocalAdvertisedSession session) {
        advertised.put(session.getHandle(), session);
    }

    void withdraw(LocalAdvertisedSession session) {
        advertised.remove(session.getHandle(), session);
    }

    Optional<LocalAdvertisedSession> lookup(String handle) {
        return Optional.ofNullable(advertised.get(handle));
    }

    /**
     * Lists sessions visible to a searcher, excluding the searcher's own.
     */
    List<SessionSearchResult> browse(String searcherId, SessionSearchQuery query) {
        return advertised.values().stream()
                .filter(session -> !session.getOwnerId().equals(searcherId))
                .filter(session -> session.getState() != SessionState.DESTROYING)
                .filter(session -> !query.lanOnly() || session.getConfig().isLan())
                .filter(session -> !query.lobbiesOnly() || session.getConfig().isPreferLobbies())
                .filter(LocalAdvertisedSession::isJoinable)
                .limit(query.maxResults())
                .map(LocalAdvertisedSession::toSearchResult)
                .collect(Collectors.toList());
    }

    public int getAdvertisedCount() {
        return advertised.size();
    }

    static String handleFor(String ownerId, String sessionName) {
        return ownerId + "/" + sessionName;
    }
}
