package sh.harold.sessionlink.orchestrator;

import sh.harold.sessionlink.api.session.AdvertisingMode;
import sh.harold.sessionlink.api.session.SessionBackend;
import sh.harold.sessionlink.api.session.SessionConfig;
import sh.harold.sessionlink.api.session.SessionSearchQuery;

import java.util.Objects;

/**
 * Derives session settings and search queries from the backend identity.
 * Join-in-progress, presence and lobby preference are fixed policy.
 */
public class SessionConfigFactory {

    private final String lanIdentity;

    public SessionConfigFactory(String lanIdentity) {
        this.lanIdentity = Objects.requireNonNull(lanIdentity, "lanIdentity");
    }

    public SessionConfig createConfig(SessionBackend backend, int maxPublicSlots, String matchTag) {
        return SessionConfig.builder()
                .maxPublicSlots(maxPublicSlots)
                .matchTag(matchTag)
                .advertisingMode(advertisingMode(backend))
                .joinInProgressAllowed(true)
                .usesPresence(true)
                .preferLobbies(true)
                .shouldAdvertise(true)
                .build();
    }

    public SessionSearchQuery createSearchQuery(SessionBackend backend, int maxResults) {
        return new SessionSearchQuery(maxResults, advertisingMode(backend) == AdvertisingMode.LAN, true);
    }

    public AdvertisingMode advertisingMode(SessionBackend backend) {
        return AdvertisingMode.forIdentity(backend.getIdentity(), lanIdentity);
    }

    public String getLanIdentity() {
        return lanIdentity;
    }
}
