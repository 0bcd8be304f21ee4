package sh.harold.sessionlink.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import sh.harold.sessionlink.api.session.SessionConstants;

import java.time.Duration;

/**
 * Typed view of {@code sessionlink.yml}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionLinkSettings {

    @JsonProperty("session")
    private SessionSection session = new SessionSection();

    @JsonProperty("backend")
    private BackendSection backend = new BackendSection();

    @JsonProperty("player")
    private PlayerSection player = new PlayerSection();

    public static SessionLinkSettings defaults() {
        return new SessionLinkSettings();
    }

    public SessionSection getSession() {
        return session;
    }

    public BackendSection getBackend() {
        return backend;
    }

    public PlayerSection getPlayer() {
        return player;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SessionSection {
        @JsonProperty("name")
        private String name = SessionConstants.GAME_SESSION;

        @JsonProperty("lan-identity")
        private String lanIdentity = SessionConstants.LAN_BACKEND_IDENTITY;

        @JsonProperty("public-slots")
        private int publicSlots = 4;

        @JsonProperty("match-tag")
        private String matchTag = "FreeForAll";

        @JsonProperty("search-results")
        private int searchResults = 10000;

        @JsonProperty("lobby-path")
        private String lobbyPath = "/Game/Maps/Lobby";

        public String getName() {
            return name;
        }

        public String getLanIdentity() {
            return lanIdentity;
        }

        public int getPublicSlots() {
            return publicSlots;
        }

        public String getMatchTag() {
            return matchTag;
        }

        public int getSearchResults() {
            return searchResults;
        }

        public String getLobbyPath() {
            return lobbyPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BackendSection {
        @JsonProperty("type")
        private BackendType type = BackendType.LOCAL;

        @JsonProperty("host-address")
        private String hostAddress = "127.0.0.1:7777";

        @JsonProperty("completion-delay-millis")
        private long completionDelayMillis;

        public BackendType getType() {
            return type;
        }

        public String getHostAddress() {
            return hostAddress;
        }

        public Duration getCompletionDelay() {
            return Duration.ofMillis(Math.max(0, completionDelayMillis));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlayerSection {
        @JsonProperty("id")
        private String id = "local-player";

        @JsonProperty("display-name")
        private String displayName = "";

        public String getId() {
            return id;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    /**
     * Session provider the host application runs against.
     */
    public enum BackendType {
        /**
         * In-process LAN provider
         */
        LOCAL,
        /**
         * No provider configured; every operation fails as unavailable
         */
        NONE
    }
}
