package sh.harold.sessionlink.menu;

import sh.harold.sessionlink.api.session.SessionConstants;
import sh.harold.sessionlink.config.SessionLinkSettings;

import java.util.Objects;

/**
 * What the menu hosts and searches for.
 *
 * @param publicSlots public slots advertised when hosting
 * @param matchTag match tag hosted and joined
 * @param searchResults max results requested when searching
 * @param lobbyPath destination the host travels to
 */
public record MenuSettings(int publicSlots, String matchTag, int searchResults, String lobbyPath) {

    public MenuSettings {
        Objects.requireNonNull(matchTag, "matchTag");
        Objects.requireNonNull(lobbyPath, "lobbyPath");
        if (publicSlots < 0) {
            throw new IllegalArgumentException("Public slots must not be negative");
        }
        if (searchResults <= 0) {
            throw new IllegalArgumentException("Search results must be positive");
        }
    }

    public static MenuSettings from(SessionLinkSettings settings) {
        SessionLinkSettings.SessionSection session = settings.getSession();
        return new MenuSettings(session.getPublicSlots(), session.getMatchTag(),
                session.getSearchResults(), session.getLobbyPath());
    }

    public String lobbyTravelUrl() {
        return lobbyPath + SessionConstants.LISTEN_OPTION;
    }
}
