package sh.harold.sessionlink.api.session;

/**
 * Well-known names shared by the orchestrator and backends.
 */
public final class SessionConstants {

    private SessionConstants() {
        // Prevent instantiation
    }

    /** Name of the single session a participant hosts or joins. */
    public static final String GAME_SESSION = "GameSession";

    /** Identity reported by the local/offline (LAN) session provider. */
    public static final String LAN_BACKEND_IDENTITY = "NULL";

    /** Advertised attribute holding the match tag. */
    public static final String MATCH_TYPE_ATTRIBUTE = "MatchType";

    /** Travel option appended to the lobby path so the host listens for connections. */
    public static final String LISTEN_OPTION = "?listen";
}
