package sh.harold.sessionlink.api.session;

/**
 * How a hosted session is advertised to other participants.
 */
public enum AdvertisingMode {
    /**
     * Broadcast on the local network segment only.
     */
    LAN,
    /**
     * Advertised through a hosted matchmaking service.
     */
    HOSTED;

    /**
     * Picks the mode implied by a backend identity.
     *
     * @param backendIdentity the identity reported by the backend
     * @param lanIdentity the identity that denotes the local/offline provider
     * @return LAN when the identities match, HOSTED otherwise
     */
    public static AdvertisingMode forIdentity(String backendIdentity, String lanIdentity) {
        return lanIdentity.equalsIgnoreCase(backendIdentity) ? LAN : HOSTED;
    }
}
