package sh.harold.sessionlink.api.session;

/**
 * Gameplay transition mechanism invoked after hosting or joining succeeds.
 * Implemented by the host application.
 */
public interface TravelService {

    /**
     * Moves the host into the shared lobby destination.
     *
     * @param destinationUrl lobby path including travel options
     * @return true if the travel request was accepted
     */
    boolean travelToLobby(String destinationUrl);

    /**
     * Connects a joining participant to a resolved session address.
     *
     * @param address the resolved connect address
     */
    void connectTo(String address);
}
