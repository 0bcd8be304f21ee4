package sh.harold.sessionlink.api.session;

/**
 * Parameters of a single session search.
 *
 * @param maxResults upper bound on the number of results the backend returns
 * @param lanOnly restrict the search to the local network
 * @param lobbiesOnly restrict the search to lobby sessions
 */
public record SessionSearchQuery(int maxResults, boolean lanOnly, boolean lobbiesOnly) {

    public SessionSearchQuery {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("Max results must be positive: " + maxResults);
        }
    }
}
