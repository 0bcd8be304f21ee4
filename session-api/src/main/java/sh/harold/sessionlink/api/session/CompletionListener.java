package sh.harold.sessionlink.api.session;

/**
 * Receives out-of-band completions from a {@link SessionBackend}.
 */
@FunctionalInterface
public interface CompletionListener {

    /**
     * Handles a completion. May be invoked on any thread.
     *
     * @param completion the completion delivered by the backend
     */
    void onComplete(BackendCompletion completion);
}
