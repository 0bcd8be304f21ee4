package sh.harold.sessionlink.api.session.event;

import sh.harold.sessionlink.api.session.FailureCause;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.SessionException;

/**
 * Published once per hosting attempt. On success the session is advertised and
 * the host may travel to the lobby.
 */
public final class CreateSessionCompleteEvent extends SessionEvent {

    private CreateSessionCompleteEvent(String sessionName, boolean success, FailureCause cause, SessionException error) {
        super(OperationKind.CREATE, sessionName, success, cause, error);
    }

    public static CreateSessionCompleteEvent success(String sessionName) {
        return new CreateSessionCompleteEvent(sessionName, true, FailureCause.NONE, null);
    }

    /**
     * @param cause why the session was not created
     * @param error the underlying exception, may be null
     */
    public static CreateSessionCompleteEvent failure(String sessionName, FailureCause cause, SessionException error) {
        return new CreateSessionCompleteEvent(sessionName, false, cause, error);
    }
}
