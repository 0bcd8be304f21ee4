package sh.harold.sessionlink.api.session.event;

import sh.harold.sessionlink.api.session.FailureCause;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.SessionException;

/**
 * Teardown outcome. Also published, as a success, when there was nothing to
 * tear down.
 */
public final class DestroySessionCompleteEvent extends SessionEvent {

    private DestroySessionCompleteEvent(String sessionName, boolean success, FailureCause cause, SessionException error) {
        super(OperationKind.DESTROY, sessionName, success, cause, error);
    }

    public static DestroySessionCompleteEvent success(String sessionName) {
        return new DestroySessionCompleteEvent(sessionName, true, FailureCause.NONE, null);
    }

    public static DestroySessionCompleteEvent failure(String sessionName, FailureCause cause, SessionException error) {
        return new DestroySessionCompleteEvent(sessionName, false, cause, error);
    }
}
