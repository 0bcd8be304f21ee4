package sh.harold.sessionlink.api.session.event;

import sh.harold.sessionlink.api.session.FailureCause;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.SessionException;

public final class StartSessionCompleteEvent extends SessionEvent {

    private StartSessionCompleteEvent(String sessionName, boolean success, FailureCause cause, SessionException error) {
        super(OperationKind.START, sessionName, success, cause, error);
    }

    public static StartSessionCompleteEvent success(String sessionName) {
        return new StartSessionCompleteEvent(sessionName, true, FailureCause.NONE, null);
    }

    public static StartSessionCompleteEvent failure(String sessionName, FailureCause cause, SessionException error) {
        return new StartSessionCompleteEvent(sessionName, false, cause, error);
    }
}
