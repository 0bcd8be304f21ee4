package sh.harold.sessionlink.api.session.event;

import sh.harold.sessionlink.api.session.FailureCause;
import sh.harold.sessionlink.api.session.JoinResult;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.SessionException;

import java.util.Objects;

/**
 * Published when a join attempt finishes. Carries the backend's result code
 * unchanged; synchronous failures surface as {@link JoinResult#UNKNOWN_ERROR}.
 */
public final class JoinSessionCompleteEvent extends SessionEvent {

    private final JoinResult result;

    private JoinSessionCompleteEvent(String sessionName, JoinResult result, FailureCause cause, SessionException error) {
        super(OperationKind.JOIN, sessionName, result.isSuccess(), cause, error);
        this.result = result;
    }

    /**
     * Wraps a result code reported by the backend on completion.
     */
    public static JoinSessionCompleteEvent completed(String sessionName, JoinResult result) {
        Objects.requireNonNull(result, "result");
        return new JoinSessionCompleteEvent(sessionName, result,
                result.isSuccess() ? FailureCause.NONE : FailureCause.ASYNC_FAILURE, null);
    }

    /**
     * Failure that never reached the backend's completion path.
     */
    public static JoinSessionCompleteEvent failure(String sessionName, FailureCause cause, SessionException error) {
        return new JoinSessionCompleteEvent(sessionName, JoinResult.UNKNOWN_ERROR, cause, error);
    }

    public JoinResult getResult() {
        return result;
    }

    @Override
    public String toString() {
        return "JoinSessionCompleteEvent{session=" + getSessionName() + ", result=" + result + '}';
    }
}
