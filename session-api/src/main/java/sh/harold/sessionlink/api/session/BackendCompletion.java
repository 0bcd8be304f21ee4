package sh.harold.sessionlink.api.session;

import java.util.List;
import java.util.Objects;

/**
 * Out-of-band completion of a backend call. Only the fields relevant to the
 * operation kind are meaningful: find completions carry results, join
 * completions carry a result code, the rest carry a success flag.
 */
public final class BackendCompletion {

    private final OperationKind kind;
    private final String sessionName;
    private final boolean success;
    private final List<SessionSearchResult> results;
    private final JoinResult joinResult;

    private BackendCompletion(OperationKind kind,
                              String sessionName,
                              boolean success,
                              List<SessionSearchResult> results,
                              JoinResult joinResult) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sessionName = sessionName;
        this.success = success;
        this.results = results == null ? List.of() : List.copyOf(results);
        this.joinResult = joinResult;
    }

    public static BackendCompletion created(String sessionName, boolean success) {
        return new BackendCompletion(OperationKind.CREATE, sessionName, success, null, null);
    }

    public static BackendCompletion found(List<SessionSearchResult> results, boolean success) {
        return new BackendCompletion(OperationKind.FIND, null, success, results, null);
    }

    public static BackendCompletion joined(String sessionName, JoinResult joinResult) {
        Objects.requireNonNull(joinResult, "joinResult");
        return new BackendCompletion(OperationKind.JOIN, sessionName, joinResult.isSuccess(), null, joinResult);
    }

    public static BackendCompletion destroyed(String sessionName, boolean success) {
        return new BackendCompletion(OperationKind.DESTROY, sessionName, success, null, null);
    }

    public static BackendCompletion started(String sessionName, boolean success) {
        return new BackendCompletion(OperationKind.START, sessionName, success, null, null);
    }

    public OperationKind getKind() {
        return kind;
    }

    /**
     * @return the session the completion refers to, or null for searches
     */
    public String getSessionName() {
        return sessionName;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<SessionSearchResult> getResults() {
        return results;
    }

    /**
     * @return the join result code, or null for non-join completions
     */
    public JoinResult getJoinResult() {
        return joinResult;
    }

    @Override
    public String toString() {
        return "BackendCompletion{kind=" + kind + ", session=" + sessionName + ", success=" + success
                + (kind == OperationKind.FIND ? ", results=" + results.size() : "")
                + (joinResult != null ? ", joinResult=" + joinResult : "") + '}';
    }
}
