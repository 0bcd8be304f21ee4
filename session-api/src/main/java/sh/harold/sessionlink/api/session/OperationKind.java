package sh.harold.sessionlink.api.session;

/**
 * The five session operations a backend completes asynchronously.
 * Each kind owns exactly one completion channel and one subscription slot.
 */
public enum OperationKind {
    CREATE("create"),
    FIND("find"),
    JOIN("join"),
    DESTROY("destroy"),
    START("start");

    private final String id;

    OperationKind(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
