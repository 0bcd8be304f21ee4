package sh.harold.sessionlink.api.session.event;

import sh.harold.sessionlink.api.session.FailureCause;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.SessionException;
import sh.harold.sessionlink.api.session.SessionSearchResult;

import java.util.List;
import java.util.Optional;

/**
 * Published when a search completes. A successful search always carries at
 * least one result; an empty search is reported as a failure.
 */
public final class FindSessionsCompleteEvent extends SessionEvent {

    private final List<SessionSearchResult> results;

    private FindSessionsCompleteEvent(List<SessionSearchResult> results,
                                      boolean success,
                                      FailureCause cause,
                                      SessionException error) {
        super(OperationKind.FIND, null, success, cause, error);
        this.results = results == null ? List.of() : List.copyOf(results);
    }

    public static FindSessionsCompleteEvent success(List<SessionSearchResult> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("A successful search must carry results");
        }
        return new FindSessionsCompleteEvent(results, true, FailureCause.NONE, null);
    }

    public static FindSessionsCompleteEvent failure(List<SessionSearchResult> results,
                                                    FailureCause cause,
                                                    SessionException error) {
        return new FindSessionsCompleteEvent(results, false, cause, error);
    }

    public List<SessionSearchResult> getResults() {
        return results;
    }

    /**
     * Picks the first result advertising the given match tag.
     *
     * @param matchTag the tag to look for
     * @return the first matching result, if any
     */
    public Optional<SessionSearchResult> firstMatching(String matchTag) {
        return results.stream().filter(result -> result.matchesTag(matchTag)).findFirst();
    }
}
