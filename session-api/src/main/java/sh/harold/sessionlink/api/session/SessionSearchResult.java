package sh.harold.sessionlink.api.session;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One session found by a search. The handle is opaque to everything but the
 * backend that produced it.
 *
 * @param handle backend-specific session reference
 * @param ownerName display name of the hosting participant
 * @param pingMillis measured round trip to the host, or -1 when unknown
 * @param openPublicSlots public slots still free at search time
 * @param attributes advertised session attributes
 */
public record SessionSearchResult(String handle,
                                  String ownerName,
                                  int pingMillis,
                                  int openPublicSlots,
                                  Map<String, String> attributes) {

    public SessionSearchResult {
        Objects.requireNonNull(handle, "handle");
        ownerName = ownerName == null ? "" : ownerName;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public Optional<String> getAttribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public Optional<String> getMatchTag() {
        return getAttribute(SessionConstants.MATCH_TYPE_ATTRIBUTE);
    }

    public boolean matchesTag(String matchTag) {
        return getMatchTag().map(tag -> tag.equals(matchTag)).orElse(false);
    }
}
