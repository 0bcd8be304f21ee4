package sh.harold.sessionlink.api.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Settings submitted to a backend when hosting a session.
 * <p>
 * Instances are immutable; a fresh one is built for every create attempt.
 */
public final class SessionConfig {

    private final int maxPublicSlots;
    private final String matchTag;
    private final AdvertisingMode advertisingMode;
    private final boolean joinInProgressAllowed;
    private final boolean usesPresence;
    private final boolean preferLobbies;
    private final boolean shouldAdvertise;
    private final Map<String, String> attributes;

    private SessionConfig(Builder builder) {
        this.maxPublicSlots = builder.maxPublicSlots;
        this.matchTag = builder.matchTag;
        this.advertisingMode = builder.advertisingMode;
        this.joinInProgressAllowed = builder.joinInProgressAllowed;
        this.usesPresence = builder.usesPresence;
        this.preferLobbies = builder.preferLobbies;
        this.shouldAdvertise = builder.shouldAdvertise;

        Map<String, String> advertised = new LinkedHashMap<>(builder.attributes);
        advertised.put(SessionConstants.MATCH_TYPE_ATTRIBUTE, matchTag);
        this.attributes = Collections.unmodifiableMap(advertised);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxPublicSlots() {
        return maxPublicSlots;
    }

    public String getMatchTag() {
        return matchTag;
    }

    public AdvertisingMode getAdvertisingMode() {
        return advertisingMode;
    }

    public boolean isLan() {
        return advertisingMode == AdvertisingMode.LAN;
    }

    public boolean isJoinInProgressAllowed() {
        return joinInProgressAllowed;
    }

    public boolean isUsesPresence() {
        return usesPresence;
    }

    public boolean isPreferLobbies() {
        return preferLobbies;
    }

    public boolean isShouldAdvertise() {
        return shouldAdvertise;
    }

    /**
     * Attributes advertised with the session, always including the match tag.
     *
     * @return an unmodifiable view of the advertised attributes
     */
    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionConfig that)) return false;
        return maxPublicSlots == that.maxPublicSlots
                && joinInProgressAllowed == that.joinInProgressAllowed
                && usesPresence == that.usesPresence
                && preferLobbies == that.preferLobbies
                && shouldAdvertise == that.shouldAdvertise
                && matchTag.equals(that.matchTag)
                && advertisingMode == that.advertisingMode
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxPublicSlots, matchTag, advertisingMode, joinInProgressAllowed,
                usesPresence, preferLobbies, shouldAdvertise, attributes);
    }

    @Override
    public String toString() {
        return "SessionConfig{" +
                "maxPublicSlots=" + maxPublicSlots +
                ", matchTag='" + matchTag + '\'' +
                ", advertisingMode=" + advertisingMode +
                ", joinInProgressAllowed=" + joinInProgressAllowed +
                ", usesPresence=" + usesPresence +
                ", preferLobbies=" + preferLobbies +
                '}';
    }

    /**
     * Builder for session configurations.
     */
    public static class Builder {
        private int maxPublicSlots = 4;
        private String matchTag = "";
        private AdvertisingMode advertisingMode = AdvertisingMode.HOSTED;
        private boolean joinInProgressAllowed;
        private boolean usesPresence;
        private boolean preferLobbies;
        private boolean shouldAdvertise = true;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        public Builder maxPublicSlots(int maxPublicSlots) {
            if (maxPublicSlots < 0) {
                throw new IllegalArgumentException("Public slots must not be negative: " + maxPublicSlots);
            }
            this.maxPublicSlots = maxPublicSlots;
            return this;
        }

        public Builder matchTag(String matchTag) {
            this.matchTag = Objects.requireNonNull(matchTag, "matchTag");
            return this;
        }

        public Builder advertisingMode(AdvertisingMode advertisingMode) {
            this.advertisingMode = Objects.requireNonNull(advertisingMode, "advertisingMode");
            return this;
        }

        public Builder joinInProgressAllowed(boolean joinInProgressAllowed) {
            this.joinInProgressAllowed = joinInProgressAllowed;
            return this;
        }

        public Builder usesPresence(boolean usesPresence) {
            this.usesPresence = usesPresence;
            return this;
        }

        public Builder preferLobbies(boolean preferLobbies) {
            this.preferLobbies = preferLobbies;
            return this;
        }

        public Builder shouldAdvertise(boolean shouldAdvertise) {
            this.shouldAdvertise = shouldAdvertise;
            return this;
        }

        public Builder attribute(String key, String value) {
            attributes.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(this);
        }
    }
}
