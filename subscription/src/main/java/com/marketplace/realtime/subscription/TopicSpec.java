package com.marketplace.realtime.subscription;

import com.marketplace.realtime.connection.ChangeFilter;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * What a consumer subscribes to: a channel name and the change filter applied on it.
 *
 * <p>Two specs are equal when both parts are equal, which is what deduplication and grouping
 * key on.
 */
public final class TopicSpec {

    private final String channelName;
    private final ChangeFilter filter;

    private TopicSpec(String channelName, ChangeFilter filter) {
        this.channelName = channelName;
        this.filter = filter;
    }

    public static TopicSpec of(@Nonnull String channelName, @Nonnull ChangeFilter filter) {
        Objects.requireNonNull(channelName, "channelName");
        if (channelName.trim().isEmpty()) {
            throw new IllegalArgumentException("channelName must not be blank");
        }
        return new TopicSpec(channelName, Objects.requireNonNull(filter, "filter"));
    }

    /**
     * @return a spec receiving every change published on {@code channelName}
     */
    public static TopicSpec channel(@Nonnull String channelName) {
        return of(channelName, ChangeFilter.all());
    }

    public String getChannelName() {
        return channelName;
    }

    public ChangeFilter getFilter() {
        return filter;
    }

    /**
     * A short, stable base-36 digest of this spec, used to build readable subscription ids.
     * Distinct specs may share a fingerprint.
     */
    public String fingerprint() {
        int hash = 0;
        String canonical = toString();
        for (int i = 0; i < canonical.length(); i++) {
            hash = 31 * hash + canonical.charAt(i);
        }
        return Long.toString(Math.abs((long) hash), 36);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TopicSpec)) {
            return false;
        }
        TopicSpec that = (TopicSpec) o;
        return channelName.equals(that.channelName) && filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channelName, filter);
    }

    @Override
    public String toString() {
        return channelName + "[" + filter + "]";
    }
}
