package com.marketplace.realtime.subscription;

import com.marketplace.realtime.connection.ConnectionStatusListener;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Per-registration options of {@link SubscriptionOptimizer#subscribe}.
 */
public final class SubscriptionOptions {

    private static final SubscriptionOptions DEFAULTS = builder().build();

    private final PriorityClassifier priorityClassifier;
    private final ConnectionStatusListener statusListener;
    private final Boolean eventBatching;

    private SubscriptionOptions(Builder builder) {
        this.priorityClassifier = builder.priorityClassifier;
        this.statusListener = builder.statusListener;
        this.eventBatching = builder.eventBatching;
    }

    public static SubscriptionOptions defaults() {
        return DEFAULTS;
    }

    public static SubscriptionOptions withPriority(PriorityClassifier priorityClassifier) {
        return builder().priority(priorityClassifier).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the classifier applied when prioritization is enabled, or {@code null} to deliver
     *         every event directly
     */
    @Nullable
    public PriorityClassifier getPriorityClassifier() {
        return priorityClassifier;
    }

    @Nullable
    public ConnectionStatusListener getStatusListener() {
        return statusListener;
    }

    /**
     * @return whether the connection batches events for this registration, or {@code null} for
     *         the connection manager's default
     */
    @Nullable
    public Boolean getEventBatching() {
        return eventBatching;
    }

    public static final class Builder {

        private PriorityClassifier priorityClassifier;
        private ConnectionStatusListener statusListener;
        private Boolean eventBatching;

        private Builder() {
        }

        public Builder priority(PriorityClassifier priorityClassifier) {
            this.priorityClassifier = Objects.requireNonNull(priorityClassifier, "priorityClassifier");
            return this;
        }

        public Builder statusListener(ConnectionStatusListener statusListener) {
            this.statusListener = Objects.requireNonNull(statusListener, "statusListener");
            return this;
        }

        /**
         * Only honoured by the registration that opens the connection subscription; members
         * joining a group share the group's.
         */
        public Builder eventBatching(boolean eventBatching) {
            this.eventBatching = eventBatching;
            return this;
        }

        public SubscriptionOptions build() {
            return new SubscriptionOptions(this);
        }
    }
}
