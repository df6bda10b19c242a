package com.marketplace.realtime.subscription;

import com.marketplace.realtime.connection.ChangeEvent;
import com.marketplace.realtime.connection.RealtimeEvent;
import com.marketplace.realtime.queue.MessagePriority;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A rule table classifier. Rules are evaluated in registration order and the first matching
 * rule decides; when none matches the default priority applies.
 *
 * <pre>{@code
 * PriorityClassifier rules = PriorityRules.builder()
 *         .eventKind("DELETE", MessagePriority.HIGH)
 *         .field("priority", "urgent", MessagePriority.HIGH)
 *         .defaultPriority(MessagePriority.LOW)
 *         .build();
 * }</pre>
 */
public final class PriorityRules implements PriorityClassifier {

    private final List<Rule> rules;
    private final MessagePriority defaultPriority;

    private PriorityRules(Builder builder) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(builder.rules));
        this.defaultPriority = builder.defaultPriority;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public MessagePriority classify(RealtimeEvent event) {
        for (Rule rule : rules) {
            if (matchesSafely(rule, event)) {
                return rule.priority;
            }
        }
        return defaultPriority;
    }

    public int size() {
        return rules.size();
    }

    private static boolean matchesSafely(Rule rule, RealtimeEvent event) {
        try {
            return rule.condition.test(event);
        } catch (RuntimeException e) {
            // a rule that cannot evaluate an event does not match it
            return false;
        }
    }

    private static final class Rule {
        private final Predicate<RealtimeEvent> condition;
        private final MessagePriority priority;

        private Rule(Predicate<RealtimeEvent> condition, MessagePriority priority) {
            this.condition = condition;
            this.priority = priority;
        }
    }

    public static final class Builder {

        private final List<Rule> rules = new ArrayList<>();
        private MessagePriority defaultPriority = MessagePriority.NORMAL;

        private Builder() {
        }

        public Builder when(Predicate<RealtimeEvent> condition, MessagePriority priority) {
            rules.add(new Rule(Objects.requireNonNull(condition, "condition"),
                    Objects.requireNonNull(priority, "priority")));
            return this;
        }

        /**
         * Matches events whose kind (for changes, the change type name) equals {@code eventKind}.
         */
        public Builder eventKind(String eventKind, MessagePriority priority) {
            Objects.requireNonNull(eventKind, "eventKind");
            return when(event -> eventKind.equalsIgnoreCase(event.getEventKind()), priority);
        }

        /**
         * Matches events in which some change carries {@code value} in {@code column}. Values
         * are compared by their string form.
         */
        public Builder field(String column, Object value, MessagePriority priority) {
            Objects.requireNonNull(column, "column");
            String expected = String.valueOf(Objects.requireNonNull(value, "value"));
            return when(event -> {
                for (ChangeEvent change : event.getEvents()) {
                    Object actual = change.getValue(column);
                    if (actual != null && expected.equals(String.valueOf(actual))) {
                        return true;
                    }
                }
                return false;
            }, priority);
        }

        public Builder defaultPriority(MessagePriority defaultPriority) {
            this.defaultPriority = Objects.requireNonNull(defaultPriority, "defaultPriority");
            return this;
        }

        public PriorityRules build() {
            return new PriorityRules(this);
        }
    }
}
