package com.marketplace.realtime.connection;

import java.util.Locale;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Structural filter understood by the event source: change type, schema, table and an
 * optional single-column predicate written as {@code column=eq.value} or
 * {@code column=neq.value}.
 *
 * <p>Two filters are equal when every part is equal, which makes the filter usable as part of
 * a map key. {@link #toString()} yields a canonical form.
 */
public final class ChangeFilter {

    public static final String DEFAULT_SCHEMA = "public";
    public static final String ANY_EVENT = "*";

    private static final ChangeFilter ALL = builder().build();

    private final ChangeType changeType;
    private final String schema;
    private final String table;
    private final String predicate;
    private final String predicateColumn;
    private final boolean predicateNegated;
    private final String predicateValue;

    private ChangeFilter(Builder builder) {
        this.changeType = builder.changeType;
        this.schema = builder.schema;
        this.table = builder.table;
        this.predicate = builder.predicate;
        if (predicate == null) {
            this.predicateColumn = null;
            this.predicateNegated = false;
            this.predicateValue = null;
        } else {
            int eq = predicate.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Filter predicate must look like column=eq.value: " + predicate);
            }
            String operation = predicate.substring(eq + 1);
            this.predicateColumn = predicate.substring(0, eq).trim();
            if (operation.startsWith("eq.")) {
                this.predicateNegated = false;
                this.predicateValue = operation.substring(3);
            } else if (operation.startsWith("neq.")) {
                this.predicateNegated = true;
                this.predicateValue = operation.substring(4);
            } else {
                throw new IllegalArgumentException("Unsupported filter operator in: " + predicate);
            }
        }
    }

    /**
     * @return a filter matching every change of every table
     */
    public static ChangeFilter all() {
        return ALL;
    }

    public static ChangeFilter table(String table) {
        return builder().table(table).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the change type to match, or {@code null} for any
     */
    @Nullable
    public ChangeType getChangeType() {
        return changeType;
    }

    public String getSchema() {
        return schema;
    }

    @Nullable
    public String getTable() {
        return table;
    }

    @Nullable
    public String getPredicate() {
        return predicate;
    }

    public boolean matches(ChangeEvent event) {
        if (changeType != null && changeType != event.getChangeType()) {
            return false;
        }
        if (!schema.equals(event.getSchema())) {
            return false;
        }
        if (table != null && !table.equals(event.getTable())) {
            return false;
        }
        if (predicateColumn == null) {
            return true;
        }
        Object value = event.getValue(predicateColumn);
        boolean equal = value != null && predicateValue.equals(String.valueOf(value));
        return predicateNegated != equal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChangeFilter)) {
            return false;
        }
        ChangeFilter that = (ChangeFilter) o;
        return changeType == that.changeType
                && schema.equals(that.schema)
                && Objects.equals(table, that.table)
                && Objects.equals(predicate, that.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(changeType, schema, table, predicate);
    }

    @Override
    public String toString() {
        return "event=" + (changeType == null ? ANY_EVENT : changeType.name())
                + ",schema=" + schema
                + ",table=" + (table == null ? ANY_EVENT : table)
                + (predicate == null ? "" : ",filter=" + predicate);
    }

    public static final class Builder {

        private ChangeType changeType;
        private String schema = DEFAULT_SCHEMA;
        private String table;
        private String predicate;

        private Builder() {
        }

        /**
         * @param event {@code "*"} for any change, otherwise a {@link ChangeType} name
         */
        public Builder event(String event) {
            Objects.requireNonNull(event, "event");
            String normalized = event.trim().toUpperCase(Locale.ROOT);
            if (ANY_EVENT.equals(normalized)) {
                this.changeType = null;
            } else {
                try {
                    this.changeType = ChangeType.valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown change event: " + event, e);
                }
            }
            return this;
        }

        public Builder event(ChangeType changeType) {
            this.changeType = Objects.requireNonNull(changeType, "changeType");
            return this;
        }

        public Builder schema(String schema) {
            this.schema = Objects.requireNonNull(schema, "schema");
            return this;
        }

        public Builder table(String table) {
            this.table = Objects.requireNonNull(table, "table");
            return this;
        }

        /**
         * @param predicate {@code column=eq.value} or {@code column=neq.value}
         */
        public Builder filter(String predicate) {
            this.predicate = Objects.requireNonNull(predicate, "predicate").trim();
            return this;
        }

        public ChangeFilter build() {
            return new ChangeFilter(this);
        }
    }
}
