package com.marketplace.realtime.connection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A single row change emitted by the event source for a topic.
 *
 * <p>{@link #getRecord()} holds the row after the change and is empty for deletes;
 * {@link #getOldRecord()} holds the row before the change and is empty for inserts.
 */
public final class ChangeEvent implements RealtimeEvent {

    private final String topic;
    private final ChangeType changeType;
    private final String schema;
    private final String table;
    private final Map<String, Object> record;
    private final Map<String, Object> oldRecord;
    private final long commitTimestamp;

    private ChangeEvent(Builder builder) {
        this.topic = Objects.requireNonNull(builder.topic, "topic");
        this.changeType = Objects.requireNonNull(builder.changeType, "changeType");
        this.schema = builder.schema;
        this.table = Objects.requireNonNull(builder.table, "table");
        this.record = Collections.unmodifiableMap(new LinkedHashMap<>(builder.record));
        this.oldRecord = Collections.unmodifiableMap(new LinkedHashMap<>(builder.oldRecord));
        this.commitTimestamp = builder.commitTimestamp;
    }

    public static Builder builder(String topic, ChangeType changeType, String table) {
        return new Builder(topic, changeType, table);
    }

    @Override
    public String getTopic() {
        return topic;
    }

    @Override
    public String getEventKind() {
        return changeType.name();
    }

    @Override
    public boolean isBatch() {
        return false;
    }

    @Override
    public List<ChangeEvent> getEvents() {
        return Collections.singletonList(this);
    }

    @Override
    public int size() {
        return 1;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public String getSchema() {
        return schema;
    }

    public String getTable() {
        return table;
    }

    public Map<String, Object> getRecord() {
        return record;
    }

    public Map<String, Object> getOldRecord() {
        return oldRecord;
    }

    /**
     * Looks {@code column} up in the new row, falling back to the old row for deletes.
     */
    @Nullable
    public Object getValue(String column) {
        if (record.containsKey(column)) {
            return record.get(column);
        }
        return oldRecord.get(column);
    }

    public long getCommitTimestamp() {
        return commitTimestamp;
    }

    @Override
    public String toString() {
        return "ChangeEvent{topic=" + topic + ", " + changeType + " " + schema + "." + table
                + ", record=" + record + "}";
    }

    public static final class Builder {

        private final String topic;
        private final ChangeType changeType;
        private final String table;
        private String schema = ChangeFilter.DEFAULT_SCHEMA;
        private final Map<String, Object> record = new LinkedHashMap<>();
        private final Map<String, Object> oldRecord = new LinkedHashMap<>();
        private long commitTimestamp;

        private Builder(String topic, ChangeType changeType, String table) {
            this.topic = topic;
            this.changeType = changeType;
            this.table = table;
        }

        public Builder schema(String schema) {
            this.schema = Objects.requireNonNull(schema, "schema");
            return this;
        }

        public Builder value(String column, Object value) {
            record.put(Objects.requireNonNull(column, "column"), value);
            return this;
        }

        public Builder record(Map<String, ?> values) {
            record.putAll(values);
            return this;
        }

        public Builder oldValue(String column, Object value) {
            oldRecord.put(Objects.requireNonNull(column, "column"), value);
            return this;
        }

        public Builder commitTimestamp(long commitTimestamp) {
            this.commitTimestamp = commitTimestamp;
            return this;
        }

        public ChangeEvent build() {
            return new ChangeEvent(this);
        }
    }
}
