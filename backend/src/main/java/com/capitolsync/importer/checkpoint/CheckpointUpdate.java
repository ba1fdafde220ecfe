package com.capitolsync.importer.checkpoint;

import com.capitolsync.importer.phase.ImportPhase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Partial checkpoint update. Only fields that were set are merged; a field set to {@code null} is cleared,
 * a field never set is left unchanged.
 */
public final class CheckpointUpdate {

    enum Field {
        PHASE, OFFSET, RECORDS_PROCESSED, TOTAL_EXPECTED, CONGRESS, BILL_TYPE, SESSION, LAST_ERROR
    }

    private final Map<Field, Object> values;

    private CheckpointUpdate(Map<Field, Object> values) {
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fresh entry into {@code phase}: cursor, counters and context fields reset together, last error cleared.
     */
    public static CheckpointUpdate enterPhase(ImportPhase phase) {
        return builder()
                .phase(phase)
                .offset(0)
                .recordsProcessed(0)
                .totalExpected(0)
                .congress(null)
                .billType(null)
                .session(null)
                .lastError(null)
                .build();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    boolean has(Field field) {
        return values.containsKey(field);
    }

    void applyTo(CheckpointState state) {
        values.forEach((field, value) -> {
            switch (field) {
                case PHASE -> state.setPhase((ImportPhase) value);
                case OFFSET -> state.setOffset((Long) value);
                case RECORDS_PROCESSED -> state.setRecordsProcessed((Long) value);
                case TOTAL_EXPECTED -> state.setTotalExpected((Long) value);
                case CONGRESS -> state.setCongress((Integer) value);
                case BILL_TYPE -> state.setBillType((String) value);
                case SESSION -> state.setSession((Integer) value);
                case LAST_ERROR -> state.setLastError((String) value);
            }
        });
    }

    @Override
    public String toString() {
        return "CheckpointUpdate" + values;
    }

    public static final class Builder {

        private final Map<Field, Object> values = new EnumMap<>(Field.class);

        private Builder() {
        }

        public Builder phase(ImportPhase phase) {
            if (phase == null) {
                throw new IllegalArgumentException("phase cannot be cleared");
            }
            values.put(Field.PHASE, phase);
            return this;
        }

        public Builder offset(long offset) {
            values.put(Field.OFFSET, nonNegative(offset, "offset"));
            return this;
        }

        public Builder recordsProcessed(long recordsProcessed) {
            values.put(Field.RECORDS_PROCESSED, nonNegative(recordsProcessed, "recordsProcessed"));
            return this;
        }

        public Builder totalExpected(long totalExpected) {
            values.put(Field.TOTAL_EXPECTED, nonNegative(totalExpected, "totalExpected"));
            return this;
        }

        public Builder congress(Integer congress) {
            values.put(Field.CONGRESS, congress);
            return this;
        }

        public Builder billType(String billType) {
            values.put(Field.BILL_TYPE, billType);
            return this;
        }

        public Builder session(Integer session) {
            values.put(Field.SESSION, session);
            return this;
        }

        public Builder lastError(String lastError) {
            values.put(Field.LAST_ERROR, lastError);
            return this;
        }

        public CheckpointUpdate build() {
            return new CheckpointUpdate(values);
        }

        private static Long nonNegative(long value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be non-negative: " + value);
            }
            return value;
        }
    }
}
