package com.qqsuccubus.core.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Dense per-minute metric table ready for JSON transport and charting.
 * <p>
 * Column labels are unique; rows are unique per minute bucket and ascending;
 * every cell holds a value.
 * </p>
 */
@EqualsAndHashCode
@ToString
public final class NormalizedTable {

    private static final NormalizedTable EMPTY = new NormalizedTable(List.of(), List.of());

    private final List<String> columns;
    private final List<Row> rows;

    public NormalizedTable(List<String> columns, List<Row> rows) {
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            if (!seen.add(column)) {
                throw new IllegalArgumentException("Duplicate column label: " + column);
            }
        }
        Instant previous = null;
        for (Row row : rows) {
            if (row.values.length != columns.size()) {
                throw new IllegalArgumentException(String.format(
                    "Row at %s has %d values, table has %d columns",
                    row.timestamp, row.values.length, columns.size()));
            }
            if (previous != null && !row.timestamp.isAfter(previous)) {
                throw new IllegalArgumentException("Rows must be strictly ascending by timestamp: " + row.timestamp);
            }
            previous = row.timestamp;
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static NormalizedTable empty() {
        return EMPTY;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Looks up one cell.
     *
     * @param timestamp minute bucket
     * @param label     column label
     * @return the value, or empty if the bucket or label is not in the table
     */
    public OptionalDouble valueAt(Instant timestamp, String label) {
        int column = columns.indexOf(label);
        if (column < 0) {
            return OptionalDouble.empty();
        }
        for (Row row : rows) {
            if (row.timestamp.equals(timestamp)) {
                return OptionalDouble.of(row.values[column]);
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Converts to the "split" wire shape: columns, epoch-millisecond index, row-major data.
     */
    public TableFrame toFrame() {
        List<Long> index = new ArrayList<>(rows.size());
        List<List<Double>> data = new ArrayList<>(rows.size());
        for (Row row : rows) {
            index.add(row.timestamp.toEpochMilli());
            List<Double> values = new ArrayList<>(row.values.length);
            for (double value : row.values) {
                values.add(value);
            }
            data.add(values);
        }
        return new TableFrame(new ArrayList<>(columns), index, data);
    }

    /**
     * Rebuilds a table from its wire shape.
     *
     * @throws IllegalArgumentException if the frame is ragged or violates table invariants
     */
    public static NormalizedTable fromFrame(TableFrame frame) {
        List<String> columns = frame.getColumns() != null ? frame.getColumns() : List.of();
        List<Long> index = frame.getIndex() != null ? frame.getIndex() : List.of();
        List<List<Double>> data = frame.getData() != null ? frame.getData() : List.of();
        if (index.size() != data.size()) {
            throw new IllegalArgumentException(String.format(
                "Frame index has %d entries but data has %d rows", index.size(), data.size()));
        }
        List<Row> rows = new ArrayList<>(index.size());
        for (int i = 0; i < index.size(); i++) {
            List<Double> values = data.get(i);
            if (values == null || index.get(i) == null) {
                throw new IllegalArgumentException("Frame row " + i + " has no timestamp or no values");
            }
            double[] row = new double[values.size()];
            for (int c = 0; c < row.length; c++) {
                Double value = values.get(c);
                row[c] = value != null ? value : 0.0;
            }
            rows.add(new Row(Instant.ofEpochMilli(index.get(i)), row));
        }
        return new NormalizedTable(columns, rows);
    }

    /**
     * One minute bucket.
     */
    @EqualsAndHashCode
    @ToString
    public static final class Row {
        private final Instant timestamp;
        private final double[] values;

        public Row(Instant timestamp, double[] values) {
            this.timestamp = timestamp;
            this.values = values.clone();
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public double value(int column) {
            return values[column];
        }

        public double[] getValues() {
            return values.clone();
        }
    }
}
