package com.qqsuccubus.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Transport-agnostic result of one raw metric query.
 * <p>
 * Columns are series labels in the order the backend returned them; a label may appear
 * more than once when several series share it. Rows are kept in insertion order and each
 * carries one cell per column; a {@code null} cell means the series had no point at that
 * timestamp.
 * </p>
 */
public final class RawMetricTable {

    private final List<String> columns;
    private final List<Row> rows;

    private RawMetricTable(List<String> columns, List<Row> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RawMetricTable empty() {
        return new RawMetricTable(new ArrayList<>(), new ArrayList<>());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public String toString() {
        return "RawMetricTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }

    /**
     * One timestamped row, cells aligned with the table's columns.
     */
    public static final class Row {
        private final Instant timestamp;
        private final Sample[] cells;

        private Row(Instant timestamp, Sample[] cells) {
            this.timestamp = timestamp;
            this.cells = cells;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        /**
         * @param column column position
         * @return the sample, or {@code null} when the cell is absent
         */
        public Sample cell(int column) {
            return cells[column];
        }

        public int width() {
            return cells.length;
        }

        @Override
        public String toString() {
            return "Row{" + timestamp + ", " + Arrays.toString(cells) + "}";
        }
    }

    public static final class Builder {
        private final List<String> columns = new ArrayList<>();
        private final List<Row> rows = new ArrayList<>();

        private Builder() {
        }

        /**
         * Appends a column.
         *
         * @return position of the new column
         */
        public int column(String label) {
            if (!rows.isEmpty()) {
                throw new IllegalStateException("Columns must be declared before rows");
            }
            columns.add(Objects.requireNonNull(label, "label"));
            return columns.size() - 1;
        }

        public Builder columns(String... labels) {
            for (String label : labels) {
                column(label);
            }
            return this;
        }

        /**
         * Appends a row. Pass {@code null} for absent cells.
         */
        public Builder row(Instant timestamp, Sample... cells) {
            Objects.requireNonNull(timestamp, "timestamp");
            if (cells.length != columns.size()) {
                throw new IllegalArgumentException(String.format(
                    "Row at %s has %d cells, table has %d columns", timestamp, cells.length, columns.size()));
            }
            rows.add(new Row(timestamp, cells.clone()));
            return this;
        }

        /**
         * Appends a row of scalar values. {@code null} entries are absent cells.
         */
        public Builder scalars(Instant timestamp, Double... values) {
            Sample[] cells = new Sample[values.length];
            for (int i = 0; i < values.length; i++) {
                cells[i] = values[i] == null ? null : Sample.scalar(values[i]);
            }
            return row(timestamp, cells);
        }

        public RawMetricTable build() {
            return new RawMetricTable(new ArrayList<>(columns), new ArrayList<>(rows));
        }
    }
}
