package com.qqsuccubus.core.normalize;

import com.qqsuccubus.core.model.NormalizedTable;
import com.qqsuccubus.core.model.RawMetricTable;
import com.qqsuccubus.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns one raw query result into a dense per-minute table.
 * <p>
 * Steps, applied in this order:
 * <ol>
 *   <li><b>Missing-value fill</b>: an absent cell counts as {@code 0.0}. This reads "no data"
 *       as "no activity", which holds for the counters, latencies and utilizations served
 *       here but is not a safe default for arbitrary metrics.</li>
 *   <li><b>Distribution collapse</b>: a distribution becomes its mean; count and extrema are
 *       dropped.</li>
 *   <li><b>Timestamp truncation</b>: seconds and sub-seconds are zeroed (UTC minute buckets).
 *       Distinct source rows may land in the same bucket.</li>
 *   <li><b>Duplicate reduction</b>: values sharing a (bucket, label) pair, whether from
 *       duplicate columns or from colliding rows, are combined with the descriptor's
 *       {@link Reducer}.</li>
 *   <li><b>Percentage scale</b>: values are multiplied by 100 for descriptors flagged
 *       {@link MetricDescriptor#isPercentageScale()}.</li>
 * </ol>
 * Output columns are sorted by label, rows ascend by bucket.
 * </p>
 * <p>
 * Stateless and free of I/O; one instance may serve any number of concurrent fetches.
 * </p>
 */
public class Normalizer {
    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    /**
     * Normalizes a raw table under the given descriptor's policy.
     *
     * @param raw        raw query result; a zero-row table yields a zero-row table
     * @param descriptor policy of the metric the table belongs to
     * @return normalized table
     */
    public NormalizedTable normalize(RawMetricTable raw, MetricDescriptor descriptor) {
        List<String> labels = raw.getColumns().stream().distinct().sorted().toList();
        if (raw.isEmpty()) {
            return new NormalizedTable(labels, List.of());
        }

        Map<String, Integer> labelPositions = new HashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            labelPositions.put(labels.get(i), i);
        }
        int[] target = new int[raw.columnCount()];
        for (int c = 0; c < target.length; c++) {
            target[c] = labelPositions.get(raw.getColumns().get(c));
        }

        Reducer reducer = descriptor.getReducer();
        TreeMap<Instant, Bucket> buckets = new TreeMap<>();
        for (RawMetricTable.Row row : raw.getRows()) {
            Bucket bucket = buckets.computeIfAbsent(truncate(row.getTimestamp()), ts -> new Bucket(labels.size()));
            for (int c = 0; c < target.length; c++) {
                double value = collapse(fill(row.cell(c)));
                bucket.accept(target[c], value, reducer);
            }
        }

        List<NormalizedTable.Row> rows = new ArrayList<>(buckets.size());
        for (Map.Entry<Instant, Bucket> entry : buckets.entrySet()) {
            double[] values = entry.getValue().values;
            if (descriptor.isPercentageScale()) {
                scale(values);
            }
            rows.add(new NormalizedTable.Row(entry.getKey(), values));
        }

        log.debug("Normalized {}: {} raw rows x {} raw columns -> {} rows x {} columns",
            descriptor.getName(), raw.rowCount(), raw.columnCount(), rows.size(), labels.size());
        return new NormalizedTable(labels, rows);
    }

    private static Sample fill(Sample cell) {
        return cell != null ? cell : Sample.scalar(0.0);
    }

    private static double collapse(Sample sample) {
        if (sample instanceof Sample.Scalar scalar) {
            return scalar.value();
        }
        return ((Sample.Distribution) sample).mean();
    }

    private static Instant truncate(Instant timestamp) {
        return timestamp.truncatedTo(ChronoUnit.MINUTES);
    }

    private static void scale(double[] values) {
        for (int i = 0; i < values.length; i++) {
            values[i] = values[i] * 100.0;
        }
    }

    /**
     * Accumulator for one minute bucket.
     */
    private static final class Bucket {
        private final double[] values;
        private final boolean[] seen;

        private Bucket(int width) {
            this.values = new double[width];
            this.seen = new boolean[width];
        }

        private void accept(int position, double value, Reducer reducer) {
            if (seen[position]) {
                values[position] = reducer.combine(values[position], value);
            } else {
                values[position] = value;
                seen[position] = true;
            }
        }
    }
}
