package com.air.normaliser.model;

import com.air.normaliser.common.exception.InvalidInputException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Column-oriented, immutable table of prepared observations.
 * <p>
 * Rows are indexed by the {@value #DATE_COLUMN} timestamp axis. Every other column is numeric and
 * uses {@link Double#NaN} as the missing-value marker. Arrays handed in are copied and arrays handed
 * out are copies, so one instance can be shared by any number of threads.
 */
public final class PreparedDataset {

    public static final String DATE_COLUMN = "date";
    public static final String TREND_COLUMN = "date_unix";
    public static final String VALUE_COLUMN = "value";

    private final List<Instant> dates;
    private final Map<String, double[]> columns;

    private PreparedDataset(List<Instant> dates, Map<String, double[]> columns) {
        this.dates = dates;
        this.columns = columns;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getRowCount() {
        return dates.size();
    }

    public List<Instant> getDates() {
        return dates;
    }

    public Instant getDate(int row) {
        return dates.get(row);
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public double value(String column, int row) {
        return requireColumn(column)[row];
    }

    public double[] column(String name) {
        return requireColumn(name).clone();
    }

    /**
     * Returns a dataset with the given columns swapped in and everything else, dates included, shared
     * with this one.
     */
    public PreparedDataset withColumns(Map<String, double[]> replacements) {
        Map<String, double[]> merged = new LinkedHashMap<>(columns);
        for (Map.Entry<String, double[]> e : replacements.entrySet()) {
            requireColumn(e.getKey());
            merged.put(e.getKey(), checkedCopy(e.getKey(), e.getValue(), dates.size()));
        }
        return new PreparedDataset(dates, Collections.unmodifiableMap(merged));
    }

    private double[] requireColumn(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new InvalidInputException("Dataset has no column '" + name + "'");
        }
        return values;
    }

    private static double[] checkedCopy(String name, double[] values, int rowCount) {
        Objects.requireNonNull(values, "values for column " + name);
        if (values.length != rowCount) {
            throw new InvalidInputException(String.format(
                    "Column '%s' has %d values but the dataset has %d rows", name, values.length, rowCount));
        }
        return values.clone();
    }

    @Override
    public String toString() {
        return "PreparedDataset{rows=" + dates.size() + ", columns=" + columns.keySet() + '}';
    }

    public static final class Builder {
        private List<Instant> dates = Collections.emptyList();
        private final Map<String, double[]> columns = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Sets the timestamp axis. Null entries are kept so validation can report them.
         */
        public Builder dates(List<Instant> dates) {
            this.dates = new ArrayList<>(Objects.requireNonNull(dates, "dates"));
            return this;
        }

        public Builder column(String name, double... values) {
            Objects.requireNonNull(name, "name");
            if (DATE_COLUMN.equals(name)) {
                throw new InvalidInputException("'" + DATE_COLUMN + "' is the timestamp axis, not a numeric column");
            }
            columns.put(name, Objects.requireNonNull(values, "values for column " + name));
            return this;
        }

        public PreparedDataset build() {
            Map<String, double[]> copies = new LinkedHashMap<>();
            for (Map.Entry<String, double[]> e : columns.entrySet()) {
                copies.put(e.getKey(), checkedCopy(e.getKey(), e.getValue(), dates.size()));
            }
            return new PreparedDataset(Collections.unmodifiableList(dates), Collections.unmodifiableMap(copies));
        }
    }
}
