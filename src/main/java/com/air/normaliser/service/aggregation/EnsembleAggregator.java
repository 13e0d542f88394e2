package com.air.normaliser.service.aggregation;

import com.air.normaliser.model.dto.NormalisedPoint;
import com.air.normaliser.model.dto.PredictionRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces a prediction ensemble to one mean per date.
 * <p>
 * Output is sorted by date and does not depend on the order of the input records.
 */
@Component
public class EnsembleAggregator {

    public List<NormalisedPoint> aggregate(List<PredictionRecord> ensemble, boolean standardErrors) {
        Map<Instant, List<PredictionRecord>> byDate = new TreeMap<>();
        for (PredictionRecord record : ensemble) {
            byDate.computeIfAbsent(record.getDate(), d -> new ArrayList<>()).add(record);
        }

        List<NormalisedPoint> series = new ArrayList<>(byDate.size());
        for (Map.Entry<Instant, List<PredictionRecord>> e : byDate.entrySet()) {
            List<PredictionRecord> group = e.getValue();
            double[] values = new double[group.size()];
            double[] errors = new double[group.size()];
            for (int i = 0; i < group.size(); i++) {
                PredictionRecord r = group.get(i);
                values[i] = r.getValue();
                errors[i] = r.getStandardError() == null ? Double.NaN : r.getStandardError();
            }
            Double se = standardErrors ? meanIgnoringMissing(errors) : null;
            series.add(new NormalisedPoint(e.getKey(), meanIgnoringMissing(values), se));
        }
        return series;
    }

    /**
     * Mean of the non-NaN values, or NaN when there are none.
     * Values are summed in sorted order so the result is identical for any input order.
     */
    static double meanIgnoringMissing(double[] values) {
        double[] present = Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();
        if (present.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : present) {
            sum += v;
        }
        return sum / present.length;
    }
}
