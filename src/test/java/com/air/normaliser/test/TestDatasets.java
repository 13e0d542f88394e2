package com.air.normaliser.test;

import com.air.normaliser.model.PreparedDataset;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Small prepared datasets for tests.
 */
public final class TestDatasets {

    private TestDatasets() {
    }

    /**
     * One row per day from 2020-01-01 with a trend column, two correlated covariates
     * ({@code air_temp = 10 * ws}) and a response.
     */
    public static PreparedDataset daily(int days) {
        List<Instant> dates = new ArrayList<>();
        double[] trend = new double[days];
        double[] ws = new double[days];
        double[] airTemp = new double[days];
        double[] value = new double[days];
        for (int i = 0; i < days; i++) {
            Instant date = LocalDate.of(2020, 1, 1).plusDays(i).atStartOfDay().toInstant(ZoneOffset.UTC);
            dates.add(date);
            trend[i] = date.getEpochSecond();
            ws[i] = i + 1;
            airTemp[i] = 10.0 * (i + 1);
            value[i] = 40.0 + i;
        }
        return PreparedDataset.builder()
                .dates(dates)
                .column(PreparedDataset.TREND_COLUMN, trend)
                .column("ws", ws)
                .column("air_temp", airTemp)
                .column(PreparedDataset.VALUE_COLUMN, value)
                .build();
    }

    public static Instant day(int dayOfJanuary) {
        return LocalDate.of(2020, 1, dayOfJanuary).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
}
