package com.air.normaliser.model;

import com.air.normaliser.common.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Row-major projection of a dataset onto a model's declared features, in declaration order.
 * Columns the model did not declare never reach it.
 */
public final class FeatureMatrix {

    private final List<String> featureNames;
    private final double[][] rows;

    private FeatureMatrix(List<String> featureNames, double[][] rows) {
        this.featureNames = featureNames;
        this.rows = rows;
    }

    public static FeatureMatrix of(PreparedDataset dataset, List<String> featureNames) {
        List<String> missing = new ArrayList<>();
        for (String name : featureNames) {
            if (!dataset.hasColumn(name)) missing.add(name);
        }
        if (!missing.isEmpty()) {
            throw new InvalidInputException("Dataset is missing model features " + missing);
        }

        int rowCount = dataset.getRowCount();
        double[][] rows = new double[rowCount][featureNames.size()];
        for (int f = 0; f < featureNames.size(); f++) {
            double[] column = dataset.column(featureNames.get(f));
            for (int r = 0; r < rowCount; r++) {
                rows[r][f] = column[r];
            }
        }
        return new FeatureMatrix(Collections.unmodifiableList(new ArrayList<>(featureNames)), rows);
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int getRowCount() {
        return rows.length;
    }

    public double value(int row, int feature) {
        return rows[row][feature];
    }

    public double value(int row, String feature) {
        int index = featureNames.indexOf(feature);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown feature: " + feature);
        }
        return rows[row][index];
    }

    public double[] row(int row) {
        return rows[row].clone();
    }
}
