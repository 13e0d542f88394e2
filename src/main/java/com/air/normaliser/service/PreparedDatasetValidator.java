package com.air.normaliser.service;

import com.air.normaliser.common.exception.InvalidInputException;
import com.air.normaliser.model.PreparedDataset;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a dataset has the prepared shape before any trial is dispatched.
 */
@Component
public class PreparedDatasetValidator {

    public void validate(PreparedDataset dataset, List<String> modelFeatures, List<String> variables,
                         String trendColumn) {
        if (dataset == null) {
            throw new InvalidInputException("No dataset supplied");
        }
        if (dataset.getRowCount() == 0) {
            throw new InvalidInputException("Dataset has no rows");
        }
        if (dataset.getDates().contains(null)) {
            throw new InvalidInputException("`" + PreparedDataset.DATE_COLUMN + "` must not contain missing values");
        }
        if (!dataset.hasColumn(trendColumn)) {
            throw new InvalidInputException("Dataset must contain the trend column `" + trendColumn + "`");
        }

        List<String> missing = new ArrayList<>();
        for (String feature : modelFeatures) {
            if (!dataset.hasColumn(feature)) missing.add(feature);
        }
        if (!missing.isEmpty()) {
            throw new InvalidInputException("Dataset is missing model features " + missing);
        }

        for (String variable : variables) {
            if (trendColumn.equals(variable) || PreparedDataset.DATE_COLUMN.equals(variable)) {
                throw new InvalidInputException("`" + variable + "` cannot be resampled");
            }
            if (!dataset.hasColumn(variable)) missing.add(variable);
        }
        if (!missing.isEmpty()) {
            throw new InvalidInputException("Dataset is missing variables to sample " + missing);
        }
    }
}
