package com.air.normaliser.service.sampling;

import com.air.normaliser.common.exception.InvalidInputException;
import com.air.normaliser.model.PreparedDataset;
import com.air.normaliser.model.dto.SampleDraw;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Resamples covariate columns of a dataset with one shared row-index draw per call.
 * <p>
 * All selected covariates move together, so their joint structure within a row survives, while their
 * link to the date axis and every unselected column (the trend term among them) is broken.
 */
@Component
public class CovariateSampler {

    public SampleDraw sample(PreparedDataset dataset, List<String> variables, boolean replace,
                             SplittableRandom random) {
        int rowCount = dataset.getRowCount();
        if (rowCount == 0) {
            throw new InvalidInputException("Cannot sample an empty dataset");
        }

        int[] index = drawRowIndex(rowCount, replace, random);

        Map<String, double[]> sampled = new LinkedHashMap<>();
        for (String variable : variables) {
            double[] source = dataset.column(variable);
            double[] target = new double[rowCount];
            for (int r = 0; r < rowCount; r++) {
                target[r] = source[index[r]];
            }
            sampled.put(variable, target);
        }
        return new SampleDraw(dataset.withColumns(sampled), index);
    }

    /**
     * Draws {@code rowCount} indices over {@code [0, rowCount)}: independently when {@code replace},
     * otherwise as a uniform permutation.
     */
    public int[] drawRowIndex(int rowCount, boolean replace, SplittableRandom random) {
        int[] index = new int[rowCount];
        if (replace) {
            for (int i = 0; i < rowCount; i++) {
                index[i] = random.nextInt(rowCount);
            }
            return index;
        }

        for (int i = 0; i < rowCount; i++) {
            index[i] = i;
        }
        // Fisher-Yates
        for (int i = rowCount - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = index[i];
            index[i] = index[j];
            index[j] = tmp;
        }
        return index;
    }
}
