package com.air.normaliser.model.dto;

import com.air.normaliser.model.PreparedDataset;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One trial's resampled dataset together with the row indices it was drawn with.
 */
@Getter
@AllArgsConstructor
public class SampleDraw {

    private final PreparedDataset dataset;
    private final int[] rowIndex;

    public int[] getRowIndex() {
        return rowIndex.clone();
    }
}
