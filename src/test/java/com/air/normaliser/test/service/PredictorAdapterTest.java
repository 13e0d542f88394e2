package com.air.normaliser.test.service;

import com.air.normaliser.common.exception.InvalidInputException;
import com.air.normaliser.common.exception.InvalidModelException;
import com.air.normaliser.common.exception.UnsupportedModelOperationException;
import com.air.normaliser.model.FeatureMatrix;
import com.air.normaliser.model.PreparedDataset;
import com.air.normaliser.model.TrainedModel;
import com.air.normaliser.model.VarianceAwareModel;
import com.air.normaliser.model.dto.PredictionResult;
import com.air.normaliser.service.prediction.PredictorAdapter;
import com.air.normaliser.test.TestDatasets;
import com.air.normaliser.test.TestModels;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PredictorAdapterTest {

    private final PredictorAdapter adapter = new PredictorAdapter();
    private final PreparedDataset dataset = TestDatasets.daily(4);

    @Test
    void modelSeesOnlyItsDeclaredFeatures() {
        TrainedModel model = mock(TrainedModel.class);
        when(model.getFeatureNames()).thenReturn(List.of("ws"));
        when(model.predict(any(), anyInt())).thenReturn(new double[]{1, 2, 3, 4});

        PredictionResult result = adapter.predict(model, dataset, false, 3);

        ArgumentCaptor<FeatureMatrix> features = ArgumentCaptor.forClass(FeatureMatrix.class);
        verify(model).predict(features.capture(), eq(3));
        assertThat(features.getValue().getFeatureNames()).containsExactly("ws");
        assertThat(result.getValues()).containsExactly(1, 2, 3, 4);
        assertThat(result.hasStandardErrors()).isFalse();
        assertThat(result.standardError(0)).isNull();
    }

    @Test
    void standardErrorsUseTheVarianceMode() {
        VarianceAwareModel model = mock(VarianceAwareModel.class);
        when(model.getFeatureNames()).thenReturn(TestModels.FEATURES);
        when(model.predictWithStandardErrors(any(), anyInt())).thenReturn(PredictionResult.withStandardErrors(
                new double[]{5, 5, 5, 5}, new double[]{0.5, 0.5, 0.5, 0.5}));

        PredictionResult result = adapter.predict(model, dataset, true, 1);

        assertThat(result.hasStandardErrors()).isTrue();
        assertThat(result.standardError(3)).isEqualTo(0.5);
        verify(model, never()).predict(any(), anyInt());
    }

    @Test
    void standardErrorsFromAPlainModelAreUnsupported() {
        assertThatThrownBy(() -> adapter.predict(TestModels.constant(5.0), dataset, true, 1))
                .isInstanceOf(UnsupportedModelOperationException.class)
                .extracting("errorCode").isEqualTo("ERR-MDL-002");
    }

    @Test
    void nullModelIsInvalid() {
        assertThatThrownBy(() -> adapter.predict(null, dataset, false, 1))
                .isInstanceOf(InvalidModelException.class);
    }

    @Test
    void modelWithoutFeaturesIsInvalid() {
        TrainedModel model = mock(TrainedModel.class);
        when(model.getFeatureNames()).thenReturn(List.of());

        assertThatThrownBy(() -> adapter.predict(model, dataset, false, 1))
                .isInstanceOf(InvalidModelException.class)
                .hasMessageContaining("declares no features");
    }

    @Test
    void wrongNumberOfPredictionsIsInvalid() {
        TrainedModel model = mock(TrainedModel.class);
        when(model.getFeatureNames()).thenReturn(List.of("ws"));
        when(model.predict(any(), anyInt())).thenReturn(new double[]{1, 2});

        assertThatThrownBy(() -> adapter.predict(model, dataset, false, 1))
                .isInstanceOf(InvalidModelException.class)
                .hasMessageContaining("2 predictions for 4 rows");
    }

    @Test
    void varianceModeWithoutErrorsIsInvalid() {
        VarianceAwareModel model = mock(VarianceAwareModel.class);
        when(model.getFeatureNames()).thenReturn(List.of("ws"));
        when(model.predictWithStandardErrors(any(), anyInt())).thenReturn(PredictionResult.of(new double[4]));

        assertThatThrownBy(() -> adapter.predict(model, dataset, true, 1))
                .isInstanceOf(InvalidModelException.class);
    }

    @Test
    void missingFeatureColumnIsInvalidInput() {
        TrainedModel model = mock(TrainedModel.class);
        when(model.getFeatureNames()).thenReturn(List.of("ws", "rh"));

        assertThatThrownBy(() -> adapter.predict(model, dataset, false, 1))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("rh");
    }
}
