package com.intelhub.backend.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.intelhub.backend.config.PipelineProperties;
import com.intelhub.backend.exception.ValidationException;
import org.junit.jupiter.api.Test;

class ThresholdSettingsTest {

    @Test
    void update_shouldReturnPreviousValue() {
        ThresholdSettings settings = new ThresholdSettings(new PipelineProperties());

        double previous = settings.update(7.5);

        assertThat(previous).isEqualTo(6.0);
        assertThat(settings.current()).isEqualTo(7.5);
    }

    @Test
    void update_shouldReject_whenOutsideRange() {
        ThresholdSettings settings = new ThresholdSettings(new PipelineProperties());

        assertThatThrownBy(() -> settings.update(0.0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> settings.update(10.5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> settings.update(Double.NaN)).isInstanceOf(ValidationException.class);
        assertThat(settings.current()).isEqualTo(6.0);
    }

    @Test
    void constructor_shouldReject_whenConfiguredThresholdInvalid() {
        PipelineProperties properties = new PipelineProperties();
        properties.setScoreThreshold(-1.0);

        assertThatThrownBy(() -> new ThresholdSettings(properties)).isInstanceOf(ValidationException.class);
    }
}
