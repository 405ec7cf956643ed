package com.etphysics.omnimeasure.engine.fault;

import com.etphysics.omnimeasure.domain.FaultPrediction;
import com.etphysics.omnimeasure.engine.EngineConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DecayFaultModelTest {

    private final DecayFaultModel model = new DecayFaultModel(EngineConfig.defaults());

    private FaultPrediction predict(double amplitude, double freqHz) {
        return model.predict(new FaultInputs(amplitude, freqHz, 0.0, 0.0));
    }

    @Test
    void high_amplitude_at_high_frequency_is_bearing_wear() {
        FaultPrediction p = predict(5.0, 30.0);

        assertThat(p.ttfHours()).isCloseTo(24.0 * Math.exp(-0.5), within(1e-9));
        assertThat(p.confidence()).isCloseTo(0.95, within(1e-12));
        assertThat(p.text()).isEqualTo("CRITICAL: Bearing Wear (Est. Fail 14.6 h)");
    }

    @Test
    void high_amplitude_at_low_frequency_is_imbalance() {
        FaultPrediction p = predict(5.0, 10.0);

        assertThat(p.ttfHours()).isCloseTo(168.0 * Math.exp(-0.3), within(1e-9));
        assertThat(p.confidence()).isCloseTo(0.90, within(1e-12));
        assertThat(p.text()).isEqualTo("CRITICAL: Imbalance (Est. Fail 5.2 d)");
    }

    @Test
    void moderate_amplitude_is_a_mount_warning_regardless_of_frequency() {
        FaultPrediction low = predict(2.5, 2.0);
        FaultPrediction high = predict(2.5, 200.0);

        assertThat(low.ttfHours()).isCloseTo(720.0 * Math.exp(-0.1), within(1e-9));
        assertThat(low.confidence()).isCloseTo(0.70, within(1e-12));
        assertThat(low.text()).isEqualTo("Warning: Check Mounts (Risk 27.1 d)");
        assertThat(high).isEqualTo(low);
    }

    @Test
    void thresholds_are_exclusive() {
        assertThat(predict(4.0, 30.0).text()).startsWith("Warning");
        assertThat(predict(1.5, 30.0).text()).isEqualTo("Healthy");
    }

    @Test
    void quiet_machine_is_healthy_without_forecast() {
        FaultPrediction p = predict(0.2, 0.0);

        assertThat(p.text()).isEqualTo("Healthy");
        assertThat(p.confidence()).isEqualTo(0.05);
        assertThat(p.hasForecast()).isFalse();
    }

    @Test
    void confidence_is_capped_per_tier() {
        assertThat(predict(100.0, 30.0).confidence()).isCloseTo(0.99, within(1e-12));
        assertThat(predict(100.0, 5.0).confidence()).isCloseTo(0.99, within(1e-12));
        assertThat(predict(3.9, 5.0).confidence()).isCloseTo(0.79, within(1e-12));
    }
}
