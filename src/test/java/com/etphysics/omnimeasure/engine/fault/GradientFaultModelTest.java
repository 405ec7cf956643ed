package com.etphysics.omnimeasure.engine.fault;

import com.etphysics.omnimeasure.domain.FaultPrediction;
import com.etphysics.omnimeasure.engine.EngineConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GradientFaultModelTest {

    private final GradientFaultModel model = new GradientFaultModel(EngineConfig.defaults());

    @Test
    void no_forecast_without_trend_or_shimmer() {
        assertThat(model.predict(new FaultInputs(0, 0, 0.5, 0.0)).text()).isEqualTo(FaultPrediction.NO_FORECAST);
        assertThat(model.predict(new FaultInputs(0, 0, 0.0, 0.01)).hasForecast()).isFalse();
        assertThat(model.predict(new FaultInputs(0, 0, 0.5, -0.01)).hasForecast()).isFalse();
    }

    @Test
    void rising_trend_projects_time_to_failure() {
        FaultPrediction p = model.predict(new FaultInputs(0, 0, 0.5, 0.01));

        assertThat(p.ttfHours()).isCloseTo(Math.log(2.0) / 0.01, within(1e-9));
        assertThat(p.confidence()).isEqualTo(0.05);
        assertThat(p.text()).isEqualTo("Trend: Est. Fail 69.3 h");
    }

    @Test
    void shimmer_of_one_or_more_gives_no_forecast() {
        assertThat(model.predict(new FaultInputs(0, 0, 4.0, 0.01)).hasForecast()).isFalse();
        assertThat(model.predict(new FaultInputs(0, 0, 1.0, 0.01)).text()).isEqualTo(FaultPrediction.NO_FORECAST);
    }

    @Test
    void steeper_trend_raises_confidence() {
        FaultPrediction p = model.predict(new FaultInputs(0, 0, 0.5, 1.0));

        assertThat(p.ttfHours()).isCloseTo(Math.log(2.0), within(1e-12));
        assertThat(p.confidence()).isCloseTo(1.0 / (1.0 + Math.log(2.0)), within(1e-12));
    }
}
