package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;
import org.hopkinson.utils.SyntheticSignals;
import org.hopkinson.utils.dataonly.BarSetup;
import org.hopkinson.utils.dataonly.EquilibriumMetrics;
import org.hopkinson.utils.dataonly.GaugeParameters;
import org.hopkinson.utils.dataonly.StressStrainCurve;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StressStrainCalculatorTest {

    private static final int N = 300;
    private static final double[] TIME = SyntheticSignals.time(N, 1e-4);

    // Равновесие: ε_T = ε_I + ε_R (отражённый растягивающий, поэтому положительный)
    private static final double[] INCIDENT = SyntheticSignals.halfSine(N, 100, 100, -1000.0);
    private static final double[] REFLECTED = SyntheticSignals.scaled(INCIDENT, -0.4);
    private static final double[] TRANSMITTED = SyntheticSignals.sum(INCIDENT, REFLECTED);

    private final StressStrainCalculator calculator =
            new StressStrainCalculator(new BarSetup(100.0, 5000.0, 200.0, 25.0, 5.0, 1e4));

    @Test
    void oneWaveAndThreeWaveAgreeUnderEquilibrium() {
        StressStrainCurve one = calculator.calculate(INCIDENT, TRANSMITTED, REFLECTED, TIME, "1-wave");
        StressStrainCurve three = calculator.calculate(INCIDENT, TRANSMITTED, REFLECTED, TIME, "3-wave");

        assertThat(one.stress()).containsExactly(three.stress(), within(1e-9));
        assertThat(one.strain()).containsExactly(three.strain(), within(1e-12));
        assertThat(one.strainRate()).containsExactly(three.strainRate(), within(1e-6));
    }

    @Test
    void equilibratedPulsesScoreNearPerfectMetrics() {
        Map<AnalysisMethod, StressStrainCurve> curves =
                calculator.calculateAllMethods(INCIDENT, TRANSMITTED, REFLECTED, TIME);

        EquilibriumMetrics metrics = calculator.calculateEquilibriumMetrics(curves);

        assertThat(metrics.fbc()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.dsuf()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.seqi()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.plateau().fbc()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.soi()).isPositive();
        assertThat(metrics.asNamedMap()).containsKeys("FBC", "SEQI", "SOI", "DSUF", "windowed_DSUF_unloading");
    }

    @Test
    void stressFollowsElasticBarFormula() {
        StressStrainCurve one = calculator.calculate(INCIDENT, TRANSMITTED, REFLECTED, TIME, AnalysisMethod.ONE_WAVE);

        int peak = SignalMath.argMax(one.stress());
        // σ = (A_bar / A_s) · E · |ε_T| · 1000 = 4 · 200 · 0.06 · 1000
        assertThat(one.stress()[peak]).isCloseTo(48_000.0, within(10.0));
        // F = A_bar · E · |ε_T| · 1000
        assertThat(one.barForce()[peak]).isCloseTo(1_200_000.0, within(300.0));
    }

    @Test
    void strainRateIsReportedPerSecondAndStrainIsItsIntegral() {
        StressStrainCurve one = calculator.calculate(INCIDENT, TRANSMITTED, REFLECTED, TIME, AnalysisMethod.ONE_WAVE);

        // |ε̇| = 2c/L · ε_R = 2 · 5000 / 5 · 0.04 = 80 1/мс
        assertThat(one.strainRate()[SignalMath.argMax(one.strainRate())]).isCloseTo(80_000.0, within(20.0));
        assertThat(one.strain()[0]).isZero();
        assertThat(one.strain()[N - 1]).isGreaterThan(one.strain()[N / 2]);
    }

    @Test
    void trueQuantitiesUseSignedEngineeringValues() {
        StressStrainCurve three = calculator.calculate(INCIDENT, TRANSMITTED, REFLECTED, TIME, AnalysisMethod.THREE_WAVE);

        int last = N - 1;
        double eps = -three.strain()[last]; // сжатие
        assertThat(three.trueStrain()[last]).isCloseTo(Math.abs(Math.log1p(eps)), within(1e-12));
        assertThat(three.trueStress()[150]).isCloseTo(
                three.stress()[150] * (1.0 - three.strain()[150]), within(1e-6));
    }

    @Test
    void twoWaveStressComesFromTheFrontFace() {
        StressStrainCurve two = calculator.calculate(INCIDENT, TRANSMITTED, REFLECTED, TIME, AnalysisMethod.TWO_WAVE);
        StressStrainCurve one = calculator.calculate(INCIDENT, TRANSMITTED, REFLECTED, TIME, AnalysisMethod.ONE_WAVE);

        assertThat(two.stress()).containsExactly(one.stress(), within(1e-9));
        assertThat(two.asNamedSeries()).containsKeys("time", "stress", "strain", "true_strain_rate", "bar_force");
    }

    @Test
    void unknownMethodLabelIsRejected() {
        assertThatThrownBy(() -> calculator.calculate(INCIDENT, TRANSMITTED, REFLECTED, TIME, "4-wave"))
                .isInstanceOf(AnalysisValidationException.class)
                .hasMessageContaining("4-wave");
        assertThat(AnalysisMethod.fromLabel("2-wave")).isEqualTo(AnalysisMethod.TWO_WAVE);
    }

    @Test
    void mismatchedLengthsAreRejected() {
        assertThatThrownBy(() -> calculator.calculate(INCIDENT, new double[N - 3], REFLECTED, TIME,
                AnalysisMethod.ONE_WAVE))
                .isInstanceOf(AnalysisValidationException.class);
    }

    @Test
    void silentRecordHasUndefinedMetrics() {
        double[] zeros = new double[N];
        EquilibriumMetrics metrics = calculator.calculateEquilibriumMetrics(
                calculator.calculateAllMethods(zeros, zeros, zeros, TIME));

        assertThat(metrics.fbc()).isNaN();
        assertThat(metrics.dsuf()).isNaN();
        assertThat(metrics.loading().fbc()).isNaN();
    }

    @Test
    void voltageIsConvertedThroughTheGaugeBridge() {
        GaugeParameters gauge = new GaugeParameters(350.0, 2.0, 5.0, 0.0);

        assertThat(StressStrainCalculator.voltageToStrain(new double[]{ 1.0, -2.0 }, gauge))
                .containsExactly(new double[]{ 0.1, -0.2 }, within(1e-12));
    }

    @Test
    void voltageInputIsScaledLikeGaugeUnits() {
        // 0.1 единицы датчика на вольт: вольты в 10 раз больше единиц
        GaugeParameters gauge = new GaugeParameters(350.0, 2.0, 5.0, 0.0);

        StressStrainCurve fromVolts = calculator.calculateFromVoltage(
                SyntheticSignals.scaled(INCIDENT, 10.0), SyntheticSignals.scaled(TRANSMITTED, 10.0),
                SyntheticSignals.scaled(REFLECTED, 10.0), TIME, AnalysisMethod.ONE_WAVE, gauge, gauge);
        StressStrainCurve fromUnits = calculator.calculate(INCIDENT, TRANSMITTED, REFLECTED, TIME, AnalysisMethod.ONE_WAVE);

        assertThat(fromVolts.stress()).containsExactly(fromUnits.stress(), within(1e-6));
        assertThat(fromVolts.strain()).containsExactly(fromUnits.strain(), within(1e-12));
    }
}
