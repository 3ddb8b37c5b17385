package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;
import org.hopkinson.utils.PulseDetectionException;
import org.hopkinson.utils.SyntheticSignals;
import org.hopkinson.utils.dataonly.AmplitudeMetric;
import org.hopkinson.utils.dataonly.DetectorSettings;
import org.hopkinson.utils.dataonly.Polarity;
import org.hopkinson.utils.dataonly.PulseWindow;
import org.hopkinson.utils.dataonly.SearchBounds;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PulseDetectorTest {

    private static final int LENGTH = 4000;
    private static final int PULSE_POINTS = 200;
    private static final int PULSE_START = 1400;
    private static final int PULSE_CENTER = PULSE_START + PULSE_POINTS / 2;

    private static double[] noisyCompressivePulse() {
        double[] clean = SyntheticSignals.halfSine(LENGTH, PULSE_START, PULSE_POINTS, -1.0);
        return SyntheticSignals.withNoise(clean, 0.02, 7L);
    }

    @Test
    void windowMidpointLandsNearPulseCentreForEveryThreshold() throws Exception {
        double[] trace = noisyCompressivePulse();

        for (double k : DetectorSettings.DEFAULT_K_TRIALS) {
            PulseDetector detector = new PulseDetector(
                    DetectorSettings.of(PULSE_POINTS, List.of(k), Polarity.COMPRESSIVE));

            PulseWindow window = detector.findWindow(trace, SearchBounds.NONE, AmplitudeMetric.MEDIAN);

            assertThat(window.length()).as("k=%s", k).isEqualTo(PULSE_POINTS);
            assertThat(Math.abs(window.midpoint() - PULSE_CENTER)).as("k=%s", k)
                    .isLessThanOrEqualTo(PULSE_POINTS / 10);
        }
    }

    @Test
    void peakMetricFindsTheSamePulse() throws Exception {
        PulseDetector detector = new PulseDetector(DetectorSettings.of(PULSE_POINTS));

        PulseWindow window = detector.findWindow(noisyCompressivePulse(), SearchBounds.NONE, AmplitudeMetric.PEAK);

        assertThat(Math.abs(window.midpoint() - PULSE_CENTER)).isLessThanOrEqualTo(PULSE_POINTS / 10);
    }

    @Test
    void tensileDetectorIgnoresCompressivePulse() throws Exception {
        double[] trace = SyntheticSignals.withNoise(
                SyntheticSignals.halfSine(LENGTH, PULSE_START, PULSE_POINTS, -1.0), 0.02, 11L);
        SyntheticSignals.addHalfSine(trace, 2600, PULSE_POINTS, 0.5);
        PulseDetector detector = new PulseDetector(
                DetectorSettings.of(PULSE_POINTS, List.of(6.0), Polarity.TENSILE));

        PulseWindow window = detector.findWindow(trace, SearchBounds.NONE, AmplitudeMetric.MEDIAN);

        assertThat(Math.abs(window.midpoint() - 2700)).isLessThanOrEqualTo(PULSE_POINTS / 10);
    }

    @Test
    void boundsExcludingThePulseRaiseDetectionFailure() {
        PulseDetector detector = new PulseDetector(
                DetectorSettings.of(PULSE_POINTS, List.of(6.0), Polarity.COMPRESSIVE));
        double[] trace = noisyCompressivePulse();

        assertThatThrownBy(() -> detector.findWindow(trace, SearchBounds.between(0, 800), AmplitudeMetric.MEDIAN))
                .isInstanceOf(PulseDetectionException.class);
        assertThatThrownBy(() -> detector.findWindow(trace, SearchBounds.from(2000), AmplitudeMetric.MEDIAN))
                .isInstanceOf(PulseDetectionException.class);
    }

    @Test
    void silentTraceHasNoPulse() {
        PulseDetector detector = new PulseDetector(DetectorSettings.of(PULSE_POINTS));

        assertThatThrownBy(() -> detector.findWindow(new double[LENGTH], SearchBounds.NONE, AmplitudeMetric.MEDIAN))
                .isInstanceOf(PulseDetectionException.class);
    }

    @Test
    void cancelledTokenStopsDetection() {
        PulseDetector detector = new PulseDetector(DetectorSettings.of(PULSE_POINTS));
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThatThrownBy(() -> detector.findWindow(noisyCompressivePulse(), SearchBounds.NONE,
                AmplitudeMetric.MEDIAN, token))
                .isInstanceOf(CancellationException.class);
    }

    @Test
    void templateHasUnitNormAndPolaritySign() {
        double[] t = new PulseDetector(DetectorSettings.of(64, Polarity.COMPRESSIVE)).template();

        double norm = 0.0;
        for (double v : t) {
            norm += v * v;
            assertThat(v).isNegative();
        }
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void segmentIsCentredOnEnergyCentroid() throws Exception {
        PulseDetector detector = new PulseDetector(DetectorSettings.of(PULSE_POINTS));
        double[] trace = SyntheticSignals.halfSine(LENGTH, PULSE_START, PULSE_POINTS, -1.0);
        PulseWindow window = detector.findWindow(trace, SearchBounds.NONE, AmplitudeMetric.MEDIAN);

        double[] segment = detector.segmentAndCenter(trace, window, 512);

        assertThat(segment).hasSize(512);
        assertThat(SignalMath.energyCentroid(segment)).isCloseTo(256.0, within(1.0));
        for (double v : segment) assertThat(v).isLessThanOrEqualTo(0.0);
    }

    @Test
    void segmentationIsIdempotentOnCentredSegment() throws Exception {
        PulseDetector detector = new PulseDetector(DetectorSettings.of(PULSE_POINTS));
        double[] trace = SyntheticSignals.halfSine(LENGTH, PULSE_START, PULSE_POINTS, -1.0);
        PulseWindow window = detector.findWindow(trace, SearchBounds.NONE, AmplitudeMetric.MEDIAN);

        double[] once = detector.segmentAndCenter(trace, window, 512);
        double[] twice = detector.segmentAndCenter(once, new PulseWindow(0, once.length), 512);

        assertThat(twice).containsExactly(once, within(1e-12));
    }

    @Test
    void segmentDropsWrongPolarityAndSmallSamples() {
        PulseDetector detector = new PulseDetector(DetectorSettings.of(20));
        double[] trace = SyntheticSignals.halfSine(200, 90, 20, -1.0);
        trace[40] = 0.8;     // положительный выброс
        trace[60] = -0.005;  // ниже 1% от максимума

        double[] segment = detector.segmentAndCenter(trace, new PulseWindow(0, 200), 200,
                Polarity.COMPRESSIVE, 0.01);

        int nonZero = 0;
        for (double v : segment) {
            assertThat(v).isLessThanOrEqualTo(0.0);
            if (v != 0.0) nonZero++;
        }
        assertThat(nonZero).isLessThanOrEqualTo(20);
    }

    @Test
    void segmentNearTraceEndIsZeroPadded() {
        PulseDetector detector = new PulseDetector(DetectorSettings.of(100));
        double[] trace = SyntheticSignals.halfSine(1000, 880, 100, -1.0);

        double[] segment = detector.segmentAndCenter(trace, new PulseWindow(880, 980), 400);

        assertThat(segment).hasSize(400);
        assertThat(SignalMath.energyCentroid(segment)).isCloseTo(200.0, within(1.0));
    }

    @Test
    void windowOutsideTraceIsRejected() {
        PulseDetector detector = new PulseDetector(DetectorSettings.of(100));

        assertThatThrownBy(() -> detector.segmentAndCenter(new double[50], new PulseWindow(10, 80), 64))
                .isInstanceOf(AnalysisValidationException.class);
    }

    @Test
    void riseTimeIsMeasuredBetweenFirstCrossings() throws Exception {
        double[] pulse = new double[200];
        for (int i = 0; i < pulse.length; i++) pulse[i] = i <= 100 ? -i / 100.0 : -1.0;
        double[] time = SyntheticSignals.time(200, 0.01);
        PulseDetector detector = new PulseDetector(DetectorSettings.of(50));

        double rise = detector.calculateRiseTime(pulse, time);

        assertThat(rise).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void flatPulseHasNoRiseTime() {
        PulseDetector detector = new PulseDetector(DetectorSettings.of(50));

        assertThatThrownBy(() -> detector.calculateRiseTime(new double[10], SyntheticSignals.time(10, 1.0)))
                .isInstanceOf(PulseDetectionException.class);
        assertThatThrownBy(() -> detector.calculateRiseTime(new double[10], new double[9]))
                .isInstanceOf(AnalysisValidationException.class);
    }
}
