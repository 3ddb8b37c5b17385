package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.PulseDetectionException;
import org.hopkinson.utils.SyntheticSignals;
import org.hopkinson.utils.dataonly.AmplitudeMetric;
import org.hopkinson.utils.dataonly.DetectorSettings;
import org.hopkinson.utils.dataonly.ExtractionRetry;
import org.hopkinson.utils.dataonly.Polarity;
import org.hopkinson.utils.dataonly.PulseWindow;
import org.hopkinson.utils.dataonly.SearchBounds;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PulseExtractorTest {

    private static final int PULSE_POINTS = 200;

    // Импульс на [1400, 1600), а границы поиска заканчиваются на 1400
    private static final double[] TRACE = SyntheticSignals.withNoise(
            SyntheticSignals.halfSine(4000, 1400, PULSE_POINTS, -1.0), 0.02, 7L);
    private static final SearchBounds TOO_NARROW = SearchBounds.between(0, 1400);

    private static PulseExtractor extractor(ExtractionRetry retry) {
        PulseDetector detector = new PulseDetector(
                DetectorSettings.of(PULSE_POINTS, List.of(6.0), Polarity.COMPRESSIVE));
        return new PulseExtractor(detector, retry);
    }

    @Test
    void wideningBoundsEventuallyAdmitsThePulse() throws Exception {
        PulseWindow window = extractor(new ExtractionRetry(4, 100, 400))
                .extract(TRACE, TOO_NARROW, AmplitudeMetric.MEDIAN, CancellationToken.create());

        assertThat(window.length()).isEqualTo(PULSE_POINTS);
        assertThat(Math.abs(window.midpoint() - 1500)).isLessThanOrEqualTo(20);
    }

    @Test
    void exhaustedRetriesReportAttemptCount() {
        assertThatThrownBy(() -> extractor(new ExtractionRetry(2, 50, 50))
                .extract(TRACE, TOO_NARROW, AmplitudeMetric.MEDIAN, CancellationToken.create()))
                .isInstanceOfSatisfying(PulseDetectionException.class, e -> {
                    assertThat(e.attempts()).isEqualTo(2);
                    assertThat(e.getCause()).isInstanceOf(PulseDetectionException.class);
                });
    }

    @Test
    void retriesStopOnceTheMarginCapIsReached() {
        assertThatThrownBy(() -> extractor(new ExtractionRetry(10, 50, 50))
                .extract(TRACE, TOO_NARROW, AmplitudeMetric.MEDIAN, CancellationToken.create()))
                .isInstanceOfSatisfying(PulseDetectionException.class,
                        e -> assertThat(e.attempts()).isEqualTo(2));
    }

    @Test
    void singleAttemptIsTheDefault() throws Exception {
        PulseWindow window = extractor(null)
                .extract(TRACE, SearchBounds.NONE, AmplitudeMetric.MEDIAN, CancellationToken.create());

        assertThat(Math.abs(window.midpoint() - 1500)).isLessThanOrEqualTo(20);
        assertThatThrownBy(() -> extractor(null)
                .extract(TRACE, TOO_NARROW, AmplitudeMetric.MEDIAN, CancellationToken.create()))
                .isInstanceOfSatisfying(PulseDetectionException.class,
                        e -> assertThat(e.attempts()).isEqualTo(1));
    }

    @Test
    void unboundedSearchIsNotRepeated() {
        double[] silent = new double[4000];

        assertThatThrownBy(() -> extractor(new ExtractionRetry(3, 500, 1500))
                .extract(silent, SearchBounds.NONE, AmplitudeMetric.MEDIAN, CancellationToken.create()))
                .isInstanceOfSatisfying(PulseDetectionException.class,
                        e -> assertThat(e.attempts()).isEqualTo(1));
    }
}
