package org.hopkinson.utils.pulsesolver;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalMathTest {

    @Test
    void sameModeCorrelationMatchesDirectSum() {
        double[] signal = { 0, 1, 3, -2, 5, 0, 4, -1, 2 };
        double[] template = { 1, 2, -1, 0.5 };

        double[] fast = SignalMath.crossCorrelateSame(signal, template);

        // Центр шаблона на отсчёте i: template[j] умножается на signal[i - (m-1) + (m-1)/2 + j]
        int m = template.length;
        int offset = (m - 1) - (m - 1) / 2;
        for (int i = 0; i < signal.length; i++) {
            double direct = 0.0;
            for (int j = 0; j < m; j++) {
                int k = i - offset + j;
                if (k >= 0 && k < signal.length) direct += template[j] * signal[k];
            }
            assertThat(fast[i]).as("index %d", i).isCloseTo(direct, within(1e-9));
        }
    }

    @Test
    void gradientUsesCentralDifferencesInsideAndOneSidedAtEnds() {
        assertThat(SignalMath.gradient(new double[]{ 1, 2, 4, 7, 11 }))
                .containsExactly(new double[]{ 1, 1.5, 2.5, 3.5, 4 }, within(1e-12));
    }

    @Test
    void cumulativeTrapezoidStartsAtZero() {
        double[] y = { 1, 1, 3 };
        double[] t = { 0, 1, 2 };

        assertThat(SignalMath.cumulativeTrapezoid(y, t)).containsExactly(new double[]{ 0, 1, 3 }, within(1e-12));
    }

    @Test
    void shiftingBackAndForthRestoresAllButBoundarySamples() {
        double[] x = new double[50];
        for (int i = 0; i < x.length; i++) x[i] = Math.sin(0.3 * i) + i;

        for (int s : new int[]{ -7, -1, 0, 3, 12 }) {
            double[] back = SignalMath.shift(SignalMath.shift(x, s), -s);
            int differing = 0;
            for (int i = 0; i < x.length; i++) if (back[i] != x[i]) differing++;
            assertThat(differing).as("shift %d", s).isLessThanOrEqualTo(Math.abs(s));
        }
    }

    @Test
    void positiveShiftMovesSamplesLaterAndPadsWithZeros() {
        assertThat(SignalMath.shift(new double[]{ 1, 2, 3, 4 }, 2)).containsExactly(0, 0, 1, 2);
        assertThat(SignalMath.shift(new double[]{ 1, 2, 3, 4 }, -1)).containsExactly(2, 3, 4, 0);
    }

    @Test
    void rollWrapsAround() {
        assertThat(SignalMath.roll(new double[]{ 1, 2, 3, 4 }, 1)).containsExactly(4, 1, 2, 3);
        assertThat(SignalMath.roll(new double[]{ 1, 2, 3, 4 }, -5)).containsExactly(2, 3, 4, 1);
    }

    @Test
    void energyCentroidOfZerosIsUndefined() {
        assertThat(SignalMath.energyCentroid(new double[8])).isNaN();
        assertThat(SignalMath.energyCentroid(new double[]{ 0, 0, 3, 0 })).isEqualTo(2.0);
    }

    @Test
    void pearsonOfConstantSeriesIsNaN() {
        assertThat(SignalMath.pearson(new double[]{ 1, 1, 1 }, new double[]{ 1, 2, 3 })).isNaN();
        assertThat(SignalMath.pearson(new double[]{ 1, 2, 3 }, new double[]{ 2, 4, 6 })).isCloseTo(1.0, within(1e-12));
    }
}
