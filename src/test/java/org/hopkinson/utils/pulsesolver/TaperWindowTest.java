package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TaperWindowTest {

    @Test
    void zeroAlphaIsRectangular() {
        assertThat(new TaperWindow(0.0).generate(7)).containsOnly(1.0);
    }

    @Test
    void unitAlphaIsHann() {
        int n = 33;
        double[] w = new TaperWindow(1.0).generate(n);

        for (int i = 0; i < n; i++) {
            double hann = 0.5 * (1 - Math.cos(2 * Math.PI * i / (n - 1)));
            assertThat(w[i]).as("index %d", i).isCloseTo(hann, within(1e-12));
        }
    }

    @Test
    void windowIsSymmetricWithFlatTop() {
        double[] w = new TaperWindow(0.5).generate(101);

        for (int i = 0; i < w.length; i++) {
            assertThat(w[i]).isCloseTo(w[w.length - 1 - i], within(1e-12));
            assertThat(w[i]).isBetween(0.0, 1.0);
        }
        assertThat(w[0]).isCloseTo(0.0, within(1e-12));
        // плато занимает середину: (1 − α) доли длины
        for (int i = 26; i <= 74; i++) assertThat(w[i]).isEqualTo(1.0);
    }

    @Test
    void rampsAreMonotone() {
        double[] w = new TaperWindow(0.3).generate(200);

        for (int i = 1; i < 100; i++) assertThat(w[i]).isGreaterThanOrEqualTo(w[i - 1]);
        for (int i = 101; i < 200; i++) assertThat(w[i]).isLessThanOrEqualTo(w[i - 1]);
    }

    @Test
    void degenerateLengths() {
        assertThat(new TaperWindow(0.5).generate(1)).containsExactly(1.0);
        assertThatThrownBy(() -> new TaperWindow(0.5).generate(0))
                .isInstanceOf(AnalysisValidationException.class);
        assertThat(new TaperWindow(0.5).apply(new double[0])).isEmpty();
    }

    @Test
    void alphaOutsideUnitIntervalIsRejected() {
        assertThatThrownBy(() -> new TaperWindow(-0.1)).isInstanceOf(AnalysisValidationException.class);
        assertThatThrownBy(() -> new TaperWindow(1.5)).isInstanceOf(AnalysisValidationException.class);
        assertThatThrownBy(() -> new TaperWindow(Double.NaN)).isInstanceOf(AnalysisValidationException.class);
    }

    @Test
    void applyMultipliesElementwise() {
        TaperWindow taper = new TaperWindow(1.0);
        double[] segment = { 2, 2, 2, 2, 2 };

        assertThat(taper.apply(segment)).containsExactly(new double[]{ 0, 1, 2, 1, 0 }, within(1e-12));
    }

    @Test
    void comparisonKeepsRequestedOrder() {
        Map<Double, double[]> windows = TaperWindow.compareAlphas(64, List.of(0.5, 0.0, 1.0));

        assertThat(windows.keySet()).containsExactly(0.5, 0.0, 1.0);
        assertThat(windows.values()).allSatisfy(w -> assertThat(w).hasSize(64));
    }
}
