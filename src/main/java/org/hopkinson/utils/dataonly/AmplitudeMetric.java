package org.hopkinson.utils.dataonly;

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Мера амплитуды внутри окна, по которой выбирается лучшее окно-кандидат.
 */
public enum AmplitudeMetric {

    /** Медиана модуля — устойчива к одиночным выбросам. */
    MEDIAN {
        @Override public double measure(double[] signal, PulseWindow window) {
            return new Median().evaluate(absolute(signal, window));
        }
    },

    /** Максимум модуля. */
    PEAK {
        @Override public double measure(double[] signal, PulseWindow window) {
            double max = 0.0;
            for (double v : absolute(signal, window)) max = Math.max(max, v);
            return max;
        }
    };

    public abstract double measure(double[] signal, PulseWindow window);

    private static double[] absolute(double[] signal, PulseWindow window) {
        double[] out = new double[window.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.abs(signal[window.startIndex() + i]);
        }
        return out;
    }
}
