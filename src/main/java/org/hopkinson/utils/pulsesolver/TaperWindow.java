package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Косинусное окно Тьюки (симметричное).
 * <br>α = 0 — прямоугольное окно, α = 1 — окно Ханна; между ними плоская вершина
 * с косинусными скатами, занимающими долю α длины.</br>
 */
public class TaperWindow {

    private final double alpha;

    public TaperWindow(double alpha) {
        if (!(alpha >= 0 && alpha <= 1)) {
            throw new AnalysisValidationException("alpha вне [0, 1]: " + alpha);
        }
        this.alpha = alpha;
    }

    public double alpha() {
        return this.alpha;
    }

    /**
     * @param length длина окна (не меньше 1)
     */
    public double[] generate(int length) {
        if (length < 1) {
            throw new AnalysisValidationException("Длина окна должна быть >= 1: " + length);
        }
        double[] w = new double[length];
        if (length == 1 || this.alpha == 0.0) {
            Arrays.fill(w, 1.0);
            return w;
        }

        double span = this.alpha * (length - 1);
        int width = (int) Math.floor(span / 2.0);
        for (int n = 0; n < length; n++) {
            if (n <= width) {
                w[n] = 0.5 * (1 + Math.cos(Math.PI * (-1 + 2.0 * n / span)));
            } else if (n >= length - width - 1) {
                w[n] = 0.5 * (1 + Math.cos(Math.PI * (-2.0 / this.alpha + 1 + 2.0 * n / span)));
            } else {
                w[n] = 1.0;
            }
        }
        return w;
    }

    /**
     * Поэлементное умножение сегмента на окно той же длины.
     */
    public double[] apply(double[] segment) {
        if (segment.length == 0) return new double[0];
        double[] w = generate(segment.length);
        double[] out = new double[segment.length];
        for (int i = 0; i < out.length; i++) out[i] = segment[i] * w[i];
        return out;
    }

    /**
     * Окна одной длины для нескольких α (для сравнения на одном графике).
     * @return α → окно, в порядке переданного списка
     */
    public static Map<Double, double[]> compareAlphas(int length, List<Double> alphas) {
        Map<Double, double[]> out = new LinkedHashMap<>();
        for (Double a : alphas) out.put(a, new TaperWindow(a).generate(length));
        return out;
    }
}
