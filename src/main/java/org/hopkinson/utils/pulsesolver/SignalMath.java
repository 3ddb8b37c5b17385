package org.hopkinson.utils.pulsesolver;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import static org.hopkinson.utils.pulsesolver.SignalMath.FFTUtils.*;

/**
 * Общие численные помощники всех решателей:
 * быстрое преобразование Фурье, корреляция, градиент, интегрирование, сдвиги.
 */
public final class SignalMath {

    // Запретка на создание экземпляра класса, потому что утилиты:
    private SignalMath() {}

    /**
     * Минимальная реализация комплексного числа {@code z = a + bi} для БПФ.
     */
    public record ComplexNumber(double re, double im) {

        public ComplexNumber add(ComplexNumber o) { return new ComplexNumber(re + o.re, im + o.im); }

        public ComplexNumber sub(ComplexNumber o) { return new ComplexNumber(re - o.re, im - o.im); }

        public ComplexNumber mul(ComplexNumber o) {
            return new ComplexNumber(re * o.re - im * o.im, re * o.im + im * o.re);
        }

        public ComplexNumber conj() { return new ComplexNumber(re, -im); }

        public ComplexNumber scale(double s) { return new ComplexNumber(re * s, im * s); }
    }

    /**
     * БПФ работает только с длиной, равной степени двойки.
     * @param v длина сигнала
     * @return ближайшая степень двойки, не меньшая {@code v}
     */
    static int nextPow2(int v) {
        int n = 1; while (n < v) n <<= 1; return n;
    }

    /**
     * Сборник методов быстрого преобразования Фурье.
     */
    static final class FFTUtils {
        private FFTUtils() {}

        /**
         * Алгоритм Кули-Тьюки: O(N log N) вместо O(N^2).
         * @param x входной сигнал в комплексном представлении (длина — степень двойки)
         */
        static ComplexNumber[] fft(ComplexNumber[] x) {
            int n = x.length;
            if (n == 1) return new ComplexNumber[]{ x[0] };

            if ((n & (n - 1)) != 0) throw new IllegalArgumentException("N must be power of two");

            // Делим на чётную и нечётную половины
            ComplexNumber[] even = new ComplexNumber[n / 2];
            ComplexNumber[] odd = new ComplexNumber[n / 2];
            for (int i = 0; i < n / 2; i++) { even[i] = x[2 * i]; odd[i] = x[2 * i + 1]; }

            ComplexNumber[] fe = fft(even);
            ComplexNumber[] fo = fft(odd);

            ComplexNumber[] out = new ComplexNumber[n];
            for (int k = 0; k < n / 2; k++) {
                // Поворотный множитель на единичной окружности
                double ang = -2.0 * Math.PI * k / n;
                ComplexNumber wk = new ComplexNumber(Math.cos(ang), Math.sin(ang));

                ComplexNumber t = wk.mul(fo[k]);
                out[k] = fe[k].add(t);
                out[k + n / 2] = fe[k].sub(t);
            }
            return out;
        }

        /**
         * Обратное преобразование через сопряжение: ifft(X) = conj(fft(conj(X))) / N.
         */
        static ComplexNumber[] ifft(ComplexNumber[] spectrum) {
            int n = spectrum.length;

            ComplexNumber[] conjX = new ComplexNumber[n];
            for (int i = 0; i < n; i++) conjX[i] = spectrum[i].conj();

            ComplexNumber[] fy = fft(conjX);

            ComplexNumber[] out = new ComplexNumber[n];
            for (int i = 0; i < n; i++) out[i] = fy[i].conj().scale(1.0 / n);
            return out;
        }

        /**
         * Перевод в комплексные числа с дополнением нулями до длины {@code n}.
         */
        static ComplexNumber[] toComplexPadded(double[] x, int n) {
            ComplexNumber[] out = new ComplexNumber[n];
            for (int i = 0; i < n; i++) out[i] = new ComplexNumber(i < x.length ? x[i] : 0.0, 0.0);
            return out;
        }
    }

    /**
     * Полная линейная свёртка через БПФ (теорема о свёртке: conv = IFFT(FFT(a) * FFT(b))).
     * @return массив длины {@code a.length + b.length - 1}
     */
    public static double[] convolve(double[] a, double[] b) {
        int convLen = a.length + b.length - 1;
        int n = nextPow2(convLen);

        ComplexNumber[] fa = fft(toComplexPadded(a, n));
        ComplexNumber[] fb = fft(toComplexPadded(b, n));

        ComplexNumber[] product = new ComplexNumber[n];
        for (int i = 0; i < n; i++) product[i] = fa[i].mul(fb[i]);
        ComplexNumber[] back = ifft(product);

        double[] out = new double[convLen];
        for (int i = 0; i < convLen; i++) out[i] = back[i].re(); // только действительная часть
        return out;
    }

    /**
     * Согласованная фильтрация: свёртка сигнала с развёрнутым во времени шаблоном,
     * обрезанная до длины сигнала по центру (режим «same»).
     * <br>Отсчёт {@code i} результата — корреляция с шаблоном, центр которого стоит на {@code i}.</br>
     */
    public static double[] crossCorrelateSame(double[] signal, double[] template) {
        double[] reversed = new double[template.length];
        for (int i = 0; i < template.length; i++) reversed[i] = template[template.length - 1 - i];

        double[] full = convolve(signal, reversed);
        int start = (template.length - 1) / 2;

        double[] out = new double[signal.length];
        System.arraycopy(full, start, out, 0, signal.length);
        return out;
    }

    /**
     * Дискретный градиент: центральные разности внутри, односторонние на краях.
     */
    public static double[] gradient(double[] x) {
        int n = x.length;
        double[] g = new double[n];
        if (n < 2) return g;

        g[0] = x[1] - x[0];
        g[n - 1] = x[n - 1] - x[n - 2];
        for (int i = 1; i < n - 1; i++) g[i] = (x[i + 1] - x[i - 1]) / 2.0;
        return g;
    }

    /**
     * Накопленный интеграл методом трапеций, первый элемент — ноль.
     * @param y подынтегральные значения
     * @param t узлы по времени (та же длина)
     */
    public static double[] cumulativeTrapezoid(double[] y, double[] t) {
        return cumulativeTrapezoid(y, t, y.length);
    }

    /**
     * То же, но только для первых {@code count} узлов (остальное не нужно вызывающему).
     */
    static double[] cumulativeTrapezoid(double[] y, double[] t, int count) {
        double[] out = new double[count];
        for (int i = 1; i < count; i++) {
            out[i] = out[i - 1] + 0.5 * (y[i] + y[i - 1]) * (t[i] - t[i - 1]);
        }
        return out;
    }

    /**
     * Сдвиг с дополнением нулями (без заворота): «+»: вперёд по времени,
     * результат обрезается до исходной длины.
     */
    public static double[] shift(double[] x, int s) {
        int n = x.length;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            int src = i - s;
            if (src >= 0 && src < n) out[i] = x[src];
        }
        return out;
    }

    /**
     * Циклический сдвиг (заворот за край), «+»: вправо.
     */
    public static double[] roll(double[] x, int s) {
        int n = x.length;
        double[] out = new double[n];
        if (n == 0) return out;

        int k = ((s % n) + n) % n;
        for (int i = 0; i < n; i++) out[(i + k) % n] = x[i];
        return out;
    }

    /**
     * Энергетический центр тяжести: {@code Σ(i·x²) / Σ(x²)}.
     * @return {@code NaN}, если энергия нулевая
     */
    public static double energyCentroid(double[] x) {
        double weighted = 0.0, energy = 0.0;
        for (int i = 0; i < x.length; i++) {
            double e = x[i] * x[i];
            weighted += i * e;
            energy += e;
        }
        return energy > 0 ? weighted / energy : Double.NaN;
    }

    /**
     * Стандартное отклонение генеральной совокупности (без поправки Бесселя).
     */
    public static double populationStd(double[] x, int from, int length) {
        if (length <= 0) return 0.0;
        return new StandardDeviation(false).evaluate(x, from, length);
    }

    /**
     * Коэффициент корреляции Пирсона.
     * @return {@code NaN} при нулевой дисперсии или менее чем двух точках
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length < 2 || x.length != y.length) return Double.NaN;
        return new PearsonsCorrelation().correlation(x, y);
    }

    public static int argMin(double[] x) {
        int best = 0;
        for (int i = 1; i < x.length; i++) if (x[i] < x[best]) best = i;
        return best;
    }

    public static int argMax(double[] x) {
        int best = 0;
        for (int i = 1; i < x.length; i++) if (x[i] > x[best]) best = i;
        return best;
    }

    public static double maxAbs(double[] x) {
        double m = 0.0;
        for (double v : x) m = Math.max(m, Math.abs(v));
        return m;
    }

    /**
     * Безопасная вырезка с дополнением нулями справа, если сигнал кончился.
     * @param x исходный массив
     * @param startIndex индекс начала (неотрицательный)
     * @param length желаемая длина результата
     */
    public static double[] slicePadded(double[] x, int startIndex, int length) {
        double[] out = new double[length];
        int available = Math.max(0, Math.min(length, x.length - startIndex));
        if (available > 0) System.arraycopy(x, startIndex, out, 0, available);
        return out;
    }
}
