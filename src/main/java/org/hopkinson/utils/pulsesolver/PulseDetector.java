package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;
import org.hopkinson.utils.PulseDetectionException;
import org.hopkinson.utils.dataonly.AmplitudeMetric;
import org.hopkinson.utils.dataonly.DetectorSettings;
import org.hopkinson.utils.dataonly.Polarity;
import org.hopkinson.utils.dataonly.PulseWindow;
import org.hopkinson.utils.dataonly.SearchBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Детектор импульсов на основе согласованного фильтра.
 * <br>Сигнал коррелируется с шаблоном-полусинусом, уровень шума берётся с начала
 * корреляции (до прихода волны), и по каждому порогу {@code k·σ} собираются окна-кандидаты.</br>
 * <br>Экземпляр неизменяем, шаблон строится один раз в конструкторе.</br>
 */
public class PulseDetector {

    private static final Logger log = LoggerFactory.getLogger(PulseDetector.class);

    /** Доля начала корреляции, по которой оценивается шум. */
    private static final double NOISE_FRACTION = 0.1;

    public static final double DEFAULT_RISE_LOW = 0.10;
    public static final double DEFAULT_RISE_HIGH = 0.85;

    private final DetectorSettings settings;
    private final double[] template;

    public PulseDetector(DetectorSettings settings) {
        if (settings == null) {
            throw new AnalysisValidationException("Настройки детектора не заданы");
        }
        this.settings = settings;
        this.template = buildTemplate(settings.pulsePoints(), settings.polarity());
    }

    public DetectorSettings settings() {
        return this.settings;
    }

    double[] template() {
        return this.template.clone();
    }

    /* ================ ПОИСК ОКНА ================ */

    public PulseWindow findWindow(double[] signal, SearchBounds bounds, AmplitudeMetric metric)
            throws PulseDetectionException {
        return findWindow(signal, bounds, metric, CancellationToken.create());
    }

    /**
     * Поиск самого сильного окна импульса, удовлетворяющего границам.
     * @param signal сырой сигнал канала
     * @param bounds ограничения положения окна
     * @param metric мера амплитуды для выбора победителя
     * @param token отмена (проверяется между порогами)
     * @return окно {@code [start, end)} длиной не более {@code pulsePoints}
     * @throws PulseDetectionException ни одно окно не пережило пороги и фильтр границ
     */
    public PulseWindow findWindow(double[] signal, SearchBounds bounds, AmplitudeMetric metric,
                                  CancellationToken token) throws PulseDetectionException {
        if (signal == null || signal.length == 0) {
            throw new AnalysisValidationException("Пустой сигнал для поиска импульса");
        }
        SearchBounds effectiveBounds = (bounds == null) ? SearchBounds.NONE : bounds;
        AmplitudeMetric effectiveMetric = (metric == null) ? AmplitudeMetric.MEDIAN : metric;

        int n = signal.length;
        int p = this.settings.pulsePoints();

        double[] corr = SignalMath.crossCorrelateSame(signal, this.template);
        double sigma = SignalMath.populationStd(corr, 0, Math.max(1, (int) (n * NOISE_FRACTION)));

        // Кандидаты со всех порогов складываются в общий пул
        Set<PulseWindow> pool = new LinkedHashSet<>();
        for (double k : this.settings.kTrials()) {
            token.throwIfCancelled("Pulse detection");

            double threshold = k * sigma;
            List<Integer> peaks = suppressNeighbours(corr, localPeaks(corr, threshold),
                    this.settings.minSeparation());

            for (int peak : peaks) {
                int start = Math.max(0, peak - p / 2);
                int end = Math.min(n, peak + (p - p / 2));
                if (end > start) pool.add(new PulseWindow(start, end));
            }
            log.debug("[i] k={} threshold={} peaks={}", k, threshold, peaks);
        }

        PulseWindow best = null;
        double bestAmplitude = Double.NEGATIVE_INFINITY;
        for (PulseWindow candidate : pool) {
            if (!effectiveBounds.admits(candidate)) continue;

            double amplitude = effectiveMetric.measure(signal, candidate);
            if (amplitude > bestAmplitude) {
                bestAmplitude = amplitude;
                best = candidate;
            }
        }

        if (best == null) {
            throw new PulseDetectionException(String.format(
                    "No %s pulse window found: %d candidates, none inside bounds %s (k trials %s)",
                    this.settings.polarity(), pool.size(), effectiveBounds, this.settings.kTrials()));
        }
        log.debug("[✅] Pulse window {} selected ({}={})", best, effectiveMetric, bestAmplitude);
        return best;
    }

    /**
     * Пик каждого непрерывного участка корреляции выше порога.
     */
    static List<Integer> localPeaks(double[] corr, double threshold) {
        List<Integer> peaks = new ArrayList<>();
        int i = 0;
        while (i < corr.length) {
            if (corr[i] > threshold) {
                int best = i;
                while (i < corr.length && corr[i] > threshold) {
                    if (corr[i] > corr[best]) best = i;
                    i++;
                }
                peaks.add(best);
            } else {
                i++;
            }
        }
        return peaks;
    }

    /**
     * Подавление соседей: более сильный пик вытесняет всех ближе {@code minSeparation}.
     * @return выжившие пики по возрастанию индекса
     */
    static List<Integer> suppressNeighbours(double[] corr, List<Integer> peaks, int minSeparation) {
        List<Integer> byStrength = new ArrayList<>(peaks);
        byStrength.sort(Comparator.comparingDouble((Integer idx) -> corr[idx]).reversed());

        List<Integer> kept = new ArrayList<>();
        for (int candidate : byStrength) {
            boolean farEnough = true;
            for (int k : kept) {
                if (Math.abs(candidate - k) < minSeparation) { farEnough = false; break; }
            }
            if (farEnough) kept.add(candidate);
        }
        kept.sort(Comparator.naturalOrder());
        return kept;
    }

    /* ================ СЕГМЕНТАЦИЯ ================ */

    public double[] segmentAndCenter(double[] signal, PulseWindow window, int nPoints) {
        return segmentAndCenter(signal, window, nPoints, null, 0.01);
    }

    /**
     * Вырезка сегмента фиксированной длины вокруг окна, центровка по энергии и чистка шума.
     * <ol>
     *     <li>окно симметрично расширяется до {@code nPoints} (справа дополняется нулями)
     *     <li>циклический сдвиг ставит энергетический центр на {@code nPoints/2}
     *     <li>остаются только отсчёты {@code |x| >= threshRatio * max|x|} нужного знака
     * </ol>
     * @param polarity знак импульса ({@code null}: полярность детектора)
     */
    public double[] segmentAndCenter(double[] signal, PulseWindow window, int nPoints,
                                     Polarity polarity, double threshRatio) {
        if (nPoints < 1) {
            throw new AnalysisValidationException("nPoints должен быть >= 1: " + nPoints);
        }
        if (!window.fitsInto(signal.length)) {
            throw new AnalysisValidationException(
                    "Окно " + window + " выходит за сигнал длиной " + signal.length);
        }
        if (threshRatio < 0 || threshRatio >= 1) {
            throw new AnalysisValidationException("threshRatio вне [0, 1): " + threshRatio);
        }
        Polarity sign = (polarity == null) ? this.settings.polarity() : polarity;

        int halfPad = Math.max(0, (nPoints - window.length()) / 2);
        int start = Math.max(0, window.startIndex() - halfPad);
        double[] segment = SignalMath.slicePadded(signal, start, nPoints);

        double centroid = SignalMath.energyCentroid(segment);
        if (Double.isNaN(centroid)) return segment; // одни нули

        segment = SignalMath.roll(segment, nPoints / 2 - (int) Math.rint(centroid));

        double cutoff = threshRatio * SignalMath.maxAbs(segment);
        for (int i = 0; i < nPoints; i++) {
            double x = segment[i];
            if (Math.abs(x) < cutoff || !sign.agrees(x)) segment[i] = 0.0;
        }
        return segment;
    }

    /* ================ ВРЕМЯ НАРАСТАНИЯ ================ */

    public double calculateRiseTime(double[] pulse, double[] time) throws PulseDetectionException {
        return calculateRiseTime(pulse, time, DEFAULT_RISE_LOW, DEFAULT_RISE_HIGH);
    }

    /**
     * Время между первыми пересечениями {@code lowPct} и {@code highPct} доминирующего пика.
     * <br>Пик со знаком: берётся тот экстремум (минимум или максимум), который больше по модулю.</br>
     * @throws PulseDetectionException один из уровней так и не пересечён
     */
    public double calculateRiseTime(double[] pulse, double[] time, double lowPct, double highPct)
            throws PulseDetectionException {
        AnalysisValidationException.requireSameLength("pulse, time", pulse, time);
        if (!(lowPct > 0) || !(highPct > lowPct) || highPct > 1) {
            throw new AnalysisValidationException(
                    "Нужно 0 < lowPct < highPct <= 1, получено: " + lowPct + ", " + highPct);
        }
        if (pulse.length == 0) {
            throw new PulseDetectionException("Empty pulse: no rise to measure");
        }

        double min = pulse[SignalMath.argMin(pulse)];
        double max = pulse[SignalMath.argMax(pulse)];
        double peak = Math.abs(min) > Math.abs(max) ? min : max;
        if (peak == 0.0) {
            throw new PulseDetectionException("Flat pulse: rise time thresholds never crossed");
        }

        int lowIdx = firstCrossing(pulse, lowPct * peak, peak < 0);
        int highIdx = firstCrossing(pulse, highPct * peak, peak < 0);
        if (lowIdx < 0 || highIdx < 0) {
            throw new PulseDetectionException(String.format(
                    "Rise thresholds %.0f%%/%.0f%% of peak %s never crossed",
                    lowPct * 100, highPct * 100, peak));
        }
        return time[highIdx] - time[lowIdx];
    }

    private static int firstCrossing(double[] pulse, double level, boolean negative) {
        for (int i = 0; i < pulse.length; i++) {
            if (negative ? pulse[i] <= level : pulse[i] >= level) return i;
        }
        return -1;
    }

    /**
     * Полусинус длины {@code points} с единичной L2-нормой, знак по полярности.
     */
    static double[] buildTemplate(int points, Polarity polarity) {
        double[] t = new double[points];
        double norm = 0.0;
        for (int j = 0; j < points; j++) {
            t[j] = polarity.sign() * Math.sin(Math.PI * (j + 0.5) / points);
            norm += t[j] * t[j];
        }
        norm = Math.sqrt(norm);
        for (int j = 0; j < points; j++) t[j] /= norm;
        return t;
    }
}
