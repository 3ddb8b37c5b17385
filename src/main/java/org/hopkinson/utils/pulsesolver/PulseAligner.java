package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;
import org.hopkinson.utils.dataonly.AlignerSettings;
import org.hopkinson.utils.dataonly.AlignmentResult;
import org.hopkinson.utils.dataonly.EquilibriumCriteria;
import org.hopkinson.utils.dataonly.PulseSet;
import org.hopkinson.utils.dataonly.ShiftBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Выравнивание прошедшего и отражённого импульсов относительно падающего.
 * <br>Ищутся целые сдвиги {@code (shiftT, shiftR)}, при которых выполняется равновесие:
 * согласие 1-, 2- и 3-волнового анализа на участке линейного нагружения падающего импульса.</br>
 * <br>Поиск глобальный (дифференциальная эволюция), затем доводка по соседним целым сдвигам.</br>
 */
public class PulseAligner {

    private static final Logger log = LoggerFactory.getLogger(PulseAligner.class);

    private final AlignerSettings settings;

    public PulseAligner(AlignerSettings settings) {
        if (settings == null) {
            throw new AnalysisValidationException("Настройки выравнивателя не заданы");
        }
        this.settings = settings;

        EquilibriumCriteria w = settings.criteria();
        if (!w.isNormalized()) {
            log.warn("[⚠] Equilibrium weights sum to {} instead of 1.0 (corr={}, u={}, sr={}, e={})",
                    w.sum(), w.corr(), w.u(), w.sr(), w.e());
        }
    }

    public AlignerSettings settings() {
        return this.settings;
    }

    /**
     * Участок линейного нагружения (включительно).
     */
    public record LinearRegion(int start, int end) {
        public int size() {
            return this.end - this.start + 1;
        }
    }

    /* ================ ВЫРАВНИВАНИЕ ================ */

    public AlignmentResult align(PulseSet pulses) {
        return align(pulses, null, null, CancellationToken.create());
    }

    public AlignmentResult align(PulseSet pulses, ShiftBounds boundsT, ShiftBounds boundsR,
                                 CancellationToken token) {
        return align(pulses.incident(), pulses.transmitted(), pulses.reflected(), pulses.time(),
                boundsT, boundsR, token);
    }

    /**
     * Поиск сдвигов, максимизирующих взвешенную пригодность равновесия.
     * @param boundsT границы сдвига прошедшего ({@code null}: ±N/2)
     * @param boundsR границы сдвига отражённого ({@code null}: ±N/2)
     * @return падающий без изменений, два сдвинутых сегмента и сами сдвиги
     * @throws AnalysisValidationException массивы разной длины
     * @throws java.util.concurrent.CancellationException отмена или истёк дедлайн
     */
    public AlignmentResult align(double[] incident, double[] transmitted, double[] reflected,
                                 double[] time, ShiftBounds boundsT, ShiftBounds boundsR,
                                 CancellationToken token) {
        AnalysisValidationException.requireSameLength(
                "incident, transmitted, reflected, time", incident, transmitted, reflected, time);
        int n = incident.length;
        if (n < 2) {
            throw new AnalysisValidationException("Для выравнивания нужно хотя бы 2 отсчёта: " + n);
        }
        double dt = time[1] - time[0];
        if (!(dt > 0)) {
            throw new AnalysisValidationException("Временная ось должна возрастать: dt=" + dt);
        }
        ShiftBounds bt = (boundsT == null) ? ShiftBounds.symmetric(n) : boundsT;
        ShiftBounds br = (boundsR == null) ? ShiftBounds.symmetric(n) : boundsR;

        LinearRegion region = linearRegion(incident, this.settings.kLinear());
        Fitness fitness = new Fitness(incident, transmitted, reflected, time, region, this.settings);
        log.debug("[i] Linear region {}..{} ({} points)", region.start(), region.end(), region.size());

        DifferentialEvolution optimizer = new DifferentialEvolution(this.settings.optimizer());
        double[] zero = { 0.0, 0.0 };
        DifferentialEvolution.Result found = optimizer.minimize(
                x -> fitness.objective(bt.clamp(Math.round(x[0])), br.clamp(Math.round(x[1]))),
                new double[]{ bt.min(), br.min() },
                new double[]{ bt.max(), br.max() },
                (bt.contains(0) && br.contains(0)) ? zero : null,
                token);

        int shiftT = bt.clamp(Math.round(found.point()[0]));
        int shiftR = br.clamp(Math.round(found.point()[1]));
        double objective = fitness.objective(shiftT, shiftR);

        if (this.settings.optimizer().polish()) {
            int[] polished = polish(fitness, shiftT, shiftR, objective, bt, br, token);
            shiftT = polished[0];
            shiftR = polished[1];
            objective = fitness.objective(shiftT, shiftR);
        }

        AlignmentResult result = new AlignmentResult(
                new PulseSet(incident, SignalMath.shift(transmitted, shiftT),
                        SignalMath.shift(reflected, shiftR), dt),
                shiftT, shiftR, -objective);

        if (result.isDegenerate()) {
            log.warn("[⚠] Alignment fitness is degenerate everywhere, shifts ({}, {}) kept", shiftT, shiftR);
        } else {
            log.info("[✅] Aligned: shiftT={}, shiftR={}, fitness={} ({} generations, converged={})",
                    shiftT, shiftR, result.fitness(), found.generations(), found.converged());
        }
        return result;
    }

    /**
     * Жадный спуск по восьми соседним целым сдвигам, пока есть строгое улучшение.
     */
    private static int[] polish(Fitness fitness, int shiftT, int shiftR, double objective,
                                ShiftBounds bt, ShiftBounds br, CancellationToken token) {
        int t = shiftT, r = shiftR;
        double best = objective;
        boolean improved = true;
        while (improved) {
            token.throwIfCancelled("Alignment polish");
            improved = false;
            int bestT = t, bestR = r;
            for (int dtShift = -1; dtShift <= 1; dtShift++) {
                for (int drShift = -1; drShift <= 1; drShift++) {
                    int ct = t + dtShift, cr = r + drShift;
                    if ((dtShift == 0 && drShift == 0) || !bt.contains(ct) || !br.contains(cr)) continue;

                    double value = fitness.objective(ct, cr);
                    if (value < best) {
                        best = value;
                        bestT = ct;
                        bestR = cr;
                        improved = true;
                    }
                }
            }
            t = bestT;
            r = bestR;
        }
        return new int[]{ t, r };
    }

    /**
     * Пригодность для заданных сдвигов (без оптимизации), та же, что максимизирует {@link #align}.
     */
    public double fitness(double[] incident, double[] transmitted, double[] reflected, double[] time,
                          int shiftT, int shiftR) {
        AnalysisValidationException.requireSameLength(
                "incident, transmitted, reflected, time", incident, transmitted, reflected, time);
        LinearRegion region = linearRegion(incident, this.settings.kLinear());
        return -new Fitness(incident, transmitted, reflected, time, region, this.settings)
                .objective(shiftT, shiftR);
    }

    /* ================ УЧАСТОК ЛИНЕЙНОГО НАГРУЖЕНИЯ ================ */

    /**
     * От самого крутого спада градиента идём назад и вперёд до точек,
     * где градиент вернулся к {@code kLinear · min(gradient)}.
     */
    public static LinearRegion linearRegion(double[] incident, double kLinear) {
        double[] grad = SignalMath.gradient(incident);
        int minIdx = SignalMath.argMin(grad);
        double target = kLinear * grad[minIdx];

        int start = 0;
        for (int j = minIdx - 1; j >= 0; j--) {
            if (grad[j] >= target) { start = j; break; }
        }
        int end = grad.length - 1;
        for (int j = minIdx; j < grad.length; j++) {
            if (grad[j] >= target) { end = j; break; }
        }
        return new LinearRegion(start, Math.max(start, end));
    }

    /**
     * Целевая функция на фиксированных сегментах.
     * <br>Сдвинутые массивы не строятся: значение берётся по индексу {@code i − shift}.</br>
     * <br>Чистая функция, поэтому её можно вызывать из параллельного потока.</br>
     */
    private static final class Fitness {

        private final double[] incident;
        private final double[] transmitted;
        private final double[] reflected;
        private final double[] time;
        private final LinearRegion region;
        private final double c;
        private final double cOverL;
        private final EquilibriumCriteria w;

        Fitness(double[] incident, double[] transmitted, double[] reflected, double[] time,
                LinearRegion region, AlignerSettings settings) {
            this.incident = incident;
            this.transmitted = transmitted;
            this.reflected = reflected;
            this.time = time;
            this.region = region;
            this.c = settings.barWaveSpeed();
            this.cOverL = settings.barWaveSpeed() / settings.specimenLength();
            this.w = settings.criteria();
        }

        /**
         * Минимизируемое значение: минус взвешенная пригодность либо штраф.
         */
        double objective(int shiftT, int shiftR) {
            int from = this.region.start();
            int to = this.region.end();
            int size = this.region.size();

            double[] inc = new double[size];
            double[] diff = new double[size];
            double sqU = 0.0, sqSr = 0.0;
            for (int i = from; i <= to; i++) {
                double iv = this.incident[i];
                double tv = at(this.transmitted, i - shiftT);
                double rv = at(this.reflected, i - shiftR);

                inc[i - from] = iv;
                diff[i - from] = tv - rv;

                double du = this.c * tv - this.c * (iv + rv);
                sqU += du * du;

                double dsr = rate1(rv) - rate3(iv, tv, rv);
                sqSr += dsr * dsr;
            }

            double total = 0.0;
            if (this.w.corr() > 0) total += this.w.corr() * SignalMath.pearson(inc, diff);
            if (this.w.u() > 0) total += this.w.u() / (1.0 + Math.sqrt(sqU / size));
            if (this.w.sr() > 0) total += this.w.sr() / (1.0 + Math.sqrt(sqSr / size));
            if (this.w.e() > 0) total += this.w.e() / (1.0 + strainRmse(shiftT, shiftR));

            return Double.isFinite(total) ? -total : AlignmentResult.DEGENERATE_PENALTY;
        }

        // RMSE накопленных деформаций 1- и 3-волнового анализа, интеграл от нуля до конца участка
        private double strainRmse(int shiftT, int shiftR) {
            int to = this.region.end();
            double strain1 = 0.0, strain3 = 0.0;
            double prev1 = 0.0, prev3 = 0.0;
            double sq = 0.0;
            for (int i = 0; i <= to; i++) {
                double iv = this.incident[i];
                double tv = at(this.transmitted, i - shiftT);
                double rv = at(this.reflected, i - shiftR);
                double r1 = rate1(rv);
                double r3 = rate3(iv, tv, rv);
                if (i > 0) {
                    double h = this.time[i] - this.time[i - 1];
                    strain1 += 0.5 * (r1 + prev1) * h;
                    strain3 += 0.5 * (r3 + prev3) * h;
                }
                prev1 = r1;
                prev3 = r3;

                if (i >= this.region.start()) {
                    double d = strain1 - strain3;
                    sq += d * d;
                }
            }
            return Math.sqrt(sq / this.region.size());
        }

        private double rate1(double rv) {
            return -2.0 * this.cOverL * rv;
        }

        private double rate3(double iv, double tv, double rv) {
            return this.cOverL * (iv - rv - tv);
        }

        private static double at(double[] x, int idx) {
            return (idx >= 0 && idx < x.length) ? x[idx] : 0.0;
        }
    }
}
