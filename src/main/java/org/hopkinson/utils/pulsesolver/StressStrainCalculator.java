package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;
import org.hopkinson.utils.dataonly.BarSetup;
import org.hopkinson.utils.dataonly.EquilibriumMetrics;
import org.hopkinson.utils.dataonly.EquilibriumMetrics.PhaseMetrics;
import org.hopkinson.utils.dataonly.GaugeParameters;
import org.hopkinson.utils.dataonly.PulseSet;
import org.hopkinson.utils.dataonly.StressStrainCurve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Расчёт кривых «напряжение — деформация» по теории упругих стержней и показателей равновесия.
 * <br>Единицы: мм, мс, ГПа на входе; МПа, Н и 1/с на выходе.</br>
 */
public class StressStrainCalculator {

    private static final Logger log = LoggerFactory.getLogger(StressStrainCalculator.class);

    /** ГПа → МПа. */
    private static final double GPA_TO_MPA = 1000.0;
    /** 1/мс → 1/с. */
    private static final double PER_MS_TO_PER_S = 1000.0;

    private static final double EPS = 1e-10;

    private final BarSetup bar;

    public StressStrainCalculator(BarSetup bar) {
        if (bar == null) {
            throw new AnalysisValidationException("Константы установки не заданы");
        }
        this.bar = bar;
    }

    public BarSetup bar() {
        return this.bar;
    }

    /* ================ КРИВЫЕ ================ */

    public StressStrainCurve calculate(PulseSet pulses, AnalysisMethod method) {
        return calculate(pulses.incident(), pulses.transmitted(), pulses.reflected(), pulses.time(), method);
    }

    /**
     * @param label {@code "1-wave"}, {@code "2-wave"} или {@code "3-wave"}
     * @throws AnalysisValidationException неизвестная метка или массивы разной длины
     */
    public StressStrainCurve calculate(double[] incident, double[] transmitted, double[] reflected,
                                       double[] time, String label) {
        return calculate(incident, transmitted, reflected, time, AnalysisMethod.fromLabel(label));
    }

    /**
     * Расчёт одного метода по импульсам в единицах датчика
     * (делятся на {@link BarSetup#strainScaleFactor()}).
     */
    public StressStrainCurve calculate(double[] incident, double[] transmitted, double[] reflected,
                                       double[] time, AnalysisMethod method) {
        AnalysisValidationException.requireSameLength(
                "incident, transmitted, reflected, time", incident, transmitted, reflected, time);
        double scale = this.bar.strainScaleFactor();
        return compute(divide(incident, scale), divide(transmitted, scale), divide(reflected, scale),
                time, method);
    }

    /**
     * Расчёт по напряжениям мостовой схемы: вольты переводятся мостом в единицы датчика,
     * дальше всё как в {@link #calculate(double[], double[], double[], double[], AnalysisMethod)}
     * (включая деление на {@link BarSetup#strainScaleFactor()}).
     * @param incidentGauge датчик входного стержня (падающий и отражённый)
     * @param transmittedGauge датчик выходного стержня
     */
    public StressStrainCurve calculateFromVoltage(double[] incident, double[] transmitted, double[] reflected,
                                                  double[] time, AnalysisMethod method,
                                                  GaugeParameters incidentGauge,
                                                  GaugeParameters transmittedGauge) {
        AnalysisValidationException.requireSameLength(
                "incident, transmitted, reflected, time", incident, transmitted, reflected, time);
        return calculate(voltageToStrain(incident, incidentGauge),
                voltageToStrain(transmitted, transmittedGauge),
                voltageToStrain(reflected, incidentGauge),
                time, method);
    }

    public Map<AnalysisMethod, StressStrainCurve> calculateAllMethods(PulseSet pulses) {
        return calculateAllMethods(pulses.incident(), pulses.transmitted(), pulses.reflected(), pulses.time());
    }

    public Map<AnalysisMethod, StressStrainCurve> calculateAllMethods(double[] incident, double[] transmitted,
                                                                      double[] reflected, double[] time) {
        Map<AnalysisMethod, StressStrainCurve> curves = new EnumMap<>(AnalysisMethod.class);
        for (AnalysisMethod method : AnalysisMethod.values()) {
            curves.put(method, calculate(incident, transmitted, reflected, time, method));
        }
        return curves;
    }

    /**
     * strain = V · R_g / (V_cal · GF · (R_g + R_cal))
     */
    public static double[] voltageToStrain(double[] voltage, GaugeParameters gauge) {
        if (gauge == null) {
            throw new AnalysisValidationException("Параметры тензодатчика не заданы");
        }
        double factor = gauge.strainPerVolt();
        double[] out = new double[voltage.length];
        for (int i = 0; i < out.length; i++) out[i] = voltage[i] * factor;
        return out;
    }

    private StressStrainCurve compute(double[] eI, double[] eT, double[] eR, double[] time,
                                      AnalysisMethod method) {
        if (method == null) {
            throw new AnalysisValidationException("Метод анализа не задан");
        }
        int n = time.length;
        double e = this.bar.barElasticModulus() * GPA_TO_MPA;

        double[] face = method.faceStrain(eI, eT, eR);
        double[] rate = method.strainRate(eI, eT, eR, this.bar.barWaveSpeed(), this.bar.specimenLength());
        double[] strain = SignalMath.cumulativeTrapezoid(rate, time);

        double[] stress = new double[n];
        double[] strainRate = new double[n];
        double[] trueStress = new double[n];
        double[] trueStrain = new double[n];
        double[] trueStrainRate = new double[n];
        double[] displacement = new double[n];
        double[] force = new double[n];

        // Истинные величины считаются по значениям со знаком, модуль берётся в самом конце
        for (int i = 0; i < n; i++) {
            double sigma = this.bar.areaRatio() * e * face[i];
            double eps = strain[i];

            stress[i] = Math.abs(sigma);
            strainRate[i] = Math.abs(rate[i]) * PER_MS_TO_PER_S;
            trueStrain[i] = Math.abs(Math.log1p(eps));
            trueStress[i] = Math.abs(sigma * (1.0 + eps));
            trueStrainRate[i] = Math.abs(rate[i] / (1.0 + eps)) * PER_MS_TO_PER_S;
            displacement[i] = Math.abs(this.bar.barWaveSpeed() * face[i]);
            force[i] = Math.abs(this.bar.barArea() * e * face[i]);
            strain[i] = Math.abs(eps);
        }

        log.debug("[i] {} curve: peak stress {} MPa, final strain {}", method,
                stress.length == 0 ? 0.0 : stress[SignalMath.argMax(stress)],
                n == 0 ? 0.0 : strain[n - 1]);
        return new StressStrainCurve(method, time.clone(), stress, strain, strainRate,
                trueStress, trueStrain, trueStrainRate, displacement, force);
    }

    private static double[] divide(double[] x, double scale) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) out[i] = x[i] / scale;
        return out;
    }

    /* ================ ПОКАЗАТЕЛИ РАВНОВЕСИЯ ================ */

    /**
     * Показатели по набору кривых: задний торец — 1-волновой, передний — 2-волновой анализ.
     */
    public EquilibriumMetrics calculateEquilibriumMetrics(Map<AnalysisMethod, StressStrainCurve> curves) {
        StressStrainCurve back = curves.get(AnalysisMethod.ONE_WAVE);
        StressStrainCurve front = curves.get(AnalysisMethod.TWO_WAVE);
        if (back == null || front == null) {
            throw new AnalysisValidationException(
                    "Для показателей равновесия нужны 1-wave и 2-wave кривые, есть: " + curves.keySet());
        }
        return calculateEquilibriumMetrics(back, front);
    }

    /**
     * Сравнение торцов образца.
     * <ul>
     *     <li>FBC = 1 − mean(|F_f − F_b| / max(F_f, F_b))
     *     <li>SEQI = exp(−RMSE / размах напряжения переднего торца)
     *     <li>SOI = СКО / среднее напряжения переднего торца выше 80% пика
     *     <li>DSUF = r² Пирсона между напряжениями торцов
     * </ul>
     * Учитываются только точки, где оба напряжения больше 1% пика переднего торца.
     * @param back кривая заднего торца (прошедший импульс)
     * @param front кривая переднего торца (падающий + отражённый)
     */
    public EquilibriumMetrics calculateEquilibriumMetrics(StressStrainCurve back, StressStrainCurve front) {
        double[] sb = back.stress();
        double[] sf = front.stress();
        double[] fb = back.barForce();
        double[] ff = front.barForce();
        AnalysisValidationException.requireSameLength("back stress, front stress", sb, sf);
        int n = sf.length;
        if (n == 0) return EquilibriumMetrics.undefined();

        int peakIdx = SignalMath.argMax(sf);
        double peak = sf[peakIdx];
        double cutoff = 0.01 * peak;

        boolean[] valid = new boolean[n];
        int validCount = 0;
        for (int i = 0; i < n; i++) {
            valid[i] = sf[i] > cutoff && sb[i] > cutoff;
            if (valid[i]) validCount++;
        }
        if (validCount == 0) {
            log.warn("[⚠] No points above 1% of peak stress, equilibrium metrics undefined");
            return EquilibriumMetrics.undefined();
        }

        IntPredicate all = i -> valid[i];
        double fbc = forceBalance(fb, ff, all);
        double dsuf = uniformity(sb, sf, all);

        double sq = 0.0, min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            if (!valid[i]) continue;
            double d = sf[i] - sb[i];
            sq += d * d;
            min = Math.min(min, sf[i]);
            max = Math.max(max, sf[i]);
        }
        double seqi = Math.exp(-Math.sqrt(sq / validCount) / (max - min + EPS));

        double[] high = select(sf, i -> valid[i] && sf[i] >= 0.8 * peak);
        double soi = Double.NaN;
        if (high.length > 2) {
            soi = SignalMath.populationStd(high, 0, high.length) / (mean(high) + EPS);
        }

        PhaseMetrics loading = phase(fb, ff, sb, sf, i -> valid[i] && sf[i] < 0.5 * peak);
        PhaseMetrics plateau = phase(fb, ff, sb, sf, i -> valid[i] && sf[i] >= 0.5 * peak);
        PhaseMetrics unloading = phase(fb, ff, sb, sf, i -> valid[i] && i > peakIdx);

        EquilibriumMetrics metrics = new EquilibriumMetrics(fbc, seqi, soi, dsuf, loading, plateau, unloading);
        log.info("[i] Equilibrium: FBC={}, SEQI={}, SOI={}, DSUF={}", fbc, seqi, soi, dsuf);
        return metrics;
    }

    private static PhaseMetrics phase(double[] fb, double[] ff, double[] sb, double[] sf, IntPredicate mask) {
        int count = 0;
        for (int i = 0; i < sf.length; i++) if (mask.test(i)) count++;
        if (count < 3) return PhaseMetrics.UNDEFINED;
        return new PhaseMetrics(forceBalance(fb, ff, mask), uniformity(sb, sf, mask));
    }

    private static double forceBalance(double[] fb, double[] ff, IntPredicate mask) {
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < ff.length; i++) {
            if (!mask.test(i)) continue;
            sum += Math.abs(ff[i] - fb[i]) / (Math.max(ff[i], fb[i]) + EPS);
            count++;
        }
        return count == 0 ? Double.NaN : 1.0 - sum / count;
    }

    private static double uniformity(double[] sb, double[] sf, IntPredicate mask) {
        double r = SignalMath.pearson(select(sb, mask), select(sf, mask));
        return r * r;
    }

    private static double[] select(double[] x, IntPredicate mask) {
        int count = 0;
        for (int i = 0; i < x.length; i++) if (mask.test(i)) count++;
        double[] out = new double[count];
        int k = 0;
        for (int i = 0; i < x.length; i++) if (mask.test(i)) out[k++] = x[i];
        return out;
    }

    private static double mean(double[] x) {
        double s = 0.0;
        for (double v : x) s += v;
        return s / x.length;
    }
}
