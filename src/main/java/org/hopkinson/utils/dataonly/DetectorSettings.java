package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

import java.util.List;

/**
 * Неизменяемая конфигурация детектора импульсов.
 * @param pulsePoints номинальная длина импульса в отсчётах (длина шаблона)
 * @param kTrials пороги в единицах σ шума, от строгого к мягкому
 * @param polarity знак фронта искомого импульса
 * @param minSeparation минимальное расстояние между пиками (отсчёты)
 */
public record DetectorSettings(int pulsePoints,
                               List<Double> kTrials,
                               Polarity polarity,
                               int minSeparation) {

    public static final List<Double> DEFAULT_K_TRIALS = List.of(6.0, 4.0, 2.0);

    public DetectorSettings {
        if (pulsePoints < 2) {
            throw new AnalysisValidationException("pulsePoints должен быть >= 2: " + pulsePoints);
        }
        if (kTrials == null || kTrials.isEmpty()) {
            throw new AnalysisValidationException("Список порогов kTrials пуст");
        }
        for (Double k : kTrials) {
            if (k == null || !Double.isFinite(k) || k < 0) {
                throw new AnalysisValidationException("Некорректный порог в kTrials: " + k);
            }
        }
        if (polarity == null) {
            throw new AnalysisValidationException("Полярность детектора не задана");
        }
        if (minSeparation < 1) {
            throw new AnalysisValidationException("minSeparation должен быть >= 1: " + minSeparation);
        }
        kTrials = List.copyOf(kTrials);
    }

    public static DetectorSettings of(int pulsePoints) {
        return of(pulsePoints, Polarity.COMPRESSIVE);
    }

    public static DetectorSettings of(int pulsePoints, Polarity polarity) {
        return of(pulsePoints, DEFAULT_K_TRIALS, polarity);
    }

    /**
     * Минимальное расстояние между пиками по умолчанию — 0.8 длины импульса.
     */
    public static DetectorSettings of(int pulsePoints, List<Double> kTrials, Polarity polarity) {
        return new DetectorSettings(pulsePoints, kTrials, polarity,
                Math.max(1, (int) (0.8 * pulsePoints)));
    }
}
