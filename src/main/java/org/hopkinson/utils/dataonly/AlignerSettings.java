package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Конфигурация выравнивателя импульсов.
 * @param barWaveSpeed скорость волны в стержне c (мм/мс)
 * @param specimenLength длина образца L (мм)
 * @param kLinear доля наибольшего наклона, задающая «линейный участок» (обычно 0.25–0.40)
 * @param criteria веса критериев равновесия
 * @param optimizer параметры глобальной оптимизации
 */
public record AlignerSettings(double barWaveSpeed,
                              double specimenLength,
                              double kLinear,
                              EquilibriumCriteria criteria,
                              OptimizerSettings optimizer) {

    public static final double DEFAULT_K_LINEAR = 0.35;

    public AlignerSettings {
        if (!(barWaveSpeed > 0) || !(specimenLength > 0)) {
            throw new AnalysisValidationException(String.format(
                    "c и L должны быть положительными: c=%s, L=%s", barWaveSpeed, specimenLength));
        }
        if (!(kLinear > 0) || kLinear > 1) {
            throw new AnalysisValidationException("kLinear вне (0, 1]: " + kLinear);
        }
        if (criteria == null || optimizer == null) {
            throw new AnalysisValidationException("Не заданы веса критериев или параметры оптимизатора");
        }
    }

    public static AlignerSettings of(double barWaveSpeed, double specimenLength) {
        return new AlignerSettings(barWaveSpeed, specimenLength, DEFAULT_K_LINEAR,
                EquilibriumCriteria.DEFAULT, OptimizerSettings.DEFAULT);
    }
}
