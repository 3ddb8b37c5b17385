package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Веса четырёх критериев равновесия при выравнивании.
 * @param corr корреляция падающего и (прошедший − отражённый)
 * @param u равновесие перемещений торцов стержней
 * @param sr равновесие скоростей деформации (1-волновая против 3-волновой)
 * @param e равновесие деформаций
 */
public record EquilibriumCriteria(double corr, double u, double sr, double e) {

    public static final EquilibriumCriteria DEFAULT = new EquilibriumCriteria(0.3, 0.3, 0.3, 0.1);

    private static final double SUM_TOLERANCE = 0.01;

    public EquilibriumCriteria {
        if (corr < 0 || u < 0 || sr < 0 || e < 0
                || !Double.isFinite(corr + u + sr + e)) {
            throw new AnalysisValidationException(String.format(
                    "Веса критериев должны быть неотрицательными: corr=%s, u=%s, sr=%s, e=%s",
                    corr, u, sr, e));
        }
    }

    public double sum() {
        return this.corr + this.u + this.sr + this.e;
    }

    /**
     * Мягкий инвариант: сумма весов ≈ 1 (нарушение — лишь предупреждение).
     */
    public boolean isNormalized() {
        return Math.abs(sum() - 1.0) <= SUM_TOLERANCE;
    }
}
