package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Параметры дифференциальной эволюции.
 * @param populationMultiplier размер популяции на одно измерение
 * @param maxGenerations максимум поколений
 * @param tolerance относительный допуск сходимости по разбросу энергий популяции
 * @param mutationMin нижняя граница коэффициента мутации (дизеринг)
 * @param mutationMax верхняя граница коэффициента мутации
 * @param recombination вероятность скрещивания
 * @param seed зерно генератора (фиксирует результат)
 * @param parallel оценивать поколение параллельно
 * @param polish доводка лучшего решения перебором соседних целых сдвигов
 */
public record OptimizerSettings(int populationMultiplier,
                                int maxGenerations,
                                double tolerance,
                                double mutationMin,
                                double mutationMax,
                                double recombination,
                                long seed,
                                boolean parallel,
                                boolean polish) {

    public static final OptimizerSettings DEFAULT =
            new OptimizerSettings(50, 250, 5e-5, 0.5, 1.0, 0.7, 42L, false, true);

    public OptimizerSettings {
        if (populationMultiplier < 1 || maxGenerations < 1) {
            throw new AnalysisValidationException(String.format(
                    "Размер популяции и число поколений должны быть >= 1: %d, %d",
                    populationMultiplier, maxGenerations));
        }
        if (tolerance < 0 || mutationMin < 0 || mutationMax < mutationMin || mutationMax > 2.0) {
            throw new AnalysisValidationException(String.format(
                    "Некорректные параметры мутации/допуска: tol=%s, F=(%s, %s)",
                    tolerance, mutationMin, mutationMax));
        }
        if (recombination < 0 || recombination > 1) {
            throw new AnalysisValidationException(
                    "Вероятность скрещивания вне [0, 1]: " + recombination);
        }
    }

    public OptimizerSettings withSeed(long newSeed) {
        return new OptimizerSettings(populationMultiplier, maxGenerations, tolerance,
                mutationMin, mutationMax, recombination, newSeed, parallel, polish);
    }

    public OptimizerSettings withParallel(boolean newParallel) {
        return new OptimizerSettings(populationMultiplier, maxGenerations, tolerance,
                mutationMin, mutationMax, recombination, seed, newParallel, polish);
    }
}
