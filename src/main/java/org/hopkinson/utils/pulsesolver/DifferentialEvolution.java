package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;
import org.hopkinson.utils.dataonly.OptimizerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Random;
import java.util.function.ToDoubleFunction;
import java.util.stream.IntStream;

/**
 * Глобальный минимизатор «дифференциальная эволюция», стратегия best/2/bin.
 * <ul>
 *     <li>мутант: {@code best + F·(x_r0 + x_r1 − x_r2 − x_r3)}, F случайный на каждое поколение
 *     <li>биномиальное скрещивание с вероятностью CR (одна координата берётся от мутанта всегда)
 *     <li>выход за границы — координата перевыбрасывается равномерно внутри границ
 *     <li>останов: СКО энергий популяции {@code <= tol·|среднее|} или исчерпан лимит поколений
 * </ul>
 * Пробные векторы поколения строятся заранее, поэтому параллельная оценка
 * даёт тот же результат, что и последовательная, при одинаковом зерне.
 */
public class DifferentialEvolution {

    private static final Logger log = LoggerFactory.getLogger(DifferentialEvolution.class);

    /**
     * Итог минимизации.
     * @param point лучшая точка
     * @param value значение целевой функции в ней
     * @param generations сколько поколений прошло
     * @param evaluations сколько раз вызвана целевая функция
     * @param converged сработал ли критерий сходимости
     */
    public record Result(double[] point, double value, int generations, int evaluations, boolean converged) {}

    private final OptimizerSettings settings;

    public DifferentialEvolution(OptimizerSettings settings) {
        this.settings = settings;
    }

    /**
     * @param objective минимизируемая функция (обязана быть чистой, если включён параллелизм)
     * @param lower нижние границы по координатам
     * @param upper верхние границы по координатам
     * @param initialGuess точка, которая станет первым членом популяции ({@code null}: нет)
     * @param token отмена (проверяется между поколениями)
     */
    public Result minimize(ToDoubleFunction<double[]> objective,
                           double[] lower, double[] upper,
                           double[] initialGuess,
                           CancellationToken token) {
        if (lower.length != upper.length || lower.length == 0) {
            throw new AnalysisValidationException("Границы оптимизации заданы некорректно");
        }
        int dim = lower.length;
        int popSize = Math.max(5, this.settings.populationMultiplier() * dim);
        Random rnd = new Random(this.settings.seed());

        double[][] population = latinHypercube(popSize, lower, upper, rnd);
        if (initialGuess != null && inside(initialGuess, lower, upper)) {
            population[0] = initialGuess.clone();
        }

        double[] energies = evaluate(objective, population);
        int evaluations = popSize;

        int bestIdx = 0;
        for (int i = 1; i < popSize; i++) if (energies[i] < energies[bestIdx]) bestIdx = i;
        double[] best = population[bestIdx].clone();
        double bestEnergy = energies[bestIdx];

        boolean converged = false;
        int generation = 0;
        while (generation < this.settings.maxGenerations()) {
            token.throwIfCancelled("Differential evolution");
            generation++;

            double f = this.settings.mutationMin()
                    + rnd.nextDouble() * (this.settings.mutationMax() - this.settings.mutationMin());

            double[][] trials = new double[popSize][];
            for (int i = 0; i < popSize; i++) {
                trials[i] = makeTrial(population, i, best, f, lower, upper, rnd);
            }
            double[] trialEnergies = evaluate(objective, trials);
            evaluations += popSize;

            for (int i = 0; i < popSize; i++) {
                if (trialEnergies[i] < energies[i]) {
                    population[i] = trials[i];
                    energies[i] = trialEnergies[i];
                    if (trialEnergies[i] < bestEnergy) { // ничья оставляет прежнего лидера
                        bestEnergy = trialEnergies[i];
                        best = trials[i].clone();
                    }
                }
            }

            if (generation % 50 == 0) {
                log.debug("[i] Generation {}: best={} at {}", generation, bestEnergy, Arrays.toString(best));
            }
            if (hasConverged(energies)) {
                converged = true;
                break;
            }
        }
        return new Result(best, bestEnergy, generation, evaluations, converged);
    }

    private double[] makeTrial(double[][] population, int target, double[] best, double f,
                               double[] lower, double[] upper, Random rnd) {
        int popSize = population.length;
        int dim = lower.length;

        // четыре различных индекса, не совпадающих с целевым
        int[] r = new int[4];
        for (int k = 0; k < 4; k++) {
            int candidate;
            boolean clash;
            do {
                candidate = rnd.nextInt(popSize);
                clash = candidate == target;
                for (int j = 0; j < k && !clash; j++) clash = r[j] == candidate;
            } while (clash);
            r[k] = candidate;
        }

        double[] trial = population[target].clone();
        int forced = rnd.nextInt(dim);
        for (int d = 0; d < dim; d++) {
            if (d == forced || rnd.nextDouble() < this.settings.recombination()) {
                double v = best[d] + f * (population[r[0]][d] + population[r[1]][d]
                        - population[r[2]][d] - population[r[3]][d]);
                if (v < lower[d] || v > upper[d]) {
                    v = lower[d] + rnd.nextDouble() * (upper[d] - lower[d]);
                }
                trial[d] = v;
            }
        }
        return trial;
    }

    private double[] evaluate(ToDoubleFunction<double[]> objective, double[][] points) {
        if (this.settings.parallel()) {
            return IntStream.range(0, points.length).parallel()
                    .mapToDouble(i -> objective.applyAsDouble(points[i]))
                    .toArray();
        }
        double[] out = new double[points.length];
        for (int i = 0; i < points.length; i++) out[i] = objective.applyAsDouble(points[i]);
        return out;
    }

    private boolean hasConverged(double[] energies) {
        double mean = 0.0;
        for (double e : energies) mean += e;
        mean /= energies.length;

        double var = 0.0;
        for (double e : energies) var += (e - mean) * (e - mean);
        double std = Math.sqrt(var / energies.length);

        return std <= this.settings.tolerance() * Math.abs(mean);
    }

    /**
     * Латинский гиперкуб: каждая координата покрывает все {@code popSize} страт ровно по разу.
     */
    private static double[][] latinHypercube(int popSize, double[] lower, double[] upper, Random rnd) {
        int dim = lower.length;
        double[][] pop = new double[popSize][dim];
        for (int d = 0; d < dim; d++) {
            int[] strata = new int[popSize];
            for (int i = 0; i < popSize; i++) strata[i] = i;
            for (int i = popSize - 1; i > 0; i--) { // перемешивание Фишера-Йетса
                int j = rnd.nextInt(i + 1);
                int tmp = strata[i]; strata[i] = strata[j]; strata[j] = tmp;
            }
            for (int i = 0; i < popSize; i++) {
                double u = (strata[i] + rnd.nextDouble()) / popSize;
                pop[i][d] = lower[d] + u * (upper[d] - lower[d]);
            }
        }
        return pop;
    }

    private static boolean inside(double[] x, double[] lower, double[] upper) {
        if (x.length != lower.length) return false;
        for (int d = 0; d < x.length; d++) {
            if (x[d] < lower[d] || x[d] > upper[d]) return false;
        }
        return true;
    }
}
