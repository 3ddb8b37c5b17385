package org.hopkinson.utils.dataonly;

/**
 * Итог выравнивания: падающий импульс без изменений, прошедший и отражённый
 * сдвинуты с дополнением нулями.
 * @param aligned выровненный набор импульсов
 * @param shiftTransmitted сдвиг прошедшего импульса (отсчёты, «+»: позже по времени)
 * @param shiftReflected сдвиг отражённого импульса
 * @param fitness взвешенная пригодность в лучшей точке
 *                (штраф со знаком минус, если все оценки вырождены)
 */
public record AlignmentResult(PulseSet aligned,
                              int shiftTransmitted,
                              int shiftReflected,
                              double fitness) {

    /**
     * Штраф, которым заменяется нечисловая пригодность.
     */
    public static final double DEGENERATE_PENALTY = 1e3;

    /**
     * Лучшее найденное решение — всего лишь штраф (например, нулевые сегменты).
     */
    public boolean isDegenerate() {
        return this.fitness <= -DEGENERATE_PENALTY;
    }
}
