package org.hopkinson.utils.dataonly;

/**
 * Знаковое соглашение фронта импульса.
 * <br>Сжимающий импульс на тензодатчике идёт вниз (отрицательный), растягивающий — вверх.</br>
 */
public enum Polarity {
    COMPRESSIVE(-1.0),
    TENSILE(1.0);

    private final double sign;

    Polarity(double sign) {
        this.sign = sign;
    }

    public double sign() {
        return this.sign;
    }

    /**
     * Совпадает ли знак отсчёта с полярностью (ноль не совпадает ни с какой).
     */
    public boolean agrees(double value) {
        return this == COMPRESSIVE ? value < 0 : value > 0;
    }

    public Polarity opposite() {
        return this == COMPRESSIVE ? TENSILE : COMPRESSIVE;
    }
}
