package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Полуоткрытый диапазон индексов {@code [startIndex, endIndex)} внутри сырого сигнала.
 * @param startIndex первый отсчёт окна
 * @param endIndex отсчёт сразу за окном
 */
public record PulseWindow(int startIndex, int endIndex) {

    public PulseWindow {
        if (startIndex < 0 || endIndex <= startIndex) {
            throw new AnalysisValidationException(
                    "Некорректное окно импульса: [" + startIndex + ", " + endIndex + ")");
        }
    }

    public int length() {
        return this.endIndex - this.startIndex;
    }

    /**
     * Середина окна в отсчётах (целочисленная).
     */
    public int midpoint() {
        return (this.startIndex + this.endIndex) / 2;
    }

    /**
     * Помещается ли окно в сигнал заданной длины.
     */
    public boolean fitsInto(int signalLength) {
        return this.endIndex <= signalLength;
    }

    @Override public String toString() {
        return "[" + this.startIndex + ", " + this.endIndex + ")";
    }
}
