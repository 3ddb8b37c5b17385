package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Ограниченный повтор поиска окна с расширением границ.
 * @param maxAttempts сколько всего попыток (включая первую)
 * @param marginStep на сколько отсчётов расширять границы за попытку
 * @param marginCap максимальное суммарное расширение
 */
public record ExtractionRetry(int maxAttempts, int marginStep, int marginCap) {

    /** Одна попытка, без расширения. */
    public static final ExtractionRetry SINGLE_ATTEMPT = new ExtractionRetry(1, 0, 0);

    public ExtractionRetry {
        if (maxAttempts < 1 || marginStep < 0 || marginCap < 0) {
            throw new AnalysisValidationException(String.format(
                    "Некорректные параметры повтора: attempts=%d, step=%d, cap=%d",
                    maxAttempts, marginStep, marginCap));
        }
    }

    /**
     * Расширение границ на попытке {@code attempt} (нумерация с нуля).
     */
    public int marginFor(int attempt) {
        return (int) Math.min((long) attempt * this.marginStep, this.marginCap);
    }
}
