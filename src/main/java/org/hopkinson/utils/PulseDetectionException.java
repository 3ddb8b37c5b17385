package org.hopkinson.utils;

/**
 * Импульс не найден: ни одно окно не пережило все пороги и фильтр границ,
 * либо фронт импульса так и не пересёк заданные уровни.
 * <br>Ядро <b>не</b> ослабляет пороги само — список порогов задаёт вызывающий.</br>
 */
public class PulseDetectionException extends HopkinsonAnalysisException {

    /**
     * Количество попыток, после которых сдались (1 для одиночного поиска).
     */
    private final int attempts;

    public PulseDetectionException(String message) {
        this(message, 1);
    }

    public PulseDetectionException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public PulseDetectionException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return this.attempts;
    }
}
