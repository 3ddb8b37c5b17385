package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Флажок отмены долгих вычислений (поиск окна, оптимизация) с необязательным дедлайном.
 * <br>Решатели опрашивают его между порогами и между поколениями.</br>
 */
public final class CancellationToken {

    private volatile boolean cancelled = false;
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private CancellationToken(Duration timeout) {
        this.hasDeadline = timeout != null;
        this.deadlineNanos = hasDeadline ? System.nanoTime() + timeout.toNanos() : 0L;
    }

    /**
     * Токен, который отменяется только вручную.
     */
    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /**
     * Токен, который сам истекает через {@code timeout}.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new AnalysisValidationException("Таймаут должен быть неотрицательным: " + timeout);
        }
        return new CancellationToken(timeout);
    }

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return this.cancelled || (this.hasDeadline && System.nanoTime() - this.deadlineNanos >= 0);
    }

    /**
     * @param where что именно прерывается (для сообщения)
     * @throws CancellationException если токен отменён или дедлайн прошёл
     */
    public void throwIfCancelled(String where) {
        if (isCancelled()) {
            throw new CancellationException(where + ": вычисление отменено"
                    + (this.cancelled ? "" : " по таймауту"));
        }
    }
}
