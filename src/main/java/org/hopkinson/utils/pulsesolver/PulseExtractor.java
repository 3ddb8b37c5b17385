package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.PulseDetectionException;
import org.hopkinson.utils.dataonly.AmplitudeMetric;
import org.hopkinson.utils.dataonly.ExtractionRetry;
import org.hopkinson.utils.dataonly.PulseWindow;
import org.hopkinson.utils.dataonly.SearchBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Поиск окна с ограниченным числом повторов: на каждой неудаче границы поиска
 * расширяются на шаг, пока не исчерпаны попытки или предел расширения.
 */
public class PulseExtractor {

    private static final Logger log = LoggerFactory.getLogger(PulseExtractor.class);

    private final PulseDetector detector;
    private final ExtractionRetry retry;

    public PulseExtractor(PulseDetector detector, ExtractionRetry retry) {
        this.detector = detector;
        this.retry = (retry == null) ? ExtractionRetry.SINGLE_ATTEMPT : retry;
    }

    public PulseDetector detector() {
        return this.detector;
    }

    /**
     * @throws PulseDetectionException все попытки неудачны (в исключении — число попыток)
     */
    public PulseWindow extract(double[] signal, SearchBounds bounds, AmplitudeMetric metric,
                               CancellationToken token) throws PulseDetectionException {
        SearchBounds base = (bounds == null) ? SearchBounds.NONE : bounds;
        PulseDetectionException lastFailure = null;
        SearchBounds previous = null;
        int attempts = 0;

        for (int attempt = 0; attempt < this.retry.maxAttempts(); attempt++) {
            SearchBounds widened = base.widenedBy(this.retry.marginFor(attempt));
            // расширять больше некуда (предел шага или границ нет): попытка повторила бы предыдущую
            if (widened.equals(previous)) break;

            previous = widened;
            attempts++;
            try {
                PulseWindow window = this.detector.findWindow(signal, widened, metric, token);
                if (attempt > 0) {
                    log.info("[✅] Pulse found on attempt {} with bounds {}", attempts, widened);
                }
                return window;
            } catch (PulseDetectionException e) {
                lastFailure = e;
                log.debug("[⚠] Attempt {} failed with bounds {}: {}", attempts, widened, e.getMessage());
            }
        }

        throw new PulseDetectionException(String.format(
                "Pulse extraction failed after %d attempt(s), bounds %s widened up to %s",
                attempts, base, previous), attempts, lastFailure);
    }
}
