package org.hopkinson.utils;

import org.hopkinson.utils.dataonly.AnalysisEvent;
import org.hopkinson.utils.dataonly.AnalysisObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Наблюдатель-журнал: пишет события конвейера в SLF4J и хранит их для аудита.
 */
public class LoggingAnalysisObserver implements AnalysisObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingAnalysisObserver.class);

    private final List<AnalysisEvent> history = new ArrayList<>();

    @Override public synchronized void update(AnalysisEvent event) {
        this.history.add(event);
        switch (event.stage()) {
            case FAILED -> log.error("[❌] {}", event);
            case FINISHED -> log.info("[✅] {}", event);
            default -> log.info("[i] {}", event);
        }
    }

    /**
     * Копия всех полученных событий в порядке поступления.
     */
    public synchronized List<AnalysisEvent> history() {
        return new ArrayList<>(this.history);
    }
}
