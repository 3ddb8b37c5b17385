package org.hopkinson.utils.dataonly;

/**
 * Наблюдатель за ходом анализа (отображение, аудит, журнал).
 * @see AnalysisSubject
 */
public interface AnalysisObserver {

    /**
     * Единственный метод обновления: субъект передаёт сюда событие этапа.
     * @param event посылка с этапом и описанием
     */
    void update(AnalysisEvent event);
}
