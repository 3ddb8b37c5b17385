package org.hopkinson.utils.dataonly;

/**
 * Субъект, за которым наблюдают.
 * <br>Подразумевается, что на конвейер анализа подписываются журнал и отображение.</br>
 * @see AnalysisObserver
 */
public interface AnalysisSubject {

    void attach(AnalysisObserver newObserver);

    void detach(AnalysisObserver existingObserver);

    /**
     * Оповещение всех наблюдателей о новом событии.
     */
    void notifyObservers(AnalysisEvent event);
}
