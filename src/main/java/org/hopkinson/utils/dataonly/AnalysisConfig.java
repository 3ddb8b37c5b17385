package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Полная конфигурация одного прогона анализа (без скрытых глобальных умолчаний).
 * @param incident поиск падающего импульса (на сигнале входного стержня)
 * @param transmitted поиск прошедшего импульса (на сигнале выходного стержня)
 * @param reflected поиск отражённого импульса (на сигнале входного стержня)
 * @param segmentPoints длина сегмента N
 * @param threshRatio порог подавления шума при сегментации (доля от максимума)
 * @param transmittedShift границы сдвига прошедшего ({@code null}: ±N/2)
 * @param reflectedShift границы сдвига отражённого ({@code null}: ±N/2)
 * @param aligner конфигурация выравнивания
 * @param bar константы установки
 * @param taperAlpha доля окна Тьюки ({@code null}: не применять)
 * @param retry повтор поиска окон
 */
public record AnalysisConfig(RoleDetection incident,
                             RoleDetection transmitted,
                             RoleDetection reflected,
                             int segmentPoints,
                             double threshRatio,
                             ShiftBounds transmittedShift,
                             ShiftBounds reflectedShift,
                             AlignerSettings aligner,
                             BarSetup bar,
                             Double taperAlpha,
                             ExtractionRetry retry) {

    public static final double DEFAULT_THRESH_RATIO = 0.01;

    public AnalysisConfig {
        if (incident == null || transmitted == null || reflected == null) {
            throw new AnalysisValidationException("Поиск задан не для всех трёх импульсов");
        }
        if (segmentPoints < 2) {
            throw new AnalysisValidationException("segmentPoints должен быть >= 2: " + segmentPoints);
        }
        if (threshRatio < 0 || threshRatio >= 1) {
            throw new AnalysisValidationException("threshRatio вне [0, 1): " + threshRatio);
        }
        if (aligner == null || bar == null) {
            throw new AnalysisValidationException("Не заданы параметры выравнивания или установки");
        }
        if (taperAlpha != null && (taperAlpha < 0 || taperAlpha > 1)) {
            throw new AnalysisValidationException("taperAlpha вне [0, 1]: " + taperAlpha);
        }
        if (retry == null) retry = ExtractionRetry.SINGLE_ATTEMPT;
    }

    public RoleDetection detection(PulseRole role) {
        return switch (role) {
            case INCIDENT -> this.incident;
            case TRANSMITTED -> this.transmitted;
            case REFLECTED -> this.reflected;
        };
    }

    public ShiftBounds transmittedShiftOrDefault() {
        return this.transmittedShift != null
                ? this.transmittedShift : ShiftBounds.symmetric(this.segmentPoints);
    }

    public ShiftBounds reflectedShiftOrDefault() {
        return this.reflectedShift != null
                ? this.reflectedShift : ShiftBounds.symmetric(this.segmentPoints);
    }
}
