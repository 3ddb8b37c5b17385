package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Как искать импульс одной роли: детектор, границы поиска и мера амплитуды.
 */
public record RoleDetection(DetectorSettings detector, SearchBounds bounds, AmplitudeMetric metric) {

    public RoleDetection {
        if (detector == null) {
            throw new AnalysisValidationException("Не задан детектор для роли импульса");
        }
        if (bounds == null) bounds = SearchBounds.NONE;
        if (metric == null) metric = AmplitudeMetric.MEDIAN;
    }
}
