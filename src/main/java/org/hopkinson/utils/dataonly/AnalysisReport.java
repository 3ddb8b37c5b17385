package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.pulsesolver.AnalysisMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Всё, что получилось за один прогон конвейера.
 * @param windows найденные окна по ролям
 * @param segments центрированные и очищенные сегменты (до выравнивания)
 * @param alignment выровненный набор и сдвиги
 * @param curves кривые всех методов анализа
 * @param metrics показатели равновесия
 * @param validity заключение о пригодности
 * @param tapered выровненный набор после окна Тьюки ({@code null}, если окно не задано)
 */
public record AnalysisReport(Map<PulseRole, PulseWindow> windows,
                             PulseSet segments,
                             AlignmentResult alignment,
                             Map<AnalysisMethod, StressStrainCurve> curves,
                             EquilibriumMetrics metrics,
                             ValidityAssessment validity,
                             PulseSet tapered) {

    public AnalysisReport {
        windows = Collections.unmodifiableMap(new EnumMap<>(windows));
        curves = Collections.unmodifiableMap(new EnumMap<>(curves));
    }

    public StressStrainCurve curve(AnalysisMethod method) {
        return this.curves.get(method);
    }

    public Optional<PulseSet> taperedSet() {
        return Optional.ofNullable(this.tapered);
    }
}
