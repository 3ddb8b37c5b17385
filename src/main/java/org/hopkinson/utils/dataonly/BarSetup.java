package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Физические константы установки, уже разрешённые внешним хранилищем метаданных.
 * @param barArea площадь сечения стержня (мм²)
 * @param barWaveSpeed скорость упругой волны в стержне (мм/мс)
 * @param barElasticModulus модуль Юнга стержня (ГПа)
 * @param specimenArea площадь сечения образца (мм²)
 * @param specimenLength начальная длина образца (мм)
 * @param strainScaleFactor сколько «единиц датчика» в единице деформации
 */
public record BarSetup(double barArea,
                       double barWaveSpeed,
                       double barElasticModulus,
                       double specimenArea,
                       double specimenLength,
                       double strainScaleFactor) {

    /** 10000 единиц датчика = 1.0 деформации — типично для записей SHPB. */
    public static final double DEFAULT_STRAIN_SCALE = 1e4;

    public BarSetup {
        requirePositive("barArea", barArea);
        requirePositive("barWaveSpeed", barWaveSpeed);
        requirePositive("barElasticModulus", barElasticModulus);
        requirePositive("specimenArea", specimenArea);
        requirePositive("specimenLength", specimenLength);
        requirePositive("strainScaleFactor", strainScaleFactor);
    }

    /**
     * Площади по диаметрам круглых сечений.
     */
    public static BarSetup fromDiameters(double barDiameter,
                                         double barWaveSpeed,
                                         double barElasticModulus,
                                         double specimenDiameter,
                                         double specimenLength,
                                         double strainScaleFactor) {
        return new BarSetup(circleArea(barDiameter), barWaveSpeed, barElasticModulus,
                circleArea(specimenDiameter), specimenLength, strainScaleFactor);
    }

    public double areaRatio() {
        return this.barArea / this.specimenArea;
    }

    private static double circleArea(double diameter) {
        return Math.PI * (diameter / 2.0) * (diameter / 2.0);
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new AnalysisValidationException(name + " должен быть положительным: " + value);
        }
    }
}
