package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.pulsesolver.AnalysisMethod;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Кривая «напряжение — деформация» одного метода анализа.
 * Все ряды одной длины и получены из одного {@link PulseSet}; значения — модули
 * (соглашение о сжимающем нагружении). Массивы не копируются: кривая создаётся
 * калькулятором и дальше только читается.
 * @param method метод анализа (1-, 2- или 3-волновой)
 * @param time время (мс)
 * @param stress инженерное напряжение (МПа)
 * @param strain инженерная деформация (безразмерная)
 * @param strainRate инженерная скорость деформации (1/с)
 * @param trueStress истинное напряжение (МПа)
 * @param trueStrain истинная деформация
 * @param trueStrainRate истинная скорость деформации (1/с)
 * @param barDisplacement перемещение торца стержня, с которого снято напряжение (мм)
 * @param barForce сила на этом торце (Н)
 */
public record StressStrainCurve(AnalysisMethod method,
                                double[] time,
                                double[] stress,
                                double[] strain,
                                double[] strainRate,
                                double[] trueStress,
                                double[] trueStrain,
                                double[] trueStrainRate,
                                double[] barDisplacement,
                                double[] barForce) {

    public int length() {
        return this.time.length;
    }

    /**
     * Именованные ряды в стабильном порядке (для отображения и выгрузки наружу).
     */
    public Map<String, double[]> asNamedSeries() {
        Map<String, double[]> series = new LinkedHashMap<>();
        series.put("time", this.time.clone());
        series.put("stress", this.stress.clone());
        series.put("strain", this.strain.clone());
        series.put("strain_rate", this.strainRate.clone());
        series.put("true_stress", this.trueStress.clone());
        series.put("true_strain", this.trueStrain.clone());
        series.put("true_strain_rate", this.trueStrainRate.clone());
        series.put("bar_displacement", this.barDisplacement.clone());
        series.put("bar_force", this.barForce.clone());
        return series;
    }
}
