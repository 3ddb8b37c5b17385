package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Методы анализа упругих стержней.
 * <br>Каждый метод знает, с какого торца снимается напряжение и как из импульсов
 * получается скорость деформации. Все деформации здесь уже безразмерные и со знаком.</br>
 */
public enum AnalysisMethod {

    /**
     * Напряжение — по прошедшему импульсу, скорость деформации — по отражённому.
     */
    ONE_WAVE("1-wave") {
        @Override double[] faceStrain(double[] incident, double[] transmitted, double[] reflected) {
            return transmitted.clone();
        }

        @Override double[] strainRate(double[] incident, double[] transmitted, double[] reflected,
                                      double waveSpeed, double specimenLength) {
            return reflectedRate(reflected, waveSpeed, specimenLength);
        }
    },

    /**
     * Напряжение на входном торце (падающий + отражённый), скорость — как у 1-волнового.
     */
    TWO_WAVE("2-wave") {
        @Override double[] faceStrain(double[] incident, double[] transmitted, double[] reflected) {
            double[] out = new double[incident.length];
            for (int i = 0; i < out.length; i++) out[i] = incident[i] + reflected[i];
            return out;
        }

        @Override double[] strainRate(double[] incident, double[] transmitted, double[] reflected,
                                      double waveSpeed, double specimenLength) {
            return reflectedRate(reflected, waveSpeed, specimenLength);
        }
    },

    /**
     * Напряжение по прошедшему, скорость — из всех трёх импульсов: (c/L)(ε_I − ε_R − ε_T).
     */
    THREE_WAVE("3-wave") {
        @Override double[] faceStrain(double[] incident, double[] transmitted, double[] reflected) {
            return transmitted.clone();
        }

        @Override double[] strainRate(double[] incident, double[] transmitted, double[] reflected,
                                      double waveSpeed, double specimenLength) {
            double factor = waveSpeed / specimenLength;
            double[] out = new double[incident.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = factor * (incident[i] - reflected[i] - transmitted[i]);
            }
            return out;
        }
    };

    private final String label;

    AnalysisMethod(String label) {
        this.label = label;
    }

    /**
     * Деформация того торца стержня, с которого снимается напряжение.
     */
    abstract double[] faceStrain(double[] incident, double[] transmitted, double[] reflected);

    /**
     * Инженерная скорость деформации образца (1/мс, со знаком).
     */
    abstract double[] strainRate(double[] incident, double[] transmitted, double[] reflected,
                                 double waveSpeed, double specimenLength);

    public String label() {
        return this.label;
    }

    /**
     * Разбор внешней метки метода.
     * @param label {@code "1-wave"}, {@code "2-wave"} или {@code "3-wave"}
     * @throws AnalysisValidationException неизвестная метка
     */
    public static AnalysisMethod fromLabel(String label) {
        if (label != null) {
            for (AnalysisMethod method : values()) {
                if (method.label.equals(label.trim())) return method;
            }
        }
        throw new AnalysisValidationException(
                "Неизвестный метод анализа: '" + label + "' (ожидается 1-wave, 2-wave или 3-wave)");
    }

    // ε̇ = −(2c/L)·ε_R
    private static double[] reflectedRate(double[] reflected, double waveSpeed, double specimenLength) {
        double factor = -2.0 * waveSpeed / specimenLength;
        double[] out = new double[reflected.length];
        for (int i = 0; i < out.length; i++) out[i] = factor * reflected[i];
        return out;
    }

    @Override public String toString() {
        return this.label;
    }
}
