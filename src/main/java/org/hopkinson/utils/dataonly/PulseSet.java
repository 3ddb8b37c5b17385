package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Три сегмента одинаковой длины с общей временной базой (индекс × интервал).
 * @param incident падающий импульс
 * @param transmitted прошедший импульс
 * @param reflected отражённый импульс
 * @param samplingInterval интервал дискретизации (мс)
 */
public record PulseSet(double[] incident,
                       double[] transmitted,
                       double[] reflected,
                       double samplingInterval) {

    public PulseSet {
        AnalysisValidationException.requireSameLength(
                "incident, transmitted, reflected", incident, transmitted, reflected);
        if (!(samplingInterval > 0)) {
            throw new AnalysisValidationException(
                    "Интервал дискретизации должен быть положительным: " + samplingInterval);
        }
        incident = incident.clone();
        transmitted = transmitted.clone();
        reflected = reflected.clone();
    }

    @Override public double[] incident() { return this.incident.clone(); }

    @Override public double[] transmitted() { return this.transmitted.clone(); }

    @Override public double[] reflected() { return this.reflected.clone(); }

    public int length() {
        return this.incident.length;
    }

    public double[] segment(PulseRole role) {
        return switch (role) {
            case INCIDENT -> incident();
            case TRANSMITTED -> transmitted();
            case REFLECTED -> reflected();
        };
    }

    /**
     * Общая временная ось: {@code t[i] = i * dt}.
     */
    public double[] time() {
        double[] t = new double[this.incident.length];
        for (int i = 0; i < t.length; i++) t[i] = i * this.samplingInterval;
        return t;
    }

    /**
     * Применение одной и той же функции ко всем трём сегментам (например, окна Тьюки).
     */
    public PulseSet map(UnaryOperator<double[]> operator) {
        return new PulseSet(operator.apply(incident()),
                operator.apply(transmitted()),
                operator.apply(reflected()),
                this.samplingInterval);
    }

    public Map<PulseRole, double[]> asMap() {
        Map<PulseRole, double[]> out = new EnumMap<>(PulseRole.class);
        for (PulseRole role : PulseRole.values()) out.put(role, segment(role));
        return out;
    }
}
