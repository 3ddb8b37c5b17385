package org.hopkinson.utils.dataonly;

import org.hopkinson.utils.AnalysisValidationException;

/**
 * Параметры мостовой схемы тензодатчика для перевода вольт в деформацию.
 * @param gaugeResistance сопротивление датчика (Ом)
 * @param gaugeFactor коэффициент тензочувствительности
 * @param calibrationVoltage калибровочное напряжение (В)
 * @param calibrationResistance калибровочный резистор (Ом)
 */
public record GaugeParameters(double gaugeResistance,
                              double gaugeFactor,
                              double calibrationVoltage,
                              double calibrationResistance) {

    public GaugeParameters {
        if (!(gaugeResistance > 0) || !(gaugeFactor > 0)
                || !(calibrationVoltage > 0) || calibrationResistance < 0) {
            throw new AnalysisValidationException(String.format(
                    "Некорректные параметры датчика: R=%s, GF=%s, Vcal=%s, Rcal=%s",
                    gaugeResistance, gaugeFactor, calibrationVoltage, calibrationResistance));
        }
    }

    /**
     * strain = V * R_g / (V_cal * GF * (R_g + R_cal))
     */
    public double strainPerVolt() {
        return this.gaugeResistance
                / (this.calibrationVoltage * this.gaugeFactor
                   * (this.gaugeResistance + this.calibrationResistance));
    }
}
