package org.hopkinson.utils.dataonly;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Скалярные показатели качества равновесия образца.
 * <ul>
 *     <li>FBC: коэффициент баланса сил (ближе к 1 — лучше)
 *     <li>SEQI: индекс качества равновесия напряжений (ближе к 1 — лучше)
 *     <li>SOI: индекс осцилляций напряжения на плато (меньше — лучше)
 *     <li>DSUF: фактор однородности напряжений, R² (ближе к 1 — лучше)
 * </ul>
 * Плюс FBC и DSUF по фазам нагружения, плато и разгрузки.
 */
public record EquilibriumMetrics(double fbc,
                                 double seqi,
                                 double soi,
                                 double dsuf,
                                 PhaseMetrics loading,
                                 PhaseMetrics plateau,
                                 PhaseMetrics unloading) {

    /**
     * FBC и DSUF, посчитанные только внутри одной фазы.
     */
    public record PhaseMetrics(double fbc, double dsuf) {
        public static final PhaseMetrics UNDEFINED = new PhaseMetrics(Double.NaN, Double.NaN);
    }

    /**
     * Нет ни одной точки, где напряжение заметно отличается от нуля.
     */
    public static EquilibriumMetrics undefined() {
        return new EquilibriumMetrics(Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                PhaseMetrics.UNDEFINED, PhaseMetrics.UNDEFINED, PhaseMetrics.UNDEFINED);
    }

    public Map<String, Double> asNamedMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("FBC", this.fbc);
        out.put("SEQI", this.seqi);
        out.put("SOI", this.soi);
        out.put("DSUF", this.dsuf);
        out.put("windowed_FBC_loading", this.loading.fbc());
        out.put("windowed_FBC_plateau", this.plateau.fbc());
        out.put("windowed_FBC_unloading", this.unloading.fbc());
        out.put("windowed_DSUF_loading", this.loading.dsuf());
        out.put("windowed_DSUF_plateau", this.plateau.dsuf());
        out.put("windowed_DSUF_unloading", this.unloading.dsuf());
        return out;
    }
}
