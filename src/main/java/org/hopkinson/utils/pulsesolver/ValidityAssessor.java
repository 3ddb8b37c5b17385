package org.hopkinson.utils.pulsesolver;

import org.hopkinson.utils.AnalysisValidationException;
import org.hopkinson.utils.dataonly.EquilibriumMetrics;
import org.hopkinson.utils.dataonly.ValidityAssessment;
import org.hopkinson.utils.dataonly.ValidityAssessment.Achievement;
import org.hopkinson.utils.dataonly.ValidityAssessment.TestValidity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Заключение о пригодности испытания по показателям равновесия.
 * <ul>
 *     <li>VALID: все четыре показателя проходят строгие пороги
 *     <li>QUESTIONABLE: хотя бы два проходят мягкие пороги
 *     <li>INVALID: всё остальное
 * </ul>
 * {@code NaN} не проходит ни одного порога.
 */
public class ValidityAssessor {

    private static final Logger log = LoggerFactory.getLogger(ValidityAssessor.class);

    // Строгие пороги
    public static final double FBC_STRICT = 0.95;
    public static final double SEQI_STRICT = 0.90;
    public static final double SOI_STRICT = 0.05; // меньше — лучше
    public static final double DSUF_STRICT = 0.98;

    // Мягкие пороги
    public static final double FBC_RELAXED = 0.85;
    public static final double SEQI_RELAXED = 0.80;
    public static final double SOI_RELAXED = 0.10;
    public static final double DSUF_RELAXED = 0.90;

    // Частичное выполнение критериев
    public static final double FBC_PARTIAL = 0.75;
    public static final double DSUF_PARTIAL = 0.75;
    public static final double SOI_PARTIAL = 0.20;

    public static final double FORCE_EQUILIBRIUM_FBC = 0.90;
    public static final double FORCE_EQUILIBRIUM_DSUF = 0.90;
    public static final double CONSTANT_STRAIN_RATE_SOI = 0.10;

    public static final String FORCE_EQUILIBRIUM = "ForceEquilibrium";
    public static final String CONSTANT_STRAIN_RATE = "ConstantStrainRate";

    /**
     * Оценка отдельного показателя (для раскраски в отображении).
     */
    public enum Grade { GOOD, ACCEPTABLE, POOR }

    public ValidityAssessment assess(EquilibriumMetrics metrics) {
        double fbc = metrics.fbc(), seqi = metrics.seqi(), soi = metrics.soi(), dsuf = metrics.dsuf();

        Achievement force = assessForceEquilibrium(fbc, dsuf);
        Achievement strainRate = assessStrainRate(soi);
        TestValidity validity = determineOverallValidity(metrics);

        List<String> criteria = new ArrayList<>();
        if (force == Achievement.ACHIEVED) criteria.add(FORCE_EQUILIBRIUM);
        if (strainRate == Achievement.ACHIEVED) criteria.add(CONSTANT_STRAIN_RATE);

        String notes = notes(fbc, seqi, soi, dsuf, force, strainRate);

        log.info("[i] Validity assessment complete: {}", validity);
        if (!criteria.isEmpty()) log.info("[✅] Criteria met: {}", String.join(", ", criteria));
        log.debug("[i] Validity notes: {}", notes);

        return new ValidityAssessment(validity, force, strainRate, notes, criteria);
    }

    public Achievement assessForceEquilibrium(double fbc, double dsuf) {
        if (fbc >= FORCE_EQUILIBRIUM_FBC && dsuf >= FORCE_EQUILIBRIUM_DSUF) return Achievement.ACHIEVED;
        if (fbc >= FBC_PARTIAL || dsuf >= DSUF_PARTIAL) return Achievement.PARTIALLY_ACHIEVED;
        return Achievement.NOT_ACHIEVED;
    }

    public Achievement assessStrainRate(double soi) {
        if (soi <= CONSTANT_STRAIN_RATE_SOI) return Achievement.ACHIEVED;
        if (soi <= SOI_PARTIAL) return Achievement.PARTIALLY_ACHIEVED;
        return Achievement.NOT_ACHIEVED;
    }

    public TestValidity determineOverallValidity(EquilibriumMetrics m) {
        int strict = count(m.fbc() >= FBC_STRICT, m.seqi() >= SEQI_STRICT,
                m.soi() <= SOI_STRICT, m.dsuf() >= DSUF_STRICT);
        int relaxed = count(m.fbc() >= FBC_RELAXED, m.seqi() >= SEQI_RELAXED,
                m.soi() <= SOI_RELAXED, m.dsuf() >= DSUF_RELAXED);

        if (strict == 4) return TestValidity.VALID;
        return relaxed >= 2 ? TestValidity.QUESTIONABLE : TestValidity.INVALID;
    }

    /**
     * @param metric имя показателя: FBC, SEQI, SOI или DSUF
     */
    public Grade grade(String metric, double value) {
        return switch (metric) {
            case "FBC" -> higherIsBetter(value, FBC_STRICT, FBC_RELAXED);
            case "SEQI" -> higherIsBetter(value, SEQI_STRICT, SEQI_RELAXED);
            case "DSUF" -> higherIsBetter(value, DSUF_STRICT, DSUF_RELAXED);
            case "SOI" -> value <= SOI_STRICT ? Grade.GOOD
                    : value <= SOI_RELAXED ? Grade.ACCEPTABLE : Grade.POOR;
            default -> throw new AnalysisValidationException("Неизвестный показатель: " + metric);
        };
    }

    public Map<String, Grade> gradeAll(EquilibriumMetrics metrics) {
        Map<String, Grade> out = new LinkedHashMap<>();
        out.put("FBC", grade("FBC", metrics.fbc()));
        out.put("SEQI", grade("SEQI", metrics.seqi()));
        out.put("SOI", grade("SOI", metrics.soi()));
        out.put("DSUF", grade("DSUF", metrics.dsuf()));
        return out;
    }

    private static Grade higherIsBetter(double value, double strict, double relaxed) {
        if (value >= strict) return Grade.GOOD;
        return value >= relaxed ? Grade.ACCEPTABLE : Grade.POOR;
    }

    private static int count(boolean... passed) {
        int n = 0;
        for (boolean p : passed) if (p) n++;
        return n;
    }

    private static String notes(double fbc, double seqi, double soi, double dsuf,
                                Achievement force, Achievement strainRate) {
        List<String> notes = new ArrayList<>();

        String forcePair = String.format(Locale.ROOT, "(FBC=%.3f, DSUF=%.3f)", fbc, dsuf);
        notes.add(switch (force) {
            case ACHIEVED -> "Force equilibrium achieved " + forcePair;
            case PARTIALLY_ACHIEVED -> "Force equilibrium partially achieved " + forcePair;
            case NOT_ACHIEVED -> "Force equilibrium NOT achieved " + forcePair;
        });

        String soiText = String.format(Locale.ROOT, "(SOI=%.3f)", soi);
        notes.add(switch (strainRate) {
            case ACHIEVED -> "Constant strain rate maintained " + soiText;
            case PARTIALLY_ACHIEVED -> "Strain rate oscillations detected " + soiText;
            case NOT_ACHIEVED -> "Significant strain rate oscillations " + soiText;
        });

        String seqiText = String.format(Locale.ROOT, "(SEQI=%.3f)", seqi);
        if (seqi >= SEQI_STRICT) notes.add("Good stress equilibrium " + seqiText);
        else if (seqi >= SEQI_RELAXED) notes.add("Acceptable stress equilibrium " + seqiText);
        else notes.add("Poor stress equilibrium " + seqiText);

        return String.join("; ", notes);
    }
}
