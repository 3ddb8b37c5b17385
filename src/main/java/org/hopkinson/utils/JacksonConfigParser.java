package org.hopkinson.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.hopkinson.utils.dataonly.AlignerSettings;
import org.hopkinson.utils.dataonly.AmplitudeMetric;
import org.hopkinson.utils.dataonly.AnalysisConfig;
import org.hopkinson.utils.dataonly.BarSetup;
import org.hopkinson.utils.dataonly.DetectorSettings;
import org.hopkinson.utils.dataonly.EquilibriumCriteria;
import org.hopkinson.utils.dataonly.ExtractionRetry;
import org.hopkinson.utils.dataonly.OptimizerSettings;
import org.hopkinson.utils.dataonly.Polarity;
import org.hopkinson.utils.dataonly.PulseRole;
import org.hopkinson.utils.dataonly.RoleDetection;
import org.hopkinson.utils.dataonly.SearchBounds;
import org.hopkinson.utils.dataonly.ShiftBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Чтение конфигурации анализа {@link AnalysisConfig} из {@code JSON}.
 * <br>Отсутствующие ключи заменяются значениями по умолчанию; без умолчаний остаются
 * только физические константы установки и длина импульса.</br>
 */
public class JacksonConfigParser {
/*
    ╭──────────────────────────────────────────────────────────────────────────────╮
    │ Блок с:                                                                      │
    │  * КОНСТАНТАМИ ПО УМОЛЧАНИЮ.                                                 │
    │  * Открытым API (строка, файл, ресурс из classpath).                         │
    ╰──────────────────────────────────────────────────────────────────────────────╯
*/
    private static final Logger log = LoggerFactory.getLogger(JacksonConfigParser.class);

    /** Конфигурация, которая поставляется вместе с библиотекой. */
    public static final String DEFAULT_RESOURCE = "default-analysis.json";

    public static final int DEFAULT_SEGMENT_POINTS = 4096;

    private final ObjectMapper mapper = new ObjectMapper();

    public AnalysisConfig parse(String json) throws HopkinsonAnalysisException {
        try {
            return fromTree(this.mapper.readTree(json));
        } catch (JsonProcessingException jpe) {
            throw new HopkinsonAnalysisException("Malformed analysis configuration: " + jpe.getOriginalMessage(), jpe);
        }
    }

    public AnalysisConfig parse(Path file) throws HopkinsonAnalysisException {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ioe) {
            throw new HopkinsonAnalysisException("Cannot read analysis configuration " + file, ioe);
        }
    }

    /**
     * @param resourceName имя ресурса в classpath, например {@link #DEFAULT_RESOURCE}
     */
    public AnalysisConfig parseResource(String resourceName) throws HopkinsonAnalysisException {
        try (InputStream in = JacksonConfigParser.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new HopkinsonAnalysisException("Configuration resource not found: " + resourceName);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ioe) {
            throw new HopkinsonAnalysisException("Cannot read configuration resource " + resourceName, ioe);
        }
    }

    public AnalysisConfig defaults() throws HopkinsonAnalysisException {
        return parseResource(DEFAULT_RESOURCE);
    }


/*
    ╭──────────────────────────────────────────────────────────────────────────────╮
    │ Блок с РАЗБОРОМ ДЕРЕВА ПО РАЗДЕЛАМ                                           │
    ╰──────────────────────────────────────────────────────────────────────────────╯
*/
    private AnalysisConfig fromTree(JsonNode root) throws HopkinsonAnalysisException {
        if (!root.isObject()) {
            throw new HopkinsonAnalysisException("Analysis configuration must be a JSON object");
        }
        BarSetup bar = bar(root.path("bar"));

        // Общая длина импульса, которую роль может переопределить
        Integer sharedPulsePoints = intOrNull(root, "pulsePoints");
        JsonNode detection = root.path("detection");
        RoleDetection incident = role(detection.path("incident"), sharedPulsePoints, Polarity.COMPRESSIVE, PulseRole.INCIDENT);
        RoleDetection transmitted = role(detection.path("transmitted"), sharedPulsePoints, Polarity.COMPRESSIVE, PulseRole.TRANSMITTED);
        RoleDetection reflected = role(detection.path("reflected"), sharedPulsePoints, Polarity.TENSILE, PulseRole.REFLECTED);

        JsonNode alignment = root.path("alignment");
        AlignerSettings aligner = new AlignerSettings(
                bar.barWaveSpeed(),
                bar.specimenLength(),
                doubleOr(alignment, "kLinear", AlignerSettings.DEFAULT_K_LINEAR),
                weights(alignment.path("weights")),
                optimizer(alignment.path("optimizer")));

        JsonNode taper = root.path("taperAlpha");
        Double taperAlpha = (taper.isMissingNode() || taper.isNull()) ? null : taper.asDouble();

        AnalysisConfig config = new AnalysisConfig(incident, transmitted, reflected,
                intOr(root, "segmentPoints", DEFAULT_SEGMENT_POINTS),
                doubleOr(root, "threshRatio", AnalysisConfig.DEFAULT_THRESH_RATIO),
                shiftBounds(alignment.path("transmittedShift")),
                shiftBounds(alignment.path("reflectedShift")),
                aligner, bar, taperAlpha,
                retry(root.path("retry")));

        log.debug("[✅] Analysis configuration parsed: N={}, taper={}", config.segmentPoints(), taperAlpha);
        return config;
    }

    /**
     * Площади задаются либо напрямую, либо диаметрами.
     */
    private BarSetup bar(JsonNode node) throws HopkinsonAnalysisException {
        if (node.isMissingNode()) {
            throw new HopkinsonAnalysisException("Section 'bar' is required");
        }
        double waveSpeed = required(node, "barWaveSpeed");
        double modulus = required(node, "barElasticModulus");
        double specimenLength = required(node, "specimenLength");
        double scale = doubleOr(node, "strainScaleFactor", BarSetup.DEFAULT_STRAIN_SCALE);

        if (node.has("barArea") || node.has("specimenArea")) {
            return new BarSetup(required(node, "barArea"), waveSpeed, modulus,
                    required(node, "specimenArea"), specimenLength, scale);
        }
        return BarSetup.fromDiameters(required(node, "barDiameter"), waveSpeed, modulus,
                required(node, "specimenDiameter"), specimenLength, scale);
    }

    private RoleDetection role(JsonNode node, Integer sharedPulsePoints, Polarity defaultPolarity, PulseRole role)
            throws HopkinsonAnalysisException {
        Integer pulsePoints = intOrNull(node, "pulsePoints");
        if (pulsePoints == null) pulsePoints = sharedPulsePoints;
        if (pulsePoints == null) {
            throw new HopkinsonAnalysisException("pulsePoints is not set for " + role + " (nor globally)");
        }

        Polarity polarity = enumOr(node, "polarity", Polarity.class, defaultPolarity);
        List<Double> kTrials = DetectorSettings.DEFAULT_K_TRIALS;
        if (node.path("kTrials").isArray()) {
            kTrials = new ArrayList<>();
            for (JsonNode k : node.path("kTrials")) kTrials.add(k.asDouble());
        }

        DetectorSettings detector = node.has("minSeparation")
                ? new DetectorSettings(pulsePoints, kTrials, polarity, node.path("minSeparation").asInt())
                : DetectorSettings.of(pulsePoints, kTrials, polarity);

        SearchBounds bounds = new SearchBounds(intOrNull(node, "lowerBound"), intOrNull(node, "upperBound"));
        AmplitudeMetric metric = enumOr(node, "metric", AmplitudeMetric.class, AmplitudeMetric.MEDIAN);
        return new RoleDetection(detector, bounds, metric);
    }

    private static EquilibriumCriteria weights(JsonNode node) {
        EquilibriumCriteria d = EquilibriumCriteria.DEFAULT;
        return new EquilibriumCriteria(
                doubleOr(node, "corr", d.corr()),
                doubleOr(node, "u", d.u()),
                doubleOr(node, "sr", d.sr()),
                doubleOr(node, "e", d.e()));
    }

    private static OptimizerSettings optimizer(JsonNode node) {
        OptimizerSettings d = OptimizerSettings.DEFAULT;
        JsonNode mutation = node.path("mutation");
        double mMin = mutation.isArray() ? mutation.path(0).asDouble(d.mutationMin()) : d.mutationMin();
        double mMax = mutation.isArray() ? mutation.path(1).asDouble(d.mutationMax()) : d.mutationMax();
        return new OptimizerSettings(
                intOr(node, "populationMultiplier", d.populationMultiplier()),
                intOr(node, "maxGenerations", d.maxGenerations()),
                doubleOr(node, "tolerance", d.tolerance()),
                mMin, mMax,
                doubleOr(node, "recombination", d.recombination()),
                node.path("seed").asLong(d.seed()),
                node.path("parallel").asBoolean(d.parallel()),
                node.path("polish").asBoolean(d.polish()));
    }

    /**
     * {@code [min, max]} или {@code null} (тогда ±N/2).
     */
    private static ShiftBounds shiftBounds(JsonNode node) {
        if (!node.isArray() || node.size() != 2) return null;
        return new ShiftBounds(node.path(0).asInt(), node.path(1).asInt());
    }

    private static ExtractionRetry retry(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) return ExtractionRetry.SINGLE_ATTEMPT;
        return new ExtractionRetry(intOr(node, "maxAttempts", 1),
                intOr(node, "marginStep", 0),
                intOr(node, "marginCap", 0));
    }


/*
    ╭──────────────────────────────────────────────────────────────────────────────╮
    │ Блок с УТИЛИТНЫМИ МЕТОДАМИ ЧТЕНИЯ ПОЛЕЙ                                      │
    ╰──────────────────────────────────────────────────────────────────────────────╯
*/
    private static boolean absent(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isMissingNode() || v.isNull();
    }

    private static double required(JsonNode node, String field) throws HopkinsonAnalysisException {
        if (absent(node, field) || !node.path(field).isNumber()) {
            throw new HopkinsonAnalysisException("Numeric field '" + field + "' is required");
        }
        return node.path(field).asDouble();
    }

    private static double doubleOr(JsonNode node, String field, double fallback) {
        return absent(node, field) ? fallback : node.path(field).asDouble(fallback);
    }

    private static int intOr(JsonNode node, String field, int fallback) {
        return absent(node, field) ? fallback : node.path(field).asInt(fallback);
    }

    private static Integer intOrNull(JsonNode node, String field) {
        return absent(node, field) ? null : node.path(field).asInt();
    }

    private static <E extends Enum<E>> E enumOr(JsonNode node, String field, Class<E> type, E fallback) {
        if (absent(node, field)) return fallback;
        String raw = node.path(field).asText();
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException iae) {
            throw new AnalysisValidationException(
                    "Unknown " + type.getSimpleName() + " '" + raw + "' in field '" + field + "'");
        }
    }
}
