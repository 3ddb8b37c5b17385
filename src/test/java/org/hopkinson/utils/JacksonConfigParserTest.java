package org.hopkinson.utils;

import org.hopkinson.utils.dataonly.AmplitudeMetric;
import org.hopkinson.utils.dataonly.AnalysisConfig;
import org.hopkinson.utils.dataonly.ExtractionRetry;
import org.hopkinson.utils.dataonly.Polarity;
import org.hopkinson.utils.dataonly.PulseRole;
import org.hopkinson.utils.dataonly.SearchBounds;
import org.hopkinson.utils.dataonly.ShiftBounds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class JacksonConfigParserTest {

    private static final String MINIMAL = """
            {
              "pulsePoints": 200,
              "bar": {
                "barArea": 100, "barWaveSpeed": 5000, "barElasticModulus": 200,
                "specimenArea": 25, "specimenLength": 5
              }
            }
            """;

    private final JacksonConfigParser parser = new JacksonConfigParser();

    @Test
    void bundledDefaultsLoad() throws Exception {
        AnalysisConfig config = parser.defaults();

        assertThat(config.segmentPoints()).isEqualTo(4096);
        assertThat(config.taperAlpha()).isNull();
        assertThat(config.incident().detector().pulsePoints()).isEqualTo(1000);
        assertThat(config.reflected().detector().polarity()).isEqualTo(Polarity.TENSILE);
        assertThat(config.bar().barArea()).isCloseTo(Math.PI * 9.525 * 9.525, within(1e-9));
        assertThat(config.aligner().barWaveSpeed()).isEqualTo(4953.3);
        assertThat(config.retry()).isEqualTo(new ExtractionRetry(3, 500, 1500));
    }

    @Test
    void minimalConfigurationFallsBackToDefaults() throws Exception {
        AnalysisConfig config = parser.parse(MINIMAL);

        assertThat(config.detection(PulseRole.INCIDENT).detector().polarity()).isEqualTo(Polarity.COMPRESSIVE);
        assertThat(config.detection(PulseRole.TRANSMITTED).detector().kTrials()).containsExactly(6.0, 4.0, 2.0);
        assertThat(config.detection(PulseRole.REFLECTED).metric()).isEqualTo(AmplitudeMetric.MEDIAN);
        assertThat(config.incident().bounds()).isEqualTo(SearchBounds.NONE);
        assertThat(config.bar().strainScaleFactor()).isEqualTo(1e4);
        assertThat(config.aligner().kLinear()).isEqualTo(0.35);
        assertThat(config.transmittedShift()).isNull();
        assertThat(config.retry()).isEqualTo(ExtractionRetry.SINGLE_ATTEMPT);
    }

    @Test
    void roleSectionsOverrideSharedValues() throws Exception {
        String json = """
                {
                  "pulsePoints": 200,
                  "taperAlpha": 0.25,
                  "detection": {
                    "reflected": { "pulsePoints": 150, "polarity": "Compressive", "kTrials": [3],
                                   "metric": "peak", "lowerBound": 1000, "minSeparation": 40 }
                  },
                  "alignment": {
                    "transmittedShift": [-50, 10],
                    "optimizer": { "seed": 7, "parallel": true, "mutation": [0.4, 0.9] }
                  },
                  "bar": { "barDiameter": 20, "barWaveSpeed": 5000, "barElasticModulus": 200,
                           "specimenDiameter": 10, "specimenLength": 5 }
                }
                """;

        AnalysisConfig config = parser.parse(json);

        assertThat(config.taperAlpha()).isEqualTo(0.25);
        assertThat(config.reflected().detector().pulsePoints()).isEqualTo(150);
        assertThat(config.reflected().detector().polarity()).isEqualTo(Polarity.COMPRESSIVE);
        assertThat(config.reflected().detector().minSeparation()).isEqualTo(40);
        assertThat(config.reflected().metric()).isEqualTo(AmplitudeMetric.PEAK);
        assertThat(config.reflected().bounds()).isEqualTo(SearchBounds.from(1000));
        assertThat(config.incident().detector().pulsePoints()).isEqualTo(200);
        assertThat(config.transmittedShift()).isEqualTo(new ShiftBounds(-50, 10));
        assertThat(config.aligner().optimizer().seed()).isEqualTo(7L);
        assertThat(config.aligner().optimizer().parallel()).isTrue();
        assertThat(config.aligner().optimizer().mutationMin()).isEqualTo(0.4);
        assertThat(config.bar().areaRatio()).isCloseTo(4.0, within(1e-12));
    }

    @Test
    void readsConfigurationFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("analysis.json");
        Files.writeString(file, MINIMAL);

        assertThat(parser.parse(file).incident().detector().pulsePoints()).isEqualTo(200);
        assertThatThrownBy(() -> parser.parse(dir.resolve("missing.json")))
                .isInstanceOf(HopkinsonAnalysisException.class);
    }

    @Test
    void barSectionIsRequired() {
        assertThatThrownBy(() -> parser.parse("{ \"pulsePoints\": 200 }"))
                .isInstanceOf(HopkinsonAnalysisException.class)
                .hasMessageContaining("bar");
    }

    @Test
    void pulseLengthIsRequired() {
        String json = MINIMAL.replace("\"pulsePoints\": 200,", "");

        assertThatThrownBy(() -> parser.parse(json))
                .isInstanceOf(HopkinsonAnalysisException.class)
                .hasMessageContaining("pulsePoints");
    }

    @Test
    void malformedJsonIsWrapped() {
        assertThatThrownBy(() -> parser.parse("{ \"bar\": "))
                .isInstanceOf(HopkinsonAnalysisException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void unknownPolarityIsRejected() {
        String json = MINIMAL.replace("\"pulsePoints\": 200,",
                "\"pulsePoints\": 200, \"detection\": { \"incident\": { \"polarity\": \"sideways\" } },");

        assertThatThrownBy(() -> parser.parse(json))
                .isInstanceOf(AnalysisValidationException.class)
                .hasMessageContaining("sideways");
    }

    @Test
    void missingResourceIsReported() {
        assertThatThrownBy(() -> parser.parseResource("no-such-config.json"))
                .isInstanceOf(HopkinsonAnalysisException.class);
    }
}
