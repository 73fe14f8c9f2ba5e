package mintpatterns.pattern.distribution;

import lombok.extern.slf4j.Slf4j;
import mintpatterns.config.PatternConfig;
import mintpatterns.domain.exception.PatternConfigurationException;
import mintpatterns.domain.exception.PatternDomainException;
import mintpatterns.domain.stats.SampleStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class NormalDistributionTest {

    private static final int SAMPLE_SIZE = 100_000;

    @Test
    @DisplayName("Momentos: con media 35 y desviación 10, la muestra reproduce ambos (2% y 5%)")
    void sample_shouldMatchConfiguredMoments() {
        // ARRANGE
        NormalDistribution normal = new NormalDistribution(PatternConfig.of("mean", 35, "stddev", 10, "seed", 12345));

        // ACT
        SampleStatistics stats = normal.describe(SAMPLE_SIZE);
        log.info("Normal(35, 10): media={}, desviación={}", stats.mean(), stats.standardDeviation());

        // ASSERT
        assertEquals(SAMPLE_SIZE, stats.count());
        assertTrue(stats.relativeMeanError(35) < 0.02, "La media muestral debe estar a menos del 2%");
        assertEquals(10.0, stats.standardDeviation(), 0.5, "La desviación muestral debe estar a menos del 5%");
    }

    @Test
    @DisplayName("Determinismo: dos distribuciones con la misma semilla generan la misma muestra")
    void sample_withSameSeed_shouldBeReproducible() {
        PatternConfig config = PatternConfig.of("mean", 0, "stddev", 1, "seed", 42);

        assertArrayEquals(new NormalDistribution(config).sample(100), new NormalDistribution(config).sample(100));
    }

    @Test
    @DisplayName("cdf(media) = 0.5 y la pdf es simétrica")
    void cdfAndPdf_shouldBehaveAroundTheMean() {
        NormalDistribution normal = new NormalDistribution(PatternConfig.of("mean", 35, "stddev", 10));

        assertEquals(0.5, normal.cdf(35), 1e-6);
        assertEquals(normal.pdf(25), normal.pdf(45), 1e-12);
        assertEquals(1.0 / (10 * Math.sqrt(2 * Math.PI)), normal.pdf(35), 1e-12);
        // ±1σ ≈ 68.27%
        assertEquals(0.6827, normal.cdf(45) - normal.cdf(25), 1e-3);
    }

    @Test
    @DisplayName("erf: error por debajo de 1.5e-7 en puntos de referencia")
    void erf_shouldApproximateReferenceValues() {
        assertEquals(0.0, NormalDistribution.erf(0), 1e-7);
        assertEquals(0.8427007929, NormalDistribution.erf(1), 1.5e-7);
        assertEquals(-0.8427007929, NormalDistribution.erf(-1), 1.5e-7);
        assertEquals(0.9953222650, NormalDistribution.erf(2), 1.5e-7);
    }

    @Test
    @DisplayName("Acotado: con min y max, ninguna extracción sale del intervalo")
    void generate_shouldRespectBounds() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("mean", 0);
        raw.put("stddev", 5);
        raw.put("min", -1);
        raw.put("max", 1);
        raw.put("seed", 1);
        NormalDistribution normal = new NormalDistribution(PatternConfig.from(raw));

        double[] sample = normal.sample(10_000);

        assertTrue(Arrays.stream(sample).allMatch(v -> v >= -1 && v <= 1));
    }

    @Test
    @DisplayName("Validación: stddev 0 y min >= max son configuraciones inválidas")
    void validate_shouldRejectOutOfDomainParameters() {
        NormalDistribution normal = new NormalDistribution();

        assertFalse(normal.validate(PatternConfig.of("stddev", 0)));
        assertFalse(normal.validate(PatternConfig.of("min", 10, "max", 5)));
        assertTrue(normal.validate(PatternConfig.of("mean", 100, "stddev", 15)));
        assertThrows(PatternConfigurationException.class, () -> new NormalDistribution(PatternConfig.of("stddev", -2)));
    }

    @Test
    @DisplayName("Dominio: pdf y cdf rechazan valores no finitos")
    void pdf_withNonFiniteInput_shouldThrowDomainError() {
        NormalDistribution normal = new NormalDistribution();

        assertThrows(PatternDomainException.class, () -> normal.pdf(Double.NaN));
        assertThrows(PatternDomainException.class, () -> normal.cdf(Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("sample rechaza tamaños negativos")
    void sample_withNegativeCount_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new NormalDistribution().sample(-1));
    }
}
