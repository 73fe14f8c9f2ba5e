package mintpatterns.pattern.distribution;

import mintpatterns.config.PatternConfig;
import mintpatterns.domain.exception.PatternDomainException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParetoDistributionTest {

    @Test
    @DisplayName("Regla 80/20: con alpha 1.16 el 20% superior posee ~80%")
    void percentileOwnership_shouldFollowEightyTwentyRule() {
        ParetoDistribution pareto = new ParetoDistribution(PatternConfig.of("alpha", 1.16));

        assertEquals(0.8, pareto.getPercentileOwnership(0.2), 0.05);
    }

    @Test
    @DisplayName("Más desigualdad (alpha menor) concentra más valor en la cola")
    void percentileOwnership_shouldGrowAsAlphaDecreases() {
        double unequal = new ParetoDistribution(PatternConfig.of("alpha", 1.05)).getPercentileOwnership(0.2);
        double equal = new ParetoDistribution(PatternConfig.of("alpha", 3)).getPercentileOwnership(0.2);

        assertTrue(unequal > equal);
        assertEquals(1.0, new ParetoDistribution(PatternConfig.of("alpha", 0.9)).getPercentileOwnership(0.2));
    }

    @Test
    @DisplayName("Percentil fuera de (0, 1) es un error de dominio")
    void percentileOwnership_outsideOpenInterval_shouldThrow() {
        ParetoDistribution pareto = new ParetoDistribution();

        assertThrows(PatternDomainException.class, () -> pareto.getPercentileOwnership(0));
        assertThrows(PatternDomainException.class, () -> pareto.getPercentileOwnership(1));
    }

    @Test
    @DisplayName("Las extracciones quedan en [xmin, max]")
    void sample_shouldStayWithinSupport() {
        ParetoDistribution pareto = new ParetoDistribution(PatternConfig.of("xmin", 10, "max", 500, "seed", 8));

        assertTrue(Arrays.stream(pareto.sample(20_000)).allMatch(x -> x >= 10 && x <= 500));
    }

    @Test
    @DisplayName("Media y varianza infinitas por debajo de sus umbrales")
    void moments_shouldBeInfiniteBelowThresholds() {
        ParetoDistribution heavy = new ParetoDistribution(PatternConfig.of("alpha", 1));
        ParetoDistribution medium = new ParetoDistribution(PatternConfig.of("alpha", 1.5, "xmin", 2));
        ParetoDistribution light = new ParetoDistribution(PatternConfig.of("alpha", 3, "xmin", 2));

        assertEquals(Double.POSITIVE_INFINITY, heavy.getMean());
        assertEquals(6.0, medium.getMean(), 1e-12);
        assertEquals(Double.POSITIVE_INFINITY, medium.getVariance());
        // 4·3 / (2² · 1) = 3
        assertEquals(3.0, light.getVariance(), 1e-12);
    }

    @Test
    @DisplayName("pdf y cdf: cero por debajo de xmin y cdf creciente por encima")
    void pdfAndCdf_shouldFollowPowerLaw() {
        ParetoDistribution pareto = new ParetoDistribution(PatternConfig.of("alpha", 2, "xmin", 1));

        assertEquals(0.0, pareto.pdf(0.5));
        assertEquals(0.0, pareto.cdf(0.5));
        assertEquals(2.0, pareto.pdf(1), 1e-12);
        assertEquals(0.75, pareto.cdf(2), 1e-12);
    }

    @Test
    @DisplayName("Validación: alpha 0 y max <= xmin son inválidos")
    void validate_shouldRejectInvalidParameters() {
        ParetoDistribution pareto = new ParetoDistribution();

        assertFalse(pareto.validate(PatternConfig.of("alpha", 0)));
        assertFalse(pareto.validate(PatternConfig.of("xmin", 0)));
        assertFalse(pareto.validate(PatternConfig.of("xmin", 5, "max", 5)));
        assertTrue(pareto.validate(PatternConfig.of("alpha", 2.5, "xmin", 1, "max", 10)));
    }
}
