package mintpatterns.pattern.distribution;

import mintpatterns.config.PatternConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExponentialDistributionTest {

    private static final double LAMBDA = 0.1;
    private static final double S = 5;
    private static final double T = 10;

    @Test
    @DisplayName("Falta de memoria (analítica): P(X > s+t | X > s) = P(X > t)")
    void cdf_shouldBeMemoryless() {
        ExponentialDistribution exponential = new ExponentialDistribution(PatternConfig.of("lambda", LAMBDA));

        double conditional = (1 - exponential.cdf(S + T)) / (1 - exponential.cdf(S));

        assertEquals(1 - exponential.cdf(T), conditional, 1e-12);
    }

    @Test
    @DisplayName("Falta de memoria (empírica): la proporción condicionada se ajusta a e^(-λt)")
    void sample_shouldBeMemoryless() {
        // ARRANGE
        ExponentialDistribution exponential = new ExponentialDistribution(PatternConfig.of("lambda", LAMBDA, "seed", 2024));

        // ACT
        double[] sample = exponential.sample(200_000);
        long survivedS = Arrays.stream(sample).filter(x -> x > S).count();
        long survivedST = Arrays.stream(sample).filter(x -> x > S + T).count();

        // ASSERT
        assertEquals(Math.exp(-LAMBDA * T), (double) survivedST / survivedS, 0.01);
    }

    @Test
    @DisplayName("Momentos, mediana y moda")
    void moments_shouldFollowRate() {
        ExponentialDistribution exponential = new ExponentialDistribution(PatternConfig.of("lambda", 2));

        assertEquals(0.5, exponential.getMean(), 1e-12);
        assertEquals(0.25, exponential.getVariance(), 1e-12);
        assertEquals(Math.log(2) / 2, exponential.getMedian(), 1e-12);
        assertEquals(0.0, exponential.getMode());
        assertEquals(0.5, exponential.cdf(exponential.getMedian()), 1e-12);
    }

    @Test
    @DisplayName("pdf y cdf valen 0 por debajo del soporte")
    void pdfAndCdf_belowSupport_shouldBeZero() {
        ExponentialDistribution exponential = new ExponentialDistribution();

        assertEquals(0.0, exponential.pdf(-1));
        assertEquals(0.0, exponential.cdf(-1));
        assertEquals(1.0, exponential.pdf(0), 1e-12);
    }

    @Test
    @DisplayName("Las extracciones nunca son negativas")
    void sample_shouldBeNonNegative() {
        ExponentialDistribution exponential = new ExponentialDistribution(PatternConfig.of("seed", 5));

        assertTrue(Arrays.stream(exponential.sample(10_000)).allMatch(x -> x >= 0));
    }

    @Test
    @DisplayName("Validación: lambda no positiva y min negativo son inválidos")
    void validate_shouldRejectInvalidParameters() {
        ExponentialDistribution exponential = new ExponentialDistribution();

        assertFalse(exponential.validate(PatternConfig.of("lambda", 0)));
        assertFalse(exponential.validate(PatternConfig.of("min", -1)));
        assertFalse(exponential.validate(PatternConfig.of("min", 3, "max", 2)));
        assertTrue(exponential.validate(PatternConfig.of("lambda", 0.5, "max", 100)));
    }
}
