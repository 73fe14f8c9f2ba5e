package mintpatterns.domain.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SampleStatisticsTest {

    @Test
    @DisplayName("Calcula media, varianza muestral (n-1), mínimo y máximo")
    void of_shouldComputeDescriptiveStatistics() {
        SampleStatistics stats = SampleStatistics.of(new double[]{2, 4, 4, 4, 5, 5, 7, 9});

        assertEquals(8, stats.count());
        assertEquals(5.0, stats.mean(), 1e-12);
        // Suma de desviaciones al cuadrado = 32 -> 32 / 7
        assertEquals(32.0 / 7.0, stats.variance(), 1e-12);
        assertEquals(Math.sqrt(32.0 / 7.0), stats.standardDeviation(), 1e-12);
        assertEquals(2.0, stats.min());
        assertEquals(9.0, stats.max());
    }

    @Test
    @DisplayName("Muestra vacía: recuento 0 y estadísticos NaN")
    void of_withEmptySample_shouldReturnNaN() {
        SampleStatistics stats = SampleStatistics.of(new double[0]);

        assertEquals(0, stats.count());
        assertTrue(Double.isNaN(stats.mean()));
    }

    @Test
    @DisplayName("Error relativo de la media")
    void relativeMeanError_shouldBeRelativeToExpected() {
        SampleStatistics stats = SampleStatistics.of(new double[]{99, 103});

        assertEquals(0.01, stats.relativeMeanError(100), 1e-12);
    }
}
