package mintpatterns.domain.stats;

import java.util.Arrays;
import java.util.DoubleSummaryStatistics;

/**
 * Estadísticos descriptivos de una muestra, usados para validar empíricamente
 * que un patrón respeta la forma estadística configurada.
 *
 * @param count             Número de observaciones.
 * @param mean              Media muestral.
 * @param variance          Varianza muestral (corrección de Bessel, n - 1).
 * @param standardDeviation Raíz de la varianza muestral.
 * @param min               Valor mínimo observado.
 * @param max               Valor máximo observado.
 */
public record SampleStatistics(
        long count,
        double mean,
        double variance,
        double standardDeviation,
        double min,
        double max
) {

    public static SampleStatistics of(double[] values) {
        if (values == null || values.length == 0) {
            return new SampleStatistics(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }
        DoubleSummaryStatistics summary = Arrays.stream(values).summaryStatistics();
        double mean = summary.getAverage();

        // Segunda pasada: numéricamente más estable que sum(x²) - n·mean²
        double squaredDeviations = 0.0;
        for (double value : values) {
            double deviation = value - mean;
            squaredDeviations += deviation * deviation;
        }
        double variance = values.length > 1 ? squaredDeviations / (values.length - 1) : 0.0;

        return new SampleStatistics(
                summary.getCount(),
                mean,
                variance,
                Math.sqrt(variance),
                summary.getMin(),
                summary.getMax()
        );
    }

    /**
     * Error relativo de la media frente a un valor esperado (ej: 0.02 = 2%).
     */
    public double relativeMeanError(double expectedMean) {
        return Math.abs(mean - expectedMean) / Math.abs(expectedMean);
    }
}
