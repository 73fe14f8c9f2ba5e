package mintpatterns.pattern.distribution;

import mintpatterns.domain.stats.SampleStatistics;
import mintpatterns.pattern.Pattern;

/**
 * Patrón con momentos estadísticos conocidos y funciones de densidad y distribución.
 */
public interface Distribution extends Pattern {

    double getMean();

    double getVariance();

    double getStandardDeviation();

    /**
     * Función de densidad (o de masa, en distribuciones discretas) evaluada en {@code x}.
     * Devuelve 0 fuera del soporte.
     */
    double pdf(double x);

    /**
     * Función de distribución acumulada evaluada en {@code x}.
     */
    double cdf(double x);

    /**
     * Genera {@code count} extracciones independientes mediante llamadas sucesivas a {@link #generate()}.
     */
    double[] sample(int count);

    default SampleStatistics describe(int count) {
        return SampleStatistics.of(sample(count));
    }
}
