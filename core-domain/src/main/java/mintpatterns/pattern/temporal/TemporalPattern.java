package mintpatterns.pattern.temporal;

import mintpatterns.domain.series.SeriesPoint;
import mintpatterns.pattern.Pattern;

import java.time.Instant;
import java.time.temporal.TemporalAmount;
import java.util.List;
import java.util.Optional;

/**
 * Patrón cuyo valor depende del instante para el que se genera.
 */
public interface TemporalPattern extends Pattern {

    double generateAt(Instant timestamp);

    /**
     * Genera una serie desde {@code start} hasta {@code end} (ambos incluidos) avanzando
     * {@code interval} en la zona horaria del patrón. Cada llamada usa su propio cursor.
     *
     * @throws IllegalArgumentException si {@code end} es anterior a {@code start} o el intervalo no avanza.
     */
    List<SeriesPoint> generateSeries(Instant start, Instant end, TemporalAmount interval);

    /**
     * Igual que {@link #generateSeries(Instant, Instant, TemporalAmount)} con un intervalo
     * textual como {@code "1 hour"} o {@code "15 minutes"}.
     */
    default List<SeriesPoint> generateSeries(Instant start, Instant end, String interval) {
        return generateSeries(start, end, Intervals.parse(interval));
    }

    /**
     * @return el ciclo del patrón, vacío si no es periódico (crecimiento lineal).
     */
    Optional<CyclePeriod> getPeriod();

    void setBaseTime(Instant baseTime);
}
