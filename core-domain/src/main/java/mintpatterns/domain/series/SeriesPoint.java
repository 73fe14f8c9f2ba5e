package mintpatterns.domain.series;

import java.time.Instant;

/**
 * Punto de una serie temporal generada: el instante y el valor del patrón en ese instante.
 */
public record SeriesPoint(Instant timestamp, double value) {}
