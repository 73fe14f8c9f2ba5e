package mintpatterns.pattern.temporal;

import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.domain.series.SeriesPoint;
import mintpatterns.pattern.AbstractPattern;
import mintpatterns.pattern.GenerationContext;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAmount;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base de los patrones temporales: zona horaria del calendario, instante base y recorrido de series.
 * <p>
 * El instante base se toma de {@code base_time} o, si falta, del momento de construcción;
 * {@link #setBaseTime(Instant)} lo sustituye y sobrevive a posteriores {@code setConfig}
 * que no declaren {@code base_time}.
 */
public abstract class AbstractTemporalPattern extends AbstractPattern implements TemporalPattern {

    public static final String TIMEZONE = "timezone";
    public static final String BASE_TIME = "base_time";

    public static final String DEFAULT_TIMEZONE = "UTC";

    private ZoneId zone = ZoneId.of(DEFAULT_TIMEZONE);
    private Instant baseTime;
    private boolean explicitBaseTime;

    protected AbstractTemporalPattern(String name, String description, Map<String, ParameterSpec> parameters, PatternConfig config) {
        super(name, description, parameters, config);
    }

    /**
     * Lee los parámetros propios del patrón; la zona y el instante base ya están aplicados.
     */
    protected abstract void applyTemporalConfig(PatternConfig config);

    protected void collectTemporalViolations(PatternConfig config, List<String> violations) {
    }

    @Override
    protected final void applyConfig(PatternConfig config) {
        this.zone = ZoneId.of(config.getString(TIMEZONE, DEFAULT_TIMEZONE));

        Instant configured = config.getInstant(BASE_TIME);
        if (configured != null) {
            this.baseTime = configured;
            this.explicitBaseTime = true;
        } else if (baseTime == null) {
            this.baseTime = Instant.now();
        }
        applyTemporalConfig(config);
    }

    @Override
    protected final void collectViolations(PatternConfig config, List<String> violations) {
        String timezone = config.getString(TIMEZONE, DEFAULT_TIMEZONE);
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            violations.add("Zona horaria no válida: '" + timezone + "'");
        }
        config.getInstant(BASE_TIME);
        collectTemporalViolations(config, violations);
    }

    @Override
    public double generate(GenerationContext context) {
        return generateAt(context.timestampOrNow());
    }

    @Override
    public List<SeriesPoint> generateSeries(Instant start, Instant end, TemporalAmount interval) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(interval, "interval");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("El fin de la serie (" + end + ") es anterior al inicio (" + start + ")");
        }

        List<SeriesPoint> series = new ArrayList<>();
        ZonedDateTime cursor = start.atZone(zone);
        while (!cursor.toInstant().isAfter(end)) {
            Instant timestamp = cursor.toInstant();
            series.add(new SeriesPoint(timestamp, generateAt(timestamp)));

            ZonedDateTime next = cursor.plus(interval);
            if (!next.isAfter(cursor)) {
                throw new IllegalArgumentException("El intervalo debe ser positivo: " + interval);
            }
            cursor = next;
        }
        return series;
    }

    @Override
    public void setBaseTime(Instant baseTime) {
        this.baseTime = Objects.requireNonNull(baseTime, "baseTime");
        this.explicitBaseTime = true;
    }

    public Instant getBaseTime() {
        return baseTime;
    }

    protected boolean hasExplicitBaseTime() {
        return explicitBaseTime;
    }

    public ZoneId getZone() {
        return zone;
    }

    protected ZonedDateTime local(Instant timestamp) {
        return timestamp.atZone(zone);
    }
}
