package mintpatterns.pattern.temporal;

import lombok.extern.slf4j.Slf4j;
import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.pattern.GenerationContext;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Actividad semanal: pesos por día de la semana (0 = domingo) y por hora del día.
 * <p>
 * {@link #generateTimestamp(GenerationContext)} genera instantes dentro de una ventana mediante
 * muestreo por rechazo: cada candidato uniforme se acepta con probabilidad
 * {@code peso(día) · peso(hora)}. El bucle es iterativo y acotado por {@code max_attempts};
 * si se agota, devuelve el último candidato.
 */
@Slf4j
public class WeeklyPattern extends AbstractTemporalPattern {

    public static final String WEEKDAY_WEIGHTS = "weekday_weights";
    public static final String HOURLY_WEIGHTS = "hourly_weights";
    public static final String MAX_ATTEMPTS = "max_attempts";

    private static final List<Double> DEFAULT_WEEKDAY_WEIGHTS = List.of(0.6, 1.0, 1.0, 1.0, 1.0, 0.9, 0.7);
    private static final List<Double> DEFAULT_HOURLY_WEIGHTS = Collections.nCopies(24, 1.0);
    private static final int DEFAULT_MAX_ATTEMPTS = 1000;
    private static final Duration DEFAULT_WINDOW = Duration.ofDays(7);

    private static final Map<String, ParameterSpec> PARAMETERS = parameters();

    private List<Double> weekdayWeights;
    private List<Double> hourlyWeights;
    private int maxAttempts;

    public WeeklyPattern() {
        this(PatternConfig.empty());
    }

    public WeeklyPattern(PatternConfig config) {
        super("Weekly Pattern", "Genera valores e instantes según la actividad semanal", PARAMETERS, config);
        initialize();
    }

    private static Map<String, ParameterSpec> parameters() {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put(WEEKDAY_WEIGHTS, ParameterSpec.optional("array", DEFAULT_WEEKDAY_WEIGHTS, "Pesos por día de la semana (0 = domingo, 6 = sábado)"));
        parameters.put(HOURLY_WEIGHTS, ParameterSpec.optional("array", DEFAULT_HOURLY_WEIGHTS, "Pesos por hora del día (0-23)"));
        parameters.put(MAX_ATTEMPTS, ParameterSpec.optional("int", DEFAULT_MAX_ATTEMPTS, "Intentos máximos del muestreo por rechazo"));
        parameters.put(BASE_TIME, ParameterSpec.optional("datetime", "now", "Fin por defecto de la ventana de muestreo"));
        parameters.put(TIMEZONE, ParameterSpec.optional("string", DEFAULT_TIMEZONE, "Zona horaria del calendario"));
        return parameters;
    }

    @Override
    protected void applyTemporalConfig(PatternConfig config) {
        this.weekdayWeights = List.copyOf(config.getDoubleList(WEEKDAY_WEIGHTS, DEFAULT_WEEKDAY_WEIGHTS));
        this.hourlyWeights = List.copyOf(config.getDoubleList(HOURLY_WEIGHTS, DEFAULT_HOURLY_WEIGHTS));
        this.maxAttempts = config.getInt(MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);
    }

    @Override
    protected void collectTemporalViolations(PatternConfig config, List<String> violations) {
        checkWeights(WEEKDAY_WEIGHTS, config.getDoubleList(WEEKDAY_WEIGHTS, DEFAULT_WEEKDAY_WEIGHTS), 7, violations);
        checkWeights(HOURLY_WEIGHTS, config.getDoubleList(HOURLY_WEIGHTS, DEFAULT_HOURLY_WEIGHTS), 24, violations);
        if (config.getInt(MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS) < 1) {
            violations.add("'" + MAX_ATTEMPTS + "' debe ser al menos 1");
        }
    }

    private static void checkWeights(String key, List<Double> weights, int expectedSize, List<String> violations) {
        if (weights.size() != expectedSize) {
            violations.add("'" + key + "' debe tener " + expectedSize + " pesos, tiene " + weights.size());
            return;
        }
        boolean anyPositive = false;
        for (double weight : weights) {
            if (weight < 0 || Double.isNaN(weight)) {
                violations.add("'" + key + "' no admite pesos negativos: " + weight);
                return;
            }
            anyPositive |= weight > 0;
        }
        if (!anyPositive) {
            violations.add("'" + key + "' no puede tener todos los pesos a cero");
        }
    }

    /**
     * Peso combinado (día · hora) del instante.
     */
    @Override
    public double generateAt(Instant timestamp) {
        return getValueForPeriod(timestamp);
    }

    public double getValueForPeriod(Instant timestamp) {
        ZonedDateTime local = local(timestamp);
        return weekdayWeights.get(weekdayIndex(local)) * hourlyWeights.get(local.getHour());
    }

    /**
     * @param weekdayIndex 0 = domingo ... 6 = sábado.
     */
    public double getValueForPeriod(int weekdayIndex) {
        if (weekdayIndex < 0 || weekdayIndex > 6) {
            throw new IllegalArgumentException("Índice de día fuera de rango (0-6): " + weekdayIndex);
        }
        return weekdayWeights.get(weekdayIndex);
    }

    /**
     * Genera un instante en {@code [windowStart, windowEnd]} del contexto. Sin ventana, usa la
     * semana anterior al instante base (si se configuró) o a ahora.
     */
    public Instant generateTimestamp(GenerationContext context) {
        Instant end = context.windowEnd() != null
                ? context.windowEnd()
                : (hasExplicitBaseTime() ? getBaseTime() : Instant.now());
        Instant start = context.windowStart() != null ? context.windowStart() : end.minus(DEFAULT_WINDOW);
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("El fin de la ventana (" + end + ") es anterior al inicio (" + start + ")");
        }

        long spanMillis = Duration.between(start, end).toMillis();
        Instant candidate = start;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            candidate = start.plusMillis((long) Math.floor(nextUniform() * (spanMillis + 1)));
            if (nextUniform() < getValueForPeriod(candidate)) {
                return candidate;
            }
        }
        log.debug("Patrón '{}': {} intentos agotados, se devuelve el último candidato {}", getName(), maxAttempts, candidate);
        return candidate;
    }

    public List<Instant> generateTimestamps(int count, GenerationContext context) {
        if (count < 0) {
            throw new IllegalArgumentException("El número de instantes no puede ser negativo: " + count);
        }
        List<Instant> timestamps = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            timestamps.add(generateTimestamp(context));
        }
        return timestamps;
    }

    /**
     * @return índices (0 = domingo) de los días con el peso máximo.
     */
    public List<Integer> getPeakDays() {
        return indicesOfMax(weekdayWeights);
    }

    public List<Integer> getPeakHours() {
        return indicesOfMax(hourlyWeights);
    }

    public List<Double> getWeekdayWeights() {
        return weekdayWeights;
    }

    public List<Double> getHourlyWeights() {
        return hourlyWeights;
    }

    @Override
    public Optional<CyclePeriod> getPeriod() {
        return Optional.of(CyclePeriod.WEEK);
    }

    private static int weekdayIndex(ZonedDateTime local) {
        // DayOfWeek es ISO (1 = lunes, 7 = domingo)
        return local.getDayOfWeek().getValue() % 7;
    }

    private static List<Integer> indicesOfMax(List<Double> weights) {
        double max = Collections.max(weights);
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < weights.size(); i++) {
            if (weights.get(i) == max) {
                indices.add(i);
            }
        }
        return indices;
    }
}
