package mintpatterns.pattern.temporal;

import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Crecimiento lineal desde el instante base: {@code initial_value + growth_rate · Δt},
 * con Δt medido en {@code time_unit} y un ruido multiplicativo de ±5%.
 */
public class LinearGrowth extends AbstractTemporalPattern {

    public static final String INITIAL_VALUE = "initial_value";
    public static final String GROWTH_RATE = "growth_rate";
    public static final String TIME_UNIT = "time_unit";

    private static final double NOISE = 0.05;

    private static final Map<String, ParameterSpec> PARAMETERS = parameters();

    private double initialValue;
    private double growthRate;
    private TimeScale timeUnit;
    private Double min;
    private Double max;

    public LinearGrowth() {
        this(PatternConfig.empty());
    }

    public LinearGrowth(PatternConfig config) {
        super("Linear Growth", "Genera valores con crecimiento lineal en el tiempo", PARAMETERS, config);
        initialize();
    }

    private static Map<String, ParameterSpec> parameters() {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put(INITIAL_VALUE, ParameterSpec.optional("float", 100.0, "Valor inicial"));
        parameters.put(GROWTH_RATE, ParameterSpec.optional("float", 1.0, "Crecimiento por unidad de tiempo"));
        parameters.put(TIME_UNIT, ParameterSpec.optional("string", "day", "Unidad de tiempo (second, minute, hour, day, week, month, year)"));
        parameters.put(BASE_TIME, ParameterSpec.optional("datetime", "now", "Instante base del cálculo"));
        parameters.put(MIN, ParameterSpec.optional("float", null, "Valor mínimo"));
        parameters.put(MAX, ParameterSpec.optional("float", null, "Valor máximo"));
        parameters.put(TIMEZONE, ParameterSpec.optional("string", DEFAULT_TIMEZONE, "Zona horaria del calendario"));
        return parameters;
    }

    @Override
    protected void applyTemporalConfig(PatternConfig config) {
        this.initialValue = config.getDouble(INITIAL_VALUE, 100.0);
        this.growthRate = config.getDouble(GROWTH_RATE, 1.0);
        this.timeUnit = TimeScale.fromCode(config.getString(TIME_UNIT, "day")).orElse(TimeScale.DAY);
        this.min = config.getNullableDouble(MIN);
        this.max = config.getNullableDouble(MAX);
    }

    @Override
    protected void collectTemporalViolations(PatternConfig config, List<String> violations) {
        String unit = config.getString(TIME_UNIT, "day");
        if (TimeScale.fromCode(unit).isEmpty()) {
            violations.add("Unidad de tiempo no válida: '" + unit + "'");
        }
        config.getDouble(INITIAL_VALUE, 100.0);
        config.getDouble(GROWTH_RATE, 1.0);
        checkBounds(config, violations);
    }

    @Override
    public double generateAt(Instant timestamp) {
        double elapsed = timeUnit.between(getBaseTime(), timestamp);
        double value = initialValue + growthRate * elapsed;
        value *= jitter(NOISE);
        return clamp(value, min, max);
    }

    @Override
    public Optional<CyclePeriod> getPeriod() {
        return Optional.empty();
    }

    public TimeScale getTimeUnit() {
        return timeUnit;
    }
}
