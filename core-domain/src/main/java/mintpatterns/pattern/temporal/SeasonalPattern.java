package mintpatterns.pattern.temporal;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Patrón estacional.
 * <p>
 * Responsabilidad: superponer a un valor base una oscilación cosenoidal cuyo máximo coincide con
 * los picos configurados dentro del ciclo (día, semana, mes o año), más una tendencia lineal
 * opcional por ciclo transcurrido.
 * <p>
 * La posición dentro del ciclo se normaliza a [0, 1) y la distancia a cada pico se mide dando la
 * vuelta al ciclo (diciembre queda a un mes de enero). Distancia 0 produce {@code +amplitud};
 * distancia 0.5 produce {@code -amplitud}.
 */
public class SeasonalPattern extends AbstractTemporalPattern {

    public static final String BASE_VALUE = "base_value";
    public static final String AMPLITUDE = "amplitude";
    public static final String AMPLITUDE_MODE = "amplitude_mode";
    public static final String PERIOD = "period";
    public static final String PEAKS = "peaks";
    public static final String TREND_RATE = "trend_rate";

    private static final double NOISE = 0.02;
    private static final double DEFAULT_PEAK_POSITION = 0.5;
    private static final List<Object> DEFAULT_PEAKS = List.of("december", "july");

    private static final Map<String, ParameterSpec> PARAMETERS = parameters();

    /**
     * Interpretación de {@code amplitude}: en unidades del valor o como fracción del valor base.
     */
    @Getter
    @RequiredArgsConstructor
    public enum AmplitudeMode {
        ABSOLUTE("absolute"),
        RELATIVE("relative");

        private final String code;

        public static Optional<AmplitudeMode> fromCode(String text) {
            if (text == null) {
                return Optional.empty();
            }
            return Arrays.stream(values())
                    .filter(mode -> mode.code.equalsIgnoreCase(text.trim()))
                    .findFirst();
        }
    }

    private double baseValue;
    private double amplitude;
    private AmplitudeMode amplitudeMode;
    private CyclePeriod period;
    private List<Object> peaks;
    private double trendRate;
    private Double min;
    private Double max;

    public SeasonalPattern() {
        this(PatternConfig.empty());
    }

    public SeasonalPattern(PatternConfig config) {
        super("Seasonal Pattern", "Genera valores con variaciones estacionales", PARAMETERS, config);
        initialize();
    }

    private static Map<String, ParameterSpec> parameters() {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put(BASE_VALUE, ParameterSpec.optional("float", 100.0, "Valor base alrededor del que oscila la serie"));
        parameters.put(AMPLITUDE, ParameterSpec.optional("float", 20.0, "Amplitud de la variación estacional"));
        parameters.put(AMPLITUDE_MODE, ParameterSpec.optional("string", "absolute", "absolute (unidades del valor) o relative (fracción de base_value)"));
        parameters.put(PERIOD, ParameterSpec.optional("string", "year", "Ciclo de la estacionalidad (day, week, month, year)"));
        parameters.put(PEAKS, ParameterSpec.optional("array", DEFAULT_PEAKS, "Picos del ciclo (p. ej. [\"december\", \"july\"] para el año)"));
        parameters.put(TREND_RATE, ParameterSpec.optional("float", 0.0, "Tendencia por ciclo transcurrido"));
        parameters.put(BASE_TIME, ParameterSpec.optional("datetime", "now", "Instante base de la tendencia"));
        parameters.put(MIN, ParameterSpec.optional("float", null, "Valor mínimo"));
        parameters.put(MAX, ParameterSpec.optional("float", null, "Valor máximo"));
        parameters.put(TIMEZONE, ParameterSpec.optional("string", DEFAULT_TIMEZONE, "Zona horaria del calendario"));
        return parameters;
    }

    @Override
    protected void applyTemporalConfig(PatternConfig config) {
        this.baseValue = config.getDouble(BASE_VALUE, 100.0);
        this.amplitude = config.getDouble(AMPLITUDE, 20.0);
        this.amplitudeMode = AmplitudeMode.fromCode(config.getString(AMPLITUDE_MODE, "absolute")).orElse(AmplitudeMode.ABSOLUTE);
        this.period = CyclePeriod.fromCode(config.getString(PERIOD, "year")).orElse(CyclePeriod.YEAR);
        this.peaks = config.getList(PEAKS, DEFAULT_PEAKS);
        this.trendRate = config.getDouble(TREND_RATE, 0.0);
        this.min = config.getNullableDouble(MIN);
        this.max = config.getNullableDouble(MAX);
    }

    @Override
    protected void collectTemporalViolations(PatternConfig config, List<String> violations) {
        String configuredPeriod = config.getString(PERIOD, "year");
        if (CyclePeriod.fromCode(configuredPeriod).isEmpty()) {
            violations.add("Periodo no válido: '" + configuredPeriod + "'");
        }
        String mode = config.getString(AMPLITUDE_MODE, "absolute");
        if (AmplitudeMode.fromCode(mode).isEmpty()) {
            violations.add("Modo de amplitud no válido: '" + mode + "'");
        }
        config.getDouble(BASE_VALUE, 100.0);
        config.getDouble(AMPLITUDE, 20.0);
        config.getDouble(TREND_RATE, 0.0);
        config.getList(PEAKS, DEFAULT_PEAKS);
        checkBounds(config, violations);
    }

    @Override
    public double generateAt(Instant timestamp) {
        ZonedDateTime local = local(timestamp);

        // 1. Componente estacional
        double seasonal = getEffectiveAmplitude() * Math.cos(2.0 * Math.PI * distanceToNearestPeak(local));

        // 2. Tendencia
        double trend = trendRate == 0.0 ? 0.0 : trendRate * period.getScale().between(getBaseTime(), timestamp);

        // 3. Ruido ±2%
        double value = (baseValue + seasonal + trend) * jitter(NOISE);
        return clamp(value, min, max);
    }

    public double generateForDate(Instant date) {
        return generateAt(date);
    }

    /**
     * Valor para una fecha de calendario, a medianoche en la zona del patrón.
     */
    public double generateForDate(LocalDate date) {
        return generateAt(date.atStartOfDay(getZone()).toInstant());
    }

    public double getEffectiveAmplitude() {
        return amplitudeMode == AmplitudeMode.RELATIVE ? amplitude * baseValue : amplitude;
    }

    @Override
    public Optional<CyclePeriod> getPeriod() {
        return Optional.of(period);
    }

    double distanceToNearestPeak(ZonedDateTime local) {
        double position = positionInPeriod(local);
        double nearest = 1.0;
        for (double peak : peakPositions(local)) {
            double gap = Math.abs(position - peak);
            nearest = Math.min(nearest, Math.min(gap, 1.0 - gap));
        }
        return nearest;
    }

    /**
     * Posición del instante dentro del ciclo, en [0, 1).
     */
    double positionInPeriod(ZonedDateTime local) {
        switch (period) {
            case DAY:
                return local.toLocalTime().toSecondOfDay() / 86_400.0;
            case WEEK:
                double dayOfWeek = (local.getDayOfWeek().getValue() - 1) / 7.0;
                double timeOfDay = (local.getHour() * 3_600 + local.getMinute() * 60) / 86_400.0;
                return dayOfWeek + timeOfDay / 7.0;
            case MONTH:
                return (local.getDayOfMonth() - 1) / (double) local.toLocalDate().lengthOfMonth();
            case YEAR:
            default:
                return (local.getDayOfYear() - 1) / (double) local.toLocalDate().lengthOfYear();
        }
    }

    /**
     * Posiciones de los picos válidos; los no reconocidos se ignoran y, si no queda ninguno,
     * el pico se sitúa a mitad de ciclo.
     */
    List<Double> peakPositions(ZonedDateTime local) {
        List<Double> positions = new ArrayList<>();
        for (Object peak : peaks) {
            peakPosition(peak, local).ifPresent(positions::add);
        }
        if (positions.isEmpty()) {
            positions.add(DEFAULT_PEAK_POSITION);
        }
        return positions;
    }

    private OptionalDouble peakPosition(Object peak, ZonedDateTime local) {
        OptionalDouble numeric = asNumber(peak);
        switch (period) {
            case DAY:
                // Hora del día (0-23)
                return numeric.isPresent() ? OptionalDouble.of(numeric.getAsDouble() / 24.0) : OptionalDouble.empty();
            case WEEK:
                // Nombre del día o número ISO (1 = lunes)
                Optional<DayOfWeek> day = Arrays.stream(DayOfWeek.values())
                        .filter(d -> d.name().equalsIgnoreCase(String.valueOf(peak).trim()))
                        .findFirst();
                if (day.isPresent()) {
                    return OptionalDouble.of((day.get().getValue() - 1) / 7.0);
                }
                return numeric.isPresent() ? OptionalDouble.of((numeric.getAsDouble() - 1) / 7.0) : OptionalDouble.empty();
            case MONTH:
                // Día del mes, sobre la longitud real del mes del instante
                return numeric.isPresent()
                        ? OptionalDouble.of((numeric.getAsDouble() - 1) / local.toLocalDate().lengthOfMonth())
                        : OptionalDouble.empty();
            case YEAR:
            default:
                // Nombre del mes o número (1 = enero)
                Optional<Month> month = Arrays.stream(Month.values())
                        .filter(m -> m.name().equalsIgnoreCase(String.valueOf(peak).trim()))
                        .findFirst();
                if (month.isPresent()) {
                    return OptionalDouble.of((month.get().getValue() - 1) / 12.0);
                }
                return numeric.isPresent() ? OptionalDouble.of((numeric.getAsDouble() - 1) / 12.0) : OptionalDouble.empty();
        }
    }

    private static OptionalDouble asNumber(Object peak) {
        if (peak instanceof Number) {
            return OptionalDouble.of(((Number) peak).doubleValue());
        }
        if (peak instanceof String && ((String) peak).trim().matches("-?\\d+(\\.\\d+)?")) {
            return OptionalDouble.of(Double.parseDouble(((String) peak).trim()));
        }
        return OptionalDouble.empty();
    }
}
