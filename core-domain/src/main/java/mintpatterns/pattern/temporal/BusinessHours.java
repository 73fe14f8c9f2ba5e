package mintpatterns.pattern.temporal;

import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Actividad en horario laboral.
 * <ul>
 * <li>Día no laborable o fuera de {@code [start, end)}: valor valle ±20%.</li>
 * <li>A menos de una hora de una hora punta: valor pico ±10%.</li>
 * <li>Resto del horario laboral: punto medio entre pico y valle ±15%.</li>
 * </ul>
 * Las horas se evalúan en la zona horaria configurada.
 */
public class BusinessHours extends AbstractTemporalPattern {

    public static final String PEAK_VALUE = "peak_value";
    public static final String OFF_PEAK_VALUE = "off_peak_value";
    public static final String BUSINESS_HOURS = "business_hours";
    public static final String BUSINESS_DAYS = "business_days";
    public static final String PEAK_HOURS = "peak_hours";

    private static final Map<String, Object> DEFAULT_BUSINESS_HOURS = Map.of("start", 9, "end", 17);
    private static final List<Double> DEFAULT_BUSINESS_DAYS = List.of(1.0, 2.0, 3.0, 4.0, 5.0);
    private static final List<Double> DEFAULT_PEAK_HOURS = List.of(12.0, 14.0, 16.0);

    private static final double PEAK_NOISE = 0.10;
    private static final double BUSINESS_NOISE = 0.15;
    private static final double OFF_PEAK_NOISE = 0.20;

    private static final Map<String, ParameterSpec> PARAMETERS = parameters();

    private double peakValue;
    private double offPeakValue;
    private double openingHour;
    private double closingHour;
    private Set<Integer> businessDays;
    private List<Double> peakHours;

    public BusinessHours() {
        this(PatternConfig.empty());
    }

    public BusinessHours(PatternConfig config) {
        super("Business Hours Pattern", "Genera valores según el horario laboral y sus horas punta", PARAMETERS, config);
        initialize();
    }

    private static Map<String, ParameterSpec> parameters() {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put(PEAK_VALUE, ParameterSpec.optional("float", 100.0, "Valor en horas punta"));
        parameters.put(OFF_PEAK_VALUE, ParameterSpec.optional("float", 10.0, "Valor fuera del horario laboral"));
        parameters.put(BUSINESS_HOURS, ParameterSpec.optional("object", DEFAULT_BUSINESS_HOURS, "Horario laboral {start, end} en horas"));
        parameters.put(BUSINESS_DAYS, ParameterSpec.optional("array", DEFAULT_BUSINESS_DAYS, "Días laborables (ISO: 1 = lunes, 7 = domingo)"));
        parameters.put(PEAK_HOURS, ParameterSpec.optional("array", DEFAULT_PEAK_HOURS, "Horas punta dentro del horario laboral"));
        parameters.put(TIMEZONE, ParameterSpec.optional("string", DEFAULT_TIMEZONE, "Zona horaria del horario laboral"));
        return parameters;
    }

    @Override
    protected void applyTemporalConfig(PatternConfig config) {
        this.peakValue = config.getDouble(PEAK_VALUE, 100.0);
        this.offPeakValue = config.getDouble(OFF_PEAK_VALUE, 10.0);

        PatternConfig hours = PatternConfig.from(config.getMap(BUSINESS_HOURS, DEFAULT_BUSINESS_HOURS));
        this.openingHour = hours.getDouble("start", 9.0);
        this.closingHour = hours.getDouble("end", 17.0);

        Set<Integer> days = new TreeSet<>();
        for (Double day : config.getDoubleList(BUSINESS_DAYS, DEFAULT_BUSINESS_DAYS)) {
            days.add(day.intValue());
        }
        this.businessDays = days;
        this.peakHours = config.getDoubleList(PEAK_HOURS, DEFAULT_PEAK_HOURS);
    }

    @Override
    protected void collectTemporalViolations(PatternConfig config, List<String> violations) {
        config.getDouble(PEAK_VALUE, 100.0);
        config.getDouble(OFF_PEAK_VALUE, 10.0);

        PatternConfig hours = PatternConfig.from(config.getMap(BUSINESS_HOURS, DEFAULT_BUSINESS_HOURS));
        double start = hours.getDouble("start", 9.0);
        double end = hours.getDouble("end", 17.0);
        if (start < 0 || end > 24 || start >= end) {
            violations.add("Horario laboral no válido: [" + start + ", " + end + ")");
        }

        for (Double day : config.getDoubleList(BUSINESS_DAYS, DEFAULT_BUSINESS_DAYS)) {
            if (day < 1 || day > 7) {
                violations.add("Día laborable fuera de rango (1-7): " + day);
            }
        }
        config.getDoubleList(PEAK_HOURS, DEFAULT_PEAK_HOURS);
    }

    @Override
    public double generateAt(Instant timestamp) {
        ZonedDateTime local = local(timestamp);

        if (!businessDays.contains(local.getDayOfWeek().getValue())) {
            return offPeakValue * jitter(OFF_PEAK_NOISE);
        }

        double currentTime = local.getHour() + local.getMinute() / 60.0;
        if (currentTime < openingHour || currentTime >= closingHour) {
            return offPeakValue * jitter(OFF_PEAK_NOISE);
        }

        for (double peakHour : peakHours) {
            if (Math.abs(currentTime - peakHour) < 1.0) {
                return peakValue * jitter(PEAK_NOISE);
            }
        }

        return (peakValue + offPeakValue) / 2.0 * jitter(BUSINESS_NOISE);
    }

    /**
     * Nivel de actividad normalizado {@code (valor - valle) / (pico - valle)}; 0.5 si pico y valle coinciden.
     * Consume una muestra del generador aleatorio.
     */
    public double getActivityLevel(Instant timestamp) {
        double value = generateAt(timestamp);
        double range = peakValue - offPeakValue;
        if (range == 0.0) {
            return 0.5;
        }
        return (value - offPeakValue) / range;
    }

    @Override
    public Optional<CyclePeriod> getPeriod() {
        return Optional.of(CyclePeriod.WEEK);
    }

    public Set<Integer> getBusinessDays() {
        return Set.copyOf(businessDays);
    }
}
