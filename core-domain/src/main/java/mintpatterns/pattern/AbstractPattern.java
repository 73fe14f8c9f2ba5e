package mintpatterns.pattern;

import lombok.extern.slf4j.Slf4j;
import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.domain.exception.PatternConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Comportamiento base de los generadores: ciclo de vida del generador aleatorio sembrado,
 * almacenamiento y fusión de la configuración, validación y acotado de valores.
 * <p>
 * Las subclases declaran su esquema de parámetros en el constructor, leen la configuración
 * en {@link #applyConfig(PatternConfig)} y deben llamar a {@link #initialize()} al final
 * de su propio constructor (después de que sus campos estén inicializados).
 */
@Slf4j
public abstract class AbstractPattern implements Pattern {

    public static final String MIN = "min";
    public static final String MAX = "max";

    private final String name;
    private final String description;
    private final Map<String, ParameterSpec> parameters;

    private PatternConfig config;
    private Long seed;
    private final Random random;

    protected AbstractPattern(String name, String description, Map<String, ParameterSpec> parameters, PatternConfig config) {
        this.name = name;
        this.description = description;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.config = config == null ? PatternConfig.empty() : config;

        OptionalLong configuredSeed = this.config.getSeed();
        if (configuredSeed.isPresent()) {
            this.seed = configuredSeed.getAsLong();
            this.random = new Random(this.seed);
        } else {
            this.random = new Random();
        }
    }

    /**
     * Valida la configuración inicial y la aplica. Debe invocarse al final del constructor concreto.
     *
     * @throws PatternConfigurationException si la configuración no es válida.
     */
    protected final void initialize() {
        requireValid(config);
        applyConfig(config);
    }

    /**
     * Lee los parámetros (ya validados) a los campos del patrón.
     */
    protected abstract void applyConfig(PatternConfig config);

    /**
     * Validación específica del patrón. Los errores de tipo que lancen los accesores de
     * {@link PatternConfig} se convierten en violaciones.
     */
    protected void collectViolations(PatternConfig config, List<String> violations) {
    }

    @Override
    public final boolean validate(PatternConfig candidate) {
        return findViolations(candidate).isEmpty();
    }

    @Override
    public List<String> findViolations(PatternConfig candidate) {
        PatternConfig target = candidate == null ? PatternConfig.empty() : candidate;
        List<String> violations = new ArrayList<>();

        parameters.forEach((key, spec) -> {
            if (spec.required() && !target.has(key)) {
                violations.add("Falta el parámetro obligatorio '" + key + "'");
            }
        });

        try {
            target.getSeed();
            collectViolations(target, violations);
        } catch (PatternConfigurationException e) {
            violations.add(e.getMessage());
        }
        return violations;
    }

    protected final void requireValid(PatternConfig candidate) {
        List<String> violations = findViolations(candidate);
        if (!violations.isEmpty()) {
            throw new PatternConfigurationException(name, description, parameters, violations);
        }
    }

    @Override
    public void setConfig(PatternConfig update) {
        PatternConfig merged = config.merge(update);
        requireValid(merged);
        this.config = merged;

        if (update != null && update.has(PatternConfig.SEED)) {
            this.seed = update.getSeed().getAsLong();
            this.random.setSeed(this.seed);
            log.debug("Patrón '{}' resembrado con semilla {}", name, seed);
        }
        applyConfig(merged);
    }

    @Override
    public void reset() {
        if (seed != null) {
            random.setSeed(seed);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public Map<String, ParameterSpec> getParameters() {
        return parameters;
    }

    @Override
    public PatternConfig getConfig() {
        return config;
    }

    public boolean isSeeded() {
        return seed != null;
    }

    // --- Fuente aleatoria ---

    protected Random random() {
        return random;
    }

    /**
     * Uniforme en [0, 1).
     */
    protected double nextUniform() {
        return random.nextDouble();
    }

    /**
     * Uniforme en el intervalo abierto (0, 1), apto para logaritmos y potencias negativas.
     */
    protected double nextOpenUniform() {
        double u;
        do {
            u = random.nextDouble();
        } while (u == 0.0);
        return u;
    }

    protected double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    /**
     * Factor multiplicativo de ruido uniforme en [1 - spread, 1 + spread).
     */
    protected double jitter(double spread) {
        return uniform(1.0 - spread, 1.0 + spread);
    }

    /**
     * Normal estándar mediante la transformación de Box-Muller.
     * u1 en (0, 1) para evitar ln(0); u2 en [0, 1).
     */
    protected double nextStandardNormal() {
        double u1 = nextOpenUniform();
        double u2 = nextUniform();
        return Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
    }

    // --- Utilidades de validación y acotado ---

    /**
     * Acota un valor solo por los lados configurados; un límite {@code null} no se aplica.
     */
    public static double clamp(double value, Double min, Double max) {
        if (min != null && value < min) {
            return min;
        }
        if (max != null && value > max) {
            return max;
        }
        return value;
    }

    protected static void checkBounds(PatternConfig config, List<String> violations) {
        Double min = config.getNullableDouble(MIN);
        Double max = config.getNullableDouble(MAX);
        if (min != null && max != null && min >= max) {
            violations.add("'min' (" + min + ") debe ser menor que 'max' (" + max + ")");
        }
    }

    protected static void checkStrictlyPositive(PatternConfig config, String key, List<String> violations) {
        Double value = config.getNullableDouble(key);
        if (value != null && !(value > 0)) {
            violations.add("'" + key + "' debe ser estrictamente positivo, recibido " + value);
        }
    }
}
