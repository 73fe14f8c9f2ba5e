package mintpatterns.factory;

import lombok.extern.slf4j.Slf4j;
import mintpatterns.config.EngineConfig;
import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.domain.exception.PatternConfigurationException;
import mintpatterns.domain.exception.PatternNotFoundException;
import mintpatterns.pattern.CompositePattern;
import mintpatterns.pattern.Pattern;
import mintpatterns.pattern.distribution.ExponentialDistribution;
import mintpatterns.pattern.distribution.NormalDistribution;
import mintpatterns.pattern.distribution.ParetoDistribution;
import mintpatterns.pattern.distribution.PoissonDistribution;
import mintpatterns.pattern.temporal.AbstractTemporalPattern;
import mintpatterns.pattern.temporal.BusinessHours;
import mintpatterns.pattern.temporal.LinearGrowth;
import mintpatterns.pattern.temporal.SeasonalPattern;
import mintpatterns.pattern.temporal.WeeklyPattern;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Random;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Registro de patrones por nombre.
 * <p>
 * Cada nombre guarda una fábrica (se crea una instancia nueva en cada {@link #create}) o una
 * instancia compartida (se devuelve siempre la misma). Los nombres usan espacios de nombres
 * separados por puntos ({@code distribution.normal}); los alias resuelven a un nombre canónico.
 * <p>
 * Los patrones creados por fábrica reciben los valores por defecto de {@link EngineConfig}
 * (semilla y, para la categoría {@code temporal}, zona horaria) cuando su configuración no los declara.
 * Los sub-patrones de un compuesto sembrado reciben semillas distintas derivadas de la del compuesto.
 * <p>
 * No es thread-safe: se espera que el registro se prepare al arrancar y después solo se lea.
 */
@Slf4j
public class PatternRegistry {

    public static final String DISTRIBUTION_CATEGORY = "distribution";
    public static final String TEMPORAL_CATEGORY = "temporal";
    public static final String COMPOSITE = "composite";

    static final String DEFINITION_CONFIG = "config";
    static final String DEFINITION_NAME = "name";
    static final String DEFINITION_WEIGHT = "weight";
    static final String COMPOSITE_PATTERNS = "patterns";

    private static final String SEPARATOR = ".";

    private record Registration(PatternFactory factory, Pattern instance, boolean builtIn) {
    }

    private record Metadata(String description, Map<String, ParameterSpec> parameters) {
        static Metadata of(Pattern pattern) {
            return new Metadata(pattern.getDescription(), pattern.getParameters());
        }
    }

    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    // Descripción y esquema del último patrón creado por fábrica, para info()
    private final Map<String, Metadata> metadata = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final EngineConfig engineConfig;

    public PatternRegistry() {
        this(EngineConfig.defaults());
    }

    public PatternRegistry(EngineConfig engineConfig) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig");
        registerBuiltIns();
    }

    private void registerBuiltIns() {
        registerBuiltIn("distribution.normal", NormalDistribution::new);
        registerBuiltIn("distribution.pareto", ParetoDistribution::new);
        registerBuiltIn("distribution.poisson", PoissonDistribution::new);
        registerBuiltIn("distribution.exponential", ExponentialDistribution::new);

        registerBuiltIn("temporal.linear", LinearGrowth::new);
        registerBuiltIn("temporal.seasonal", SeasonalPattern::new);
        registerBuiltIn("temporal.business_hours", BusinessHours::new);
        registerBuiltIn("temporal.weekly", WeeklyPattern::new);

        registerBuiltIn(COMPOSITE, this::createComposite);

        alias("normal", "distribution.normal");
        alias("bell_curve", "distribution.normal");
        alias("gaussian", "distribution.normal");
        alias("pareto", "distribution.pareto");
        alias("80-20", "distribution.pareto");
        alias("poisson", "distribution.poisson");
        alias("exponential", "distribution.exponential");
        alias("linear", "temporal.linear");
        alias("growth", "temporal.linear");
        alias("seasonal", "temporal.seasonal");
        alias("business_hours", "temporal.business_hours");
        alias("working_hours", "temporal.business_hours");
        alias("weekly", "temporal.weekly");
    }

    private void registerBuiltIn(String name, PatternFactory factory) {
        registrations.put(name, new Registration(factory, null, true));
    }

    // --- Registro ---

    /**
     * Registra una clase de patrón. Debe implementar {@link Pattern}, ser concreta y ofrecer un
     * constructor público {@code (PatternConfig)}.
     *
     * @throws PatternConfigurationException si la clase no cumple esos requisitos.
     */
    public void register(String name, Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (!Pattern.class.isAssignableFrom(type)) {
            throw new PatternConfigurationException("La clase " + type.getName() + " no implementa " + Pattern.class.getSimpleName());
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new PatternConfigurationException("La clase " + type.getName() + " no es instanciable");
        }

        Constructor<?> constructor;
        try {
            constructor = type.getConstructor(PatternConfig.class);
        } catch (NoSuchMethodException e) {
            throw new PatternConfigurationException("La clase " + type.getName() + " no tiene un constructor público (PatternConfig)", e);
        }
        register(name, config -> instantiate(constructor, config));
    }

    public void register(String name, PatternFactory factory) {
        Objects.requireNonNull(factory, "factory");
        put(name, new Registration(factory, null, false));
    }

    /**
     * Registra una instancia compartida: {@link #create} la devolverá siempre, ignorando la configuración.
     */
    public void register(String name, Pattern instance) {
        Objects.requireNonNull(instance, "instance");
        put(name, new Registration(null, instance, false));
    }

    private void put(String name, Registration registration) {
        requireName(name);
        if (aliases.containsKey(name)) {
            throw new PatternConfigurationException("'" + name + "' ya es un alias de '" + aliases.get(name) + "'");
        }
        Registration previous = registrations.put(name, registration);
        metadata.remove(name);
        if (previous != null) {
            log.debug("Patrón '{}' sustituido", name);
        } else {
            log.debug("Patrón '{}' registrado", name);
        }
    }

    /**
     * @throws PatternNotFoundException si {@code name} no está registrado.
     */
    public void alias(String alias, String name) {
        requireName(alias);
        if (registrations.containsKey(alias)) {
            throw new PatternConfigurationException("'" + alias + "' ya está registrado como patrón");
        }
        String canonical = resolve(name);
        aliases.put(alias, canonical);
        log.debug("Alias '{}' -> '{}'", alias, canonical);
    }

    /**
     * Elimina un patrón (y los alias que apuntaban a él) o, si {@code name} es un alias, solo el alias.
     *
     * @return {@code true} si había algo que eliminar.
     */
    public boolean remove(String name) {
        if (aliases.remove(name) != null) {
            log.debug("Alias '{}' eliminado", name);
            return true;
        }
        if (registrations.remove(name) == null) {
            return false;
        }
        metadata.remove(name);
        aliases.values().removeIf(name::equals);
        log.debug("Patrón '{}' eliminado", name);
        return true;
    }

    // --- Consulta ---

    public boolean has(String name) {
        return name != null && (registrations.containsKey(name) || aliases.containsKey(name));
    }

    /**
     * Resuelve un nombre o alias a su nombre canónico.
     *
     * @throws PatternNotFoundException si no existe.
     */
    public String resolve(String name) {
        if (name != null && registrations.containsKey(name)) {
            return name;
        }
        String canonical = name == null ? null : aliases.get(name);
        if (canonical == null) {
            throw new PatternNotFoundException(name);
        }
        return canonical;
    }

    /**
     * Describe un patrón registrado. No falla aunque el patrón tenga parámetros obligatorios:
     * en ese caso el esquema se obtiene de la validación rechazada o del último patrón creado.
     *
     * @throws PatternNotFoundException si el nombre no existe.
     */
    public PatternInfo info(String name) {
        String canonical = resolve(name);
        Registration registration = registrations.get(canonical);
        Metadata sample = describe(canonical, registration);

        List<String> aliasesOf = aliases.entrySet().stream()
                .filter(entry -> entry.getValue().equals(canonical))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        return new PatternInfo(canonical, sample.description(), sample.parameters(), aliasesOf, registration.builtIn());
    }

    private Metadata describe(String canonical, Registration registration) {
        if (registration.instance() != null) {
            return Metadata.of(registration.instance());
        }
        Metadata cached = metadata.get(canonical);
        if (cached != null) {
            return cached;
        }
        try {
            Metadata created = Metadata.of(registration.factory().create(PatternConfig.empty()));
            metadata.put(canonical, created);
            return created;
        } catch (PatternConfigurationException e) {
            log.debug("'{}' no admite la configuración vacía ({}); se describe con el esquema de la validación",
                    canonical, e.getViolations());
            return new Metadata(e.getPatternDescription(), e.getParameters());
        }
    }

    /**
     * @return nombres canónicos, en orden alfabético.
     */
    public List<String> all() {
        return registrations.keySet().stream().sorted().collect(Collectors.toList());
    }

    public Map<String, String> aliases() {
        return Collections.unmodifiableMap(aliases);
    }

    /**
     * @param category prefijo de espacio de nombres, con o sin punto final ({@code "temporal"}).
     */
    public List<String> getByCategory(String category) {
        String prefix = category.endsWith(SEPARATOR) ? category : category + SEPARATOR;
        return registrations.keySet().stream()
                .filter(name -> name.startsWith(prefix))
                .sorted()
                .collect(Collectors.toList());
    }

    public SortedSet<String> getCategories() {
        SortedSet<String> categories = new TreeSet<>();
        for (String name : registrations.keySet()) {
            int separator = name.indexOf(SEPARATOR);
            if (separator > 0) {
                categories.add(name.substring(0, separator));
            }
        }
        return categories;
    }

    public EngineConfig getEngineConfig() {
        return engineConfig;
    }

    // --- Creación ---

    public Pattern create(String name) {
        return create(name, PatternConfig.empty());
    }

    /**
     * Crea un patrón resolviendo alias. Las instancias compartidas se devuelven tal cual.
     *
     * @throws PatternNotFoundException      si el nombre no existe.
     * @throws PatternConfigurationException si la configuración no es válida para el patrón.
     */
    public Pattern create(String name, PatternConfig config) {
        String canonical = resolve(name);
        Registration registration = registrations.get(canonical);
        PatternConfig requested = config == null ? PatternConfig.empty() : config;

        if (registration.instance() != null) {
            if (!requested.isEmpty()) {
                log.warn("'{}' es una instancia compartida; se ignora la configuración {}", canonical, requested.keys());
            }
            return registration.instance();
        }
        Pattern created = registration.factory().create(withEngineDefaults(canonical, requested));
        metadata.put(canonical, Metadata.of(created));
        return created;
    }

    /**
     * Crea el patrón por defecto de una categoría ({@code distribution} o {@code temporal}).
     */
    public Pattern createDefault(String category) {
        if (DISTRIBUTION_CATEGORY.equals(category)) {
            return create(engineConfig.defaultDistribution());
        }
        if (TEMPORAL_CATEGORY.equals(category)) {
            return create(engineConfig.defaultTemporal());
        }
        throw new PatternNotFoundException(category);
    }

    /**
     * Crea un patrón a partir de una definición {@code {type, ...parámetros}}. Los parámetros
     * pueden ir también anidados bajo {@code config}; estos prevalecen sobre los del nivel superior.
     *
     * @throws PatternConfigurationException si falta {@code type}.
     */
    public Pattern load(Map<String, ?> definition) {
        Object type = definition.get(PatternConfig.TYPE);
        if (type == null) {
            throw new PatternConfigurationException("La definición de patrón no tiene '" + PatternConfig.TYPE + "'");
        }

        Map<String, Object> parameters = new LinkedHashMap<>(definition);
        parameters.remove(PatternConfig.TYPE);
        Object nested = parameters.remove(DEFINITION_CONFIG);
        if (nested instanceof Map) {
            ((Map<?, ?>) nested).forEach((key, value) -> parameters.put(String.valueOf(key), value));
        } else if (nested != null) {
            throw new PatternConfigurationException("'" + DEFINITION_CONFIG + "' debe ser un objeto en la definición de '" + type + "'");
        }
        return create(type.toString(), PatternConfig.from(parameters));
    }

    /**
     * Construye un {@link CompositePattern} a partir de definiciones. Cada definición puede llevar
     * {@code name} (por defecto, su posición) y {@code weight}; el resto se pasa a {@link #load}.
     * <p>
     * Si el compuesto queda sembrado (por su configuración o por la semilla del motor), cada
     * sub-patrón sin {@code seed} propia recibe una semilla derivada de la del compuesto, distinta
     * para cada posición.
     */
    public CompositePattern composite(List<? extends Map<String, ?>> definitions, PatternConfig config) {
        PatternConfig effective = withEngineDefaults(COMPOSITE, config == null ? PatternConfig.empty() : config);
        OptionalLong compositeSeed = effective.getSeed();
        Random childSeeds = compositeSeed.isPresent() ? new Random(compositeSeed.getAsLong()) : null;

        Map<String, Pattern> children = new LinkedHashMap<>();
        Map<String, Object> weights = new LinkedHashMap<>();

        for (int i = 0; i < definitions.size(); i++) {
            Map<String, Object> definition = new LinkedHashMap<>(definitions.get(i));
            Object childName = definition.remove(DEFINITION_NAME);
            Object weight = definition.remove(DEFINITION_WEIGHT);
            String name = childName == null ? String.valueOf(i) : childName.toString();
            if (childSeeds != null) {
                // Se consume siempre una semilla por posición; una seed explícita (o anidada en config) prevalece
                definition.putIfAbsent(PatternConfig.SEED, childSeeds.nextLong());
            }

            if (children.containsKey(name)) {
                throw new PatternConfigurationException("Nombre de sub-patrón duplicado: '" + name + "'");
            }
            children.put(name, load(definition));
            if (weight != null) {
                weights.put(name, weight);
            }
        }

        if (!weights.isEmpty() && !effective.has(CompositePattern.WEIGHTS)) {
            effective = effective.with(CompositePattern.WEIGHTS, weights);
        }
        return new CompositePattern(children, effective);
    }

    @SuppressWarnings("unchecked")
    private Pattern createComposite(PatternConfig config) {
        Object definitions = config.get(COMPOSITE_PATTERNS);
        PatternConfig rest = config.without(COMPOSITE_PATTERNS);
        if (definitions == null) {
            return new CompositePattern(Map.of(), rest);
        }
        if (definitions instanceof List) {
            return composite((List<Map<String, ?>>) definitions, rest);
        }
        if (definitions instanceof Map) {
            // Definiciones por nombre: {"ruido": {"type": "normal"}, ...}
            List<Map<String, ?>> named = new ArrayList<>();
            ((Map<String, ?>) definitions).forEach((name, definition) -> {
                if (!(definition instanceof Map)) {
                    throw new PatternConfigurationException("La definición de '" + name + "' debe ser un objeto");
                }
                Map<String, Object> withName = new LinkedHashMap<>((Map<String, ?>) definition);
                withName.put(DEFINITION_NAME, name);
                named.add(withName);
            });
            return composite(named, rest);
        }
        throw new PatternConfigurationException("'" + COMPOSITE_PATTERNS + "' debe ser una lista o un objeto");
    }

    private PatternConfig withEngineDefaults(String canonical, PatternConfig config) {
        PatternConfig effective = config;
        if (engineConfig.defaultSeed() != null && !effective.has(PatternConfig.SEED)) {
            effective = effective.with(PatternConfig.SEED, engineConfig.defaultSeed());
        }
        if (canonical.startsWith(TEMPORAL_CATEGORY + SEPARATOR) && !effective.has(AbstractTemporalPattern.TIMEZONE)) {
            effective = effective.with(AbstractTemporalPattern.TIMEZONE, engineConfig.defaultTimezone());
        }
        return effective;
    }

    private static Pattern instantiate(Constructor<?> constructor, PatternConfig config) {
        try {
            return (Pattern) constructor.newInstance(config);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new PatternConfigurationException("No se pudo crear " + constructor.getDeclaringClass().getName(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new PatternConfigurationException("No se pudo crear " + constructor.getDeclaringClass().getName(), e);
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new PatternConfigurationException("El nombre del patrón no puede estar vacío");
        }
    }
}
