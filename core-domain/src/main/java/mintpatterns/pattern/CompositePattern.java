package mintpatterns.pattern;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.domain.exception.PatternConfigurationException;
import mintpatterns.domain.exception.PatternDomainException;
import mintpatterns.pattern.temporal.TemporalPattern;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Combina varios patrones en uno.
 * <ul>
 * <li>{@code combine}: suma ponderada ({@code additive}) o producto de potencias ({@code multiplicative}).</li>
 * <li>{@code select}: elige un sub-patrón al azar en proporción a su peso.</li>
 * <li>{@code sequence}: recorre los sub-patrones en orden circular con un cursor propio de la instancia.</li>
 * </ul>
 * Los sub-patrones temporales se evalúan con {@link TemporalPattern#generateAt} sobre el instante del contexto.
 * Los pesos se configuran como lista (en orden de inserción) o como mapa por nombre; los que faltan valen 1.
 */
public class CompositePattern extends AbstractPattern {

    public static final String MODE = "mode";
    public static final String COMBINATION = "combination";
    public static final String WEIGHTS = "weights";

    private static final double DEFAULT_WEIGHT = 1.0;

    private static final Map<String, ParameterSpec> PARAMETERS = parameters();

    @Getter
    @RequiredArgsConstructor
    public enum Mode {
        COMBINE("combine"),
        SELECT("select"),
        SEQUENCE("sequence");

        private final String code;

        public static Optional<Mode> fromCode(String text) {
            if (text == null) {
                return Optional.empty();
            }
            return Arrays.stream(values())
                    .filter(mode -> mode.code.equalsIgnoreCase(text.trim()))
                    .findFirst();
        }
    }

    @Getter
    @RequiredArgsConstructor
    public enum Combination {
        ADDITIVE("additive"),
        MULTIPLICATIVE("multiplicative");

        private final String code;

        public static Optional<Combination> fromCode(String text) {
            if (text == null) {
                return Optional.empty();
            }
            return Arrays.stream(values())
                    .filter(combination -> combination.code.equalsIgnoreCase(text.trim()))
                    .findFirst();
        }
    }

    private final Map<String, Pattern> patterns;
    private Map<String, Double> weights = Map.of();
    private Mode mode;
    private Combination combination;
    private int cursor;

    public CompositePattern() {
        this(Map.of(), PatternConfig.empty());
    }

    public CompositePattern(Map<String, ? extends Pattern> patterns, PatternConfig config) {
        super("Composite Pattern", "Combina varios patrones (combinación, selección o secuencia)", PARAMETERS, config);
        this.patterns = new LinkedHashMap<>();
        patterns.forEach((name, pattern) -> this.patterns.put(name, Objects.requireNonNull(pattern, name)));
        initialize();
    }

    /**
     * Sub-patrones nombrados por su posición ({@code "0"}, {@code "1"}...).
     */
    public CompositePattern(List<? extends Pattern> patterns, PatternConfig config) {
        this(indexByPosition(patterns), config);
    }

    private static Map<String, Pattern> indexByPosition(List<? extends Pattern> patterns) {
        Map<String, Pattern> indexed = new LinkedHashMap<>();
        for (int i = 0; i < patterns.size(); i++) {
            indexed.put(String.valueOf(i), patterns.get(i));
        }
        return indexed;
    }

    private static Map<String, ParameterSpec> parameters() {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put(MODE, ParameterSpec.optional("string", "combine", "Modo: combine, select o sequence"));
        parameters.put(COMBINATION, ParameterSpec.optional("string", "additive", "Combinación en modo combine: additive o multiplicative"));
        parameters.put(WEIGHTS, ParameterSpec.optional("array", null, "Pesos por posición (lista) o por nombre (mapa); 1 por defecto"));
        return parameters;
    }

    @Override
    protected void applyConfig(PatternConfig config) {
        this.mode = Mode.fromCode(config.getString(MODE, "combine")).orElse(Mode.COMBINE);
        this.combination = Combination.fromCode(config.getString(COMBINATION, "additive")).orElse(Combination.ADDITIVE);
        this.weights = resolveWeights(config);
    }

    @Override
    protected void collectViolations(PatternConfig config, List<String> violations) {
        String configuredMode = config.getString(MODE, "combine");
        if (Mode.fromCode(configuredMode).isEmpty()) {
            violations.add("Modo no válido: '" + configuredMode + "'");
        }
        String configuredCombination = config.getString(COMBINATION, "additive");
        if (Combination.fromCode(configuredCombination).isEmpty()) {
            violations.add("Combinación no válida: '" + configuredCombination + "'");
        }

        if (config.get(WEIGHTS) instanceof Map) {
            for (String name : config.getMap(WEIGHTS, Map.of()).keySet()) {
                if (!patterns.containsKey(name)) {
                    violations.add("Peso para un patrón inexistente: '" + name + "'");
                }
            }
        } else if (config.has(WEIGHTS)) {
            int count = config.getList(WEIGHTS, List.of()).size();
            if (count > patterns.size()) {
                violations.add("Hay " + count + " pesos para " + patterns.size() + " patrones");
            }
        }

        boolean selecting = Mode.fromCode(configuredMode).orElse(Mode.COMBINE) == Mode.SELECT;
        for (Map.Entry<String, Double> entry : resolveWeights(config).entrySet()) {
            if (selecting && (entry.getValue() < 0 || entry.getValue().isNaN())) {
                violations.add("En modo select los pesos no pueden ser negativos: '" + entry.getKey() + "' = " + entry.getValue());
            }
        }
    }

    private Map<String, Double> resolveWeights(PatternConfig config) {
        Map<String, Double> resolved = new LinkedHashMap<>();
        patterns.keySet().forEach(name -> resolved.put(name, DEFAULT_WEIGHT));

        if (config.get(WEIGHTS) instanceof Map) {
            PatternConfig byName = PatternConfig.from(config.getMap(WEIGHTS, Map.of()));
            for (String name : byName.keys()) {
                if (resolved.containsKey(name)) {
                    resolved.put(name, byName.getDouble(name, DEFAULT_WEIGHT));
                }
            }
        } else if (config.has(WEIGHTS)) {
            List<Double> byPosition = config.getDoubleList(WEIGHTS, List.of());
            int i = 0;
            for (String name : patterns.keySet()) {
                if (i >= byPosition.size()) {
                    break;
                }
                resolved.put(name, byPosition.get(i++));
            }
        }
        return resolved;
    }

    @Override
    public double generate(GenerationContext context) {
        switch (mode) {
            case SELECT:
                return valueOf(select(), context);
            case SEQUENCE:
                return valueOf(next(), context);
            case COMBINE:
            default:
                return combine(context);
        }
    }

    private double combine(GenerationContext context) {
        if (combination == Combination.MULTIPLICATIVE) {
            double product = 1.0;
            for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
                product *= Math.pow(valueOf(entry.getValue(), context), weights.get(entry.getKey()));
            }
            return product;
        }
        double sum = 0.0;
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            sum += weights.get(entry.getKey()) * valueOf(entry.getValue(), context);
        }
        return sum;
    }

    private Pattern select() {
        requireNotEmpty();
        double total = 0.0;
        for (double weight : weights.values()) {
            total += weight;
        }

        if (total <= 0) {
            // Todos los pesos a cero: elección uniforme
            int index = random().nextInt(patterns.size());
            return patterns.values().stream().skip(index).findFirst().orElseThrow();
        }

        double target = nextUniform() * total;
        double cumulative = 0.0;
        Pattern chosen = null;
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            double weight = weights.get(entry.getKey());
            if (weight <= 0) {
                continue;
            }
            cumulative += weight;
            chosen = entry.getValue();
            if (target < cumulative) {
                return chosen;
            }
        }
        // Redondeo en la última suma acumulada
        return chosen;
    }

    private Pattern next() {
        requireNotEmpty();
        int index = cursor % patterns.size();
        cursor = index + 1;
        return patterns.values().stream().skip(index).findFirst().orElseThrow();
    }

    private void requireNotEmpty() {
        if (patterns.isEmpty()) {
            throw new PatternDomainException("El patrón compuesto no tiene sub-patrones (modo " + mode.getCode() + ")");
        }
    }

    private static double valueOf(Pattern pattern, GenerationContext context) {
        if (pattern instanceof TemporalPattern) {
            return ((TemporalPattern) pattern).generateAt(context.timestampOrNow());
        }
        return pattern.generate(context);
    }

    public void addPattern(String name, Pattern pattern) {
        addPattern(name, pattern, DEFAULT_WEIGHT);
    }

    /**
     * Añade (o sustituye) un sub-patrón con su peso. Los pesos pasan a guardarse por nombre.
     */
    public void addPattern(String name, Pattern pattern, double weight) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Map<String, Double> updated = new LinkedHashMap<>(weights);
        updated.put(name, weight);
        Pattern previous = patterns.put(name, pattern);
        try {
            setConfig(PatternConfig.of(WEIGHTS, updated));
        } catch (PatternConfigurationException e) {
            if (previous != null) {
                patterns.put(name, previous);
            } else {
                patterns.remove(name);
            }
            throw e;
        }
    }

    /**
     * @return el sub-patrón eliminado, si existía.
     */
    public Optional<Pattern> removePattern(String name) {
        Pattern removed = patterns.remove(name);
        if (removed != null) {
            Map<String, Double> updated = new LinkedHashMap<>(weights);
            updated.remove(name);
            setConfig(PatternConfig.of(WEIGHTS, updated));
            if (cursor > patterns.size()) {
                cursor = 0;
            }
        }
        return Optional.ofNullable(removed);
    }

    public Map<String, Pattern> getPatterns() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
    }

    public Map<String, Double> getWeights() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public Mode getMode() {
        return mode;
    }

    public Combination getCombination() {
        return combination;
    }

    @Override
    public void reset() {
        super.reset();
        cursor = 0;
        patterns.values().forEach(Pattern::reset);
    }
}
