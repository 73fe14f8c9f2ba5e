package mintpatterns.domain.exception;

import mintpatterns.config.ParameterSpec;

import java.util.List;
import java.util.Map;

/**
 * Se lanza cuando la configuración de un patrón no es válida: falta un parámetro obligatorio,
 * un parámetro está fuera de su dominio (ej: {@code stddev <= 0}, {@code min >= max})
 * o tiene un tipo incorrecto.
 * <p>
 * También cubre los errores de registro (clases que no implementan
 * {@link mintpatterns.pattern.Pattern}, definiciones sin {@code type}).
 * <p>
 * Cuando la lanza la validación de un patrón concreto, lleva además su descripción y su
 * esquema de parámetros, de modo que el registro pueda describir patrones con parámetros
 * obligatorios sin llegar a instanciarlos.
 */
public class PatternConfigurationException extends IllegalArgumentException {

    private final List<String> violations;
    private final String patternDescription;
    private final Map<String, ParameterSpec> parameters;

    public PatternConfigurationException(String message) {
        super(message);
        this.violations = List.of(message);
        this.patternDescription = null;
        this.parameters = Map.of();
    }

    public PatternConfigurationException(String patternName, List<String> violations) {
        this(patternName, null, Map.of(), violations);
    }

    public PatternConfigurationException(String patternName, String patternDescription,
                                         Map<String, ParameterSpec> parameters, List<String> violations) {
        super("Configuración inválida para '" + patternName + "': " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
        this.patternDescription = patternDescription;
        this.parameters = parameters;
    }

    public PatternConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
        this.patternDescription = null;
        this.parameters = Map.of();
    }

    public List<String> getViolations() {
        return violations;
    }

    /**
     * @return descripción del patrón que rechazó la configuración; {@code null} si no procede de uno.
     */
    public String getPatternDescription() {
        return patternDescription;
    }

    /**
     * @return esquema de parámetros del patrón que rechazó la configuración; vacío si no procede de uno.
     */
    public Map<String, ParameterSpec> getParameters() {
        return parameters;
    }
}
