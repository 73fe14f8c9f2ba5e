package mintpatterns.pattern;

import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;

import java.util.List;
import java.util.Map;

/**
 * Contrato común de todos los generadores de valores del motor.
 * <p>
 * Un patrón se construye a partir de un {@link PatternConfig}, posee su propio generador
 * pseudoaleatorio y produce un valor por llamada. La jerarquía es cerrada en la práctica:
 * distribuciones ({@link mintpatterns.pattern.distribution.Distribution}), patrones temporales
 * ({@link mintpatterns.pattern.temporal.TemporalPattern}) y el combinador {@link CompositePattern}.
 * <p>
 * Las instancias no son thread-safe: cada hilo debe usar su propia instancia o serializar el acceso.
 */
public interface Pattern {

    /**
     * Genera el siguiente valor del patrón.
     *
     * @param context Contexto de la llamada (instante, ventana...). Nunca nulo; usar {@link GenerationContext#empty()}.
     * @return El valor generado.
     */
    double generate(GenerationContext context);

    default double generate() {
        return generate(GenerationContext.empty());
    }

    /**
     * Comprueba una configuración sin lanzar excepciones, para validar antes de construir.
     */
    boolean validate(PatternConfig config);

    /**
     * @return La lista de problemas de la configuración; vacía si es válida.
     */
    List<String> findViolations(PatternConfig config);

    Map<String, ParameterSpec> getParameters();

    String getName();

    String getDescription();

    PatternConfig getConfig();

    /**
     * Fusiona parcialmente la configuración. Si incluye {@code seed}, reinicia el generador con ella.
     *
     * @throws mintpatterns.domain.exception.PatternConfigurationException si el resultado no es válido.
     */
    void setConfig(PatternConfig config);

    /**
     * Restaura el estado interno (flujo aleatorio sembrado, cursores).
     */
    void reset();
}
