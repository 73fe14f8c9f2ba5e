package mintpatterns.pattern;

import lombok.Builder;
import lombok.With;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Contexto opcional de una llamada a {@link Pattern#generate(GenerationContext)}.
 *
 * @param timestamp   Instante para el que se genera el valor (patrones temporales). Si falta, se usa "ahora".
 * @param windowStart Inicio de la ventana de muestreo de instantes (patrón semanal).
 * @param windowEnd   Fin de la ventana de muestreo de instantes (patrón semanal).
 * @param attributes  Datos adicionales del orquestador; los patrones del motor no los interpretan.
 */
@Builder
@With
public record GenerationContext(
        Instant timestamp,
        Instant windowStart,
        Instant windowEnd,
        Map<String, Object> attributes
) {
    private static final GenerationContext EMPTY = new GenerationContext(null, null, null, Map.of());

    public GenerationContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static GenerationContext empty() {
        return EMPTY;
    }

    public static GenerationContext at(Instant timestamp) {
        return new GenerationContext(timestamp, null, null, Map.of());
    }

    public Optional<Instant> findTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public Instant timestampOrNow() {
        return timestamp != null ? timestamp : Instant.now();
    }
}
