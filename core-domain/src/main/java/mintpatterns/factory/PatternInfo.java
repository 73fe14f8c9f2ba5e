package mintpatterns.factory;

import mintpatterns.config.ParameterSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ficha descriptiva de un patrón registrado.
 *
 * @param name        Nombre canónico (p. ej. {@code distribution.normal}).
 * @param description Descripción del patrón.
 * @param parameters  Esquema de parámetros.
 * @param aliases     Alias que resuelven a este nombre.
 * @param builtIn     {@code true} si lo registra el propio motor.
 */
public record PatternInfo(
        String name,
        String description,
        Map<String, ParameterSpec> parameters,
        List<String> aliases,
        boolean builtIn
) {
    public PatternInfo {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        aliases = List.copyOf(aliases);
    }
}
