package mintpatterns.config;

import lombok.Builder;

/**
 * Descripción de un parámetro aceptado por un patrón.
 *
 * @param type         Tipo lógico del parámetro (float, int, string, array, map, datetime).
 * @param defaultValue Valor usado cuando el parámetro no se configura; {@code null} si no tiene.
 * @param required     Si la configuración debe incluirlo obligatoriamente.
 * @param description  Texto legible para listados e introspección.
 */
@Builder
public record ParameterSpec(
        String type,
        Object defaultValue,
        boolean required,
        String description
) {
    public static ParameterSpec optional(String type, Object defaultValue, String description) {
        return new ParameterSpec(type, defaultValue, false, description);
    }
}
