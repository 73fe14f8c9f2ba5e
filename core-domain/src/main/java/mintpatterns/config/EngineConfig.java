package mintpatterns.config;

import lombok.Builder;
import lombok.With;

/**
 * Valores por defecto del motor de patrones, compartidos por todos los patrones
 * que crea un {@link mintpatterns.factory.PatternRegistry}.
 *
 * @param defaultSeed         Semilla aplicada a los patrones creados sin semilla propia.
 *                            {@code null} deja el generador sin semilla (no reproducible).
 * @param defaultTimezone     Zona horaria para los patrones temporales que no declaran {@code timezone}.
 * @param defaultDistribution Nombre o alias de la distribución por defecto.
 * @param defaultTemporal     Nombre o alias del patrón temporal por defecto.
 */
@Builder
@With
public record EngineConfig(
        Long defaultSeed,
        String defaultTimezone,
        String defaultDistribution,
        String defaultTemporal
) {
    public EngineConfig {
        if (defaultTimezone == null || defaultTimezone.isBlank()) {
            defaultTimezone = "UTC";
        }
        if (defaultDistribution == null || defaultDistribution.isBlank()) {
            defaultDistribution = "normal";
        }
        if (defaultTemporal == null || defaultTemporal.isBlank()) {
            defaultTemporal = "linear";
        }
    }

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }
}
