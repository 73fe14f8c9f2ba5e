package mintpatterns.factory;

import mintpatterns.config.PatternConfig;
import mintpatterns.pattern.Pattern;

/**
 * Construye un patrón nuevo a partir de su configuración.
 */
@FunctionalInterface
public interface PatternFactory {

    Pattern create(PatternConfig config);
}
