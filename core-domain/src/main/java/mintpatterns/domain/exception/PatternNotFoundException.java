package mintpatterns.domain.exception;

import lombok.Getter;

/**
 * Nombre o alias de patrón no registrado en el {@link mintpatterns.factory.PatternRegistry}.
 */
@Getter
public class PatternNotFoundException extends RuntimeException {

    private final String patternName;

    public PatternNotFoundException(String patternName) {
        super("El patrón '" + patternName + "' no está registrado");
        this.patternName = patternName;
    }
}
