package mintpatterns.domain.exception;

/**
 * Petición matemáticamente imposible: un percentil fuera de (0, 1), una entrada no finita
 * a una función de densidad, o una selección sobre un compuesto vacío.
 */
public class PatternDomainException extends ArithmeticException {

    public PatternDomainException(String message) {
        super(message);
    }
}
