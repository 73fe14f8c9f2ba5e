package mintpatterns.pattern;

import lombok.extern.slf4j.Slf4j;
import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.domain.exception.PatternConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class AbstractPatternTest {

    /**
     * Patrón mínimo: uniforme en [0, scale) con un parámetro obligatorio.
     */
    private static class UniformPattern extends AbstractPattern {

        private double scale;

        UniformPattern(PatternConfig config) {
            super("Uniform", "Uniforme de prueba",
                    Map.of("scale", ParameterSpec.builder().type("float").required(true).description("Escala").build()),
                    config);
            initialize();
        }

        @Override
        protected void applyConfig(PatternConfig config) {
            this.scale = config.getDouble("scale", 1.0);
        }

        @Override
        protected void collectViolations(PatternConfig config, List<String> violations) {
            checkStrictlyPositive(config, "scale", violations);
        }

        @Override
        public double generate(GenerationContext context) {
            return nextUniform() * scale;
        }

        double draw() {
            return generate();
        }
    }

    private static double[] draws(UniformPattern pattern, int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = pattern.draw();
        }
        return values;
    }

    @Test
    @DisplayName("Determinismo: misma semilla y misma secuencia de llamadas producen los mismos valores")
    void sameSeed_shouldProduceIdenticalSequences() {
        UniformPattern a = new UniformPattern(PatternConfig.of("scale", 10, "seed", 42));
        UniformPattern b = new UniformPattern(PatternConfig.of("scale", 10, "seed", 42));

        assertArrayEquals(draws(a, 50), draws(b, 50));
    }

    @Test
    @DisplayName("Falta un parámetro obligatorio: el constructor lanza y validate devuelve false")
    void missingRequiredParameter_shouldBeRejected() {
        PatternConfigurationException ex = assertThrows(PatternConfigurationException.class,
                () -> new UniformPattern(PatternConfig.empty()));

        log.info("Violaciones: {}", ex.getViolations());
        assertEquals(1, ex.getViolations().size());

        UniformPattern valid = new UniformPattern(PatternConfig.of("scale", 1));
        assertFalse(valid.validate(PatternConfig.empty()));
        assertTrue(valid.validate(PatternConfig.of("scale", 3)));
    }

    @Test
    @DisplayName("validate nunca lanza: un tipo erróneo se convierte en violación")
    void validate_withWrongType_shouldReturnFalse() {
        UniformPattern pattern = new UniformPattern(PatternConfig.of("scale", 1));

        assertFalse(pattern.validate(PatternConfig.of("scale", "grande")));
        assertFalse(pattern.validate(PatternConfig.of("scale", 1, "seed", "abc")));
        assertFalse(pattern.validate(PatternConfig.of("scale", 0)));
    }

    @Test
    @DisplayName("setConfig fusiona parcialmente y vuelve a leer los parámetros")
    void setConfig_shouldMergeAndReapply() {
        UniformPattern pattern = new UniformPattern(PatternConfig.of("scale", 1, "seed", 7));

        pattern.setConfig(PatternConfig.of("scale", 1000));

        assertEquals(1000.0, pattern.getConfig().getDouble("scale", 0));
        assertEquals(7L, pattern.getConfig().getSeed().getAsLong());
        assertTrue(Arrays.stream(draws(pattern, 100)).anyMatch(v -> v > 1.0));
    }

    @Test
    @DisplayName("setConfig inválido no modifica el patrón")
    void setConfig_withInvalidUpdate_shouldKeepPreviousConfig() {
        UniformPattern pattern = new UniformPattern(PatternConfig.of("scale", 5));

        assertThrows(PatternConfigurationException.class, () -> pattern.setConfig(PatternConfig.of("scale", -1)));
        assertEquals(5.0, pattern.getConfig().getDouble("scale", 0));
    }

    @Test
    @DisplayName("setConfig con semilla resiembra el generador; sin semilla, no")
    void setConfig_shouldReseedOnlyWhenSeedIsPresent() {
        UniformPattern reference = new UniformPattern(PatternConfig.of("scale", 1, "seed", 99));
        double[] expected = draws(reference, 10);

        UniformPattern pattern = new UniformPattern(PatternConfig.of("scale", 1, "seed", 1));
        draws(pattern, 5);
        pattern.setConfig(PatternConfig.of("seed", 99));

        assertArrayEquals(expected, draws(pattern, 10));
    }

    @Test
    @DisplayName("reset restaura el flujo aleatorio de la semilla configurada")
    void reset_shouldRewindSeededStream() {
        UniformPattern pattern = new UniformPattern(PatternConfig.of("scale", 1, "seed", 3));
        double[] first = draws(pattern, 10);

        pattern.reset();

        assertArrayEquals(first, draws(pattern, 10));
        assertTrue(pattern.isSeeded());
    }

    @Test
    @DisplayName("clamp solo acota los lados configurados")
    void clamp_shouldApplyOnlyConfiguredBounds() {
        assertEquals(5.0, AbstractPattern.clamp(3.0, 5.0, null));
        assertEquals(10.0, AbstractPattern.clamp(30.0, null, 10.0));
        assertEquals(-1e9, AbstractPattern.clamp(-1e9, null, 10.0));
        assertEquals(7.0, AbstractPattern.clamp(7.0, null, null));
    }
}
