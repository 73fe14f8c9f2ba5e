package mintpatterns.pattern.distribution;

import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.domain.exception.PatternDomainException;
import mintpatterns.pattern.AbstractPattern;

import java.util.Map;

/**
 * Base de las distribuciones: muestreo por lotes y comprobación de dominio de pdf/cdf.
 */
public abstract class AbstractDistribution extends AbstractPattern implements Distribution {

    protected AbstractDistribution(String name, String description, Map<String, ParameterSpec> parameters, PatternConfig config) {
        super(name, description, parameters, config);
    }

    @Override
    public double[] sample(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("El tamaño de la muestra no puede ser negativo: " + count);
        }
        double[] samples = new double[count];
        for (int i = 0; i < count; i++) {
            samples[i] = generate();
        }
        return samples;
    }

    protected static double requireFinite(double x) {
        if (!Double.isFinite(x)) {
            throw new PatternDomainException("La densidad no está definida para x = " + x);
        }
        return x;
    }
}
