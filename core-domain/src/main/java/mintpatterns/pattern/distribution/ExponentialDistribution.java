package mintpatterns.pattern.distribution;

import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.pattern.GenerationContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Distribución Exponencial: tiempo entre eventos de un proceso de Poisson.
 * Muestreo por transformada inversa.
 */
public class ExponentialDistribution extends AbstractDistribution {

    public static final String LAMBDA = "lambda";

    private static final Map<String, ParameterSpec> PARAMETERS = parameters();

    private double lambda;
    private Double min;
    private Double max;

    public ExponentialDistribution() {
        this(PatternConfig.empty());
    }

    public ExponentialDistribution(PatternConfig config) {
        super("Exponential Distribution", "Genera valores con distribución exponencial (tiempo entre eventos)", PARAMETERS, config);
        initialize();
    }

    private static Map<String, ParameterSpec> parameters() {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put(LAMBDA, ParameterSpec.optional("float", 1.0, "Tasa (1/media), estrictamente positiva"));
        parameters.put(MIN, ParameterSpec.optional("float", 0.0, "Valor mínimo"));
        parameters.put(MAX, ParameterSpec.optional("float", null, "Valor máximo (truncado opcional)"));
        return parameters;
    }

    @Override
    protected void applyConfig(PatternConfig config) {
        this.lambda = config.getDouble(LAMBDA, 1.0);
        this.min = config.getDouble(MIN, 0.0);
        this.max = config.getNullableDouble(MAX);
    }

    @Override
    protected void collectViolations(PatternConfig config, List<String> violations) {
        checkStrictlyPositive(config, LAMBDA, violations);
        Double configuredMin = config.getNullableDouble(MIN);
        if (configuredMin != null && configuredMin < 0) {
            violations.add("'min' no puede ser negativo en una exponencial, recibido " + configuredMin);
        }
        checkBounds(config, violations);
    }

    @Override
    public double generate(GenerationContext context) {
        double u = nextOpenUniform();
        double value = -Math.log(1.0 - u) / lambda;
        return clamp(value, min, max);
    }

    @Override
    public double getMean() {
        return 1.0 / lambda;
    }

    @Override
    public double getVariance() {
        return 1.0 / (lambda * lambda);
    }

    @Override
    public double getStandardDeviation() {
        return 1.0 / lambda;
    }

    public double getMedian() {
        return Math.log(2.0) / lambda;
    }

    public double getMode() {
        return 0.0;
    }

    @Override
    public double pdf(double x) {
        requireFinite(x);
        if (x < 0) {
            return 0.0;
        }
        return lambda * Math.exp(-lambda * x);
    }

    @Override
    public double cdf(double x) {
        requireFinite(x);
        if (x < 0) {
            return 0.0;
        }
        return 1.0 - Math.exp(-lambda * x);
    }
}
