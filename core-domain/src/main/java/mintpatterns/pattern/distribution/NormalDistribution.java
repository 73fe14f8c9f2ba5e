package mintpatterns.pattern.distribution;

import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.pattern.GenerationContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Distribución Normal (Gaussiana), truncable por {@code min}/{@code max}.
 * <p>
 * Muestreo por Box-Muller. La cdf usa la aproximación de Abramowitz-Stegun (7.1.26)
 * de la función error, con error absoluto máximo ~1.5e-7.
 */
public class NormalDistribution extends AbstractDistribution {

    public static final String MEAN = "mean";
    public static final String STDDEV = "stddev";

    private static final Map<String, ParameterSpec> PARAMETERS = parameters();

    // Coeficientes A&S 7.1.26
    private static final double P = 0.3275911;
    private static final double A1 = 0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 = 1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 = 1.061405429;

    private double mean;
    private double stddev;
    private Double min;
    private Double max;

    public NormalDistribution() {
        this(PatternConfig.empty());
    }

    public NormalDistribution(PatternConfig config) {
        super("Normal Distribution", "Genera valores que siguen una distribución normal (campana de Gauss)", PARAMETERS, config);
        initialize();
    }

    private static Map<String, ParameterSpec> parameters() {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put(MEAN, ParameterSpec.optional("float", 0.0, "Media (centro) de la distribución"));
        parameters.put(STDDEV, ParameterSpec.optional("float", 1.0, "Desviación típica (dispersión), estrictamente positiva"));
        parameters.put(MIN, ParameterSpec.optional("float", null, "Valor mínimo (truncado opcional)"));
        parameters.put(MAX, ParameterSpec.optional("float", null, "Valor máximo (truncado opcional)"));
        return parameters;
    }

    @Override
    protected void applyConfig(PatternConfig config) {
        this.mean = config.getDouble(MEAN, 0.0);
        this.stddev = config.getDouble(STDDEV, 1.0);
        this.min = config.getNullableDouble(MIN);
        this.max = config.getNullableDouble(MAX);
    }

    @Override
    protected void collectViolations(PatternConfig config, List<String> violations) {
        checkStrictlyPositive(config, STDDEV, violations);
        checkBounds(config, violations);
    }

    @Override
    public double generate(GenerationContext context) {
        double value = mean + nextStandardNormal() * stddev;
        return clamp(value, min, max);
    }

    @Override
    public double getMean() {
        return mean;
    }

    @Override
    public double getVariance() {
        return stddev * stddev;
    }

    @Override
    public double getStandardDeviation() {
        return stddev;
    }

    @Override
    public double pdf(double x) {
        requireFinite(x);
        double coefficient = 1.0 / (stddev * Math.sqrt(2.0 * Math.PI));
        double exponent = -Math.pow(x - mean, 2) / (2.0 * stddev * stddev);
        return coefficient * Math.exp(exponent);
    }

    @Override
    public double cdf(double x) {
        requireFinite(x);
        double z = (x - mean) / stddev;
        return 0.5 * (1.0 + erf(z / Math.sqrt(2.0)));
    }

    /**
     * Aproximación racional de la función error.
     */
    public static double erf(double x) {
        double sign = x < 0 ? -1.0 : 1.0;
        double absX = Math.abs(x);

        double t = 1.0 / (1.0 + P * absX);
        double polynomial = ((((A5 * t + A4) * t + A3) * t + A2) * t + A1) * t;
        double y = 1.0 - polynomial * Math.exp(-absX * absX);

        return sign * y;
    }
}
