package mintpatterns.pattern.distribution;

import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.domain.exception.PatternDomainException;
import mintpatterns.pattern.GenerationContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Distribución de Poisson: número de eventos en un intervalo fijo.
 * <ul>
 * <li>{@code lambda < 30}: algoritmo de Knuth (producto de uniformes hasta bajar de e^-λ).</li>
 * <li>{@code lambda >= 30}: aproximación Normal(λ, √λ) acotada a 0 y redondeada.</li>
 * </ul>
 */
public class PoissonDistribution extends AbstractDistribution {

    public static final String LAMBDA = "lambda";

    static final double NORMAL_APPROXIMATION_THRESHOLD = 30.0;
    static final int KNUTH_MAX_ITERATIONS = 1000;
    private static final int MAX_EXACT_FACTORIAL = 170;

    // Tabla inmutable 0!..170!; 171! ya desborda un double.
    private static final double[] FACTORIALS = new double[MAX_EXACT_FACTORIAL + 1];

    static {
        FACTORIALS[0] = 1.0;
        for (int i = 1; i <= MAX_EXACT_FACTORIAL; i++) {
            FACTORIALS[i] = FACTORIALS[i - 1] * i;
        }
    }

    private static final Map<String, ParameterSpec> PARAMETERS = parameters();

    private double lambda;
    private Integer max;

    public PoissonDistribution() {
        this(PatternConfig.empty());
    }

    public PoissonDistribution(PatternConfig config) {
        super("Poisson Distribution", "Genera recuentos con distribución de Poisson (frecuencia de eventos)", PARAMETERS, config);
        initialize();
    }

    private static Map<String, ParameterSpec> parameters() {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put(LAMBDA, ParameterSpec.optional("float", 1.0, "Tasa media de eventos (λ), estrictamente positiva"));
        parameters.put(MAX, ParameterSpec.optional("int", null, "Recuento máximo (truncado opcional)"));
        return parameters;
    }

    @Override
    protected void applyConfig(PatternConfig config) {
        this.lambda = config.getDouble(LAMBDA, 1.0);
        this.max = config.getNullableInt(MAX);
    }

    @Override
    protected void collectViolations(PatternConfig config, List<String> violations) {
        checkStrictlyPositive(config, LAMBDA, violations);
        Double configuredMax = config.getNullableDouble(MAX);
        if (configuredMax != null && configuredMax < 0) {
            violations.add("'max' no puede ser negativo, recibido " + configuredMax);
        }
    }

    @Override
    public double generate(GenerationContext context) {
        return generateCount();
    }

    /**
     * Genera un recuento entero.
     */
    public int generateCount() {
        int count;
        if (lambda < NORMAL_APPROXIMATION_THRESHOLD) {
            double limit = Math.exp(-lambda);
            int k = 0;
            double product = 1.0;
            do {
                k++;
                product *= nextOpenUniform();
            } while (product > limit && k < KNUTH_MAX_ITERATIONS);
            count = k - 1;
        } else {
            double approximation = clamp(lambda + nextStandardNormal() * Math.sqrt(lambda), 0.0, null);
            count = (int) Math.round(approximation);
        }

        if (max != null) {
            count = Math.min(count, max);
        }
        return count;
    }

    @Override
    public double getMean() {
        return lambda;
    }

    @Override
    public double getVariance() {
        return lambda;
    }

    @Override
    public double getStandardDeviation() {
        return Math.sqrt(lambda);
    }

    /**
     * Función de masa P(X = k). Devuelve 0 para valores negativos o no enteros.
     * Se evalúa en escala logarítmica para evitar desbordes de λ^k y k!.
     */
    @Override
    public double pdf(double x) {
        requireFinite(x);
        if (x < 0 || Math.floor(x) != x) {
            return 0.0;
        }
        return pmf((long) x);
    }

    @Override
    public double cdf(double x) {
        requireFinite(x);
        if (x < 0) {
            return 0.0;
        }
        long upper = (long) Math.floor(x);
        double sum = 0.0;
        for (long k = 0; k <= upper; k++) {
            double term = pmf(k);
            sum += term;
            // Pasada la moda, los términos solo decrecen
            if (k > lambda && term < 1e-17) {
                break;
            }
        }
        return Math.min(1.0, sum);
    }

    private double pmf(long k) {
        return Math.exp(k * Math.log(lambda) - lambda - logFactorial(k));
    }

    /**
     * n! exacto hasta 170 (tabla precalculada) y aproximación de Stirling √(2πn)(n/e)^n por encima.
     */
    public static double factorial(long n) {
        if (n < 0) {
            throw new PatternDomainException("El factorial no está definido para n = " + n);
        }
        if (n <= MAX_EXACT_FACTORIAL) {
            return FACTORIALS[(int) n];
        }
        return Math.sqrt(2.0 * Math.PI * n) * Math.pow(n / Math.E, n);
    }

    static double logFactorial(long n) {
        if (n <= MAX_EXACT_FACTORIAL) {
            return Math.log(FACTORIALS[(int) n]);
        }
        return 0.5 * Math.log(2.0 * Math.PI * n) + n * (Math.log(n) - 1.0);
    }

    public double getLambda() {
        return lambda;
    }
}
