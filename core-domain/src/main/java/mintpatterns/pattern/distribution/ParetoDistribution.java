package mintpatterns.pattern.distribution;

import mintpatterns.config.ParameterSpec;
import mintpatterns.config.PatternConfig;
import mintpatterns.domain.exception.PatternDomainException;
import mintpatterns.pattern.GenerationContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Distribución de Pareto (ley de potencias). Con {@code alpha = 1.16} reproduce la regla 80/20:
 * el 20% superior de la población acumula ~80% del valor total.
 * <p>
 * Muestreo por transformada inversa; los valores se acotan a {@code [xmin, max]}.
 */
public class ParetoDistribution extends AbstractDistribution {

    public static final String ALPHA = "alpha";
    public static final String XMIN = "xmin";

    public static final double EIGHTY_TWENTY_ALPHA = 1.16;

    private static final Map<String, ParameterSpec> PARAMETERS = parameters();

    private double alpha;
    private double xmin;
    private Double max;

    public ParetoDistribution() {
        this(PatternConfig.empty());
    }

    public ParetoDistribution(PatternConfig config) {
        super("Pareto Distribution", "Genera valores con distribución de Pareto (regla 80/20, ley de potencias)", PARAMETERS, config);
        initialize();
    }

    private static Map<String, ParameterSpec> parameters() {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        parameters.put(ALPHA, ParameterSpec.optional("float", EIGHTY_TWENTY_ALPHA, "Parámetro de forma (menor = más desigualdad, 1.16 ≈ 80/20)"));
        parameters.put(XMIN, ParameterSpec.optional("float", 1.0, "Valor mínimo (parámetro de escala)"));
        parameters.put(MAX, ParameterSpec.optional("float", null, "Valor máximo (truncado opcional)"));
        return parameters;
    }

    @Override
    protected void applyConfig(PatternConfig config) {
        this.alpha = config.getDouble(ALPHA, EIGHTY_TWENTY_ALPHA);
        this.xmin = config.getDouble(XMIN, 1.0);
        this.max = config.getNullableDouble(MAX);
    }

    @Override
    protected void collectViolations(PatternConfig config, List<String> violations) {
        checkStrictlyPositive(config, ALPHA, violations);
        checkStrictlyPositive(config, XMIN, violations);

        Double configuredMax = config.getNullableDouble(MAX);
        double configuredXmin = config.getDouble(XMIN, 1.0);
        if (configuredMax != null && configuredMax <= configuredXmin) {
            violations.add("'max' (" + configuredMax + ") debe ser mayor que 'xmin' (" + configuredXmin + ")");
        }
    }

    @Override
    public double generate(GenerationContext context) {
        double u = nextOpenUniform();
        double value = xmin / Math.pow(u, 1.0 / alpha);
        return clamp(value, xmin, max);
    }

    @Override
    public double getMean() {
        if (alpha <= 1) {
            return Double.POSITIVE_INFINITY;
        }
        return (alpha * xmin) / (alpha - 1);
    }

    @Override
    public double getVariance() {
        if (alpha <= 2) {
            return Double.POSITIVE_INFINITY;
        }
        return (xmin * xmin * alpha) / (Math.pow(alpha - 1, 2) * (alpha - 2));
    }

    @Override
    public double getStandardDeviation() {
        double variance = getVariance();
        return Double.isInfinite(variance) ? Double.POSITIVE_INFINITY : Math.sqrt(variance);
    }

    @Override
    public double pdf(double x) {
        requireFinite(x);
        if (x < xmin) {
            return 0.0;
        }
        return (alpha * Math.pow(xmin, alpha)) / Math.pow(x, alpha + 1);
    }

    @Override
    public double cdf(double x) {
        requireFinite(x);
        if (x < xmin) {
            return 0.0;
        }
        return 1.0 - Math.pow(xmin / x, alpha);
    }

    /**
     * Fracción del valor total que acumula la fracción superior {@code percentile} de la población.
     * <p>
     * Para la curva de Lorenz de Pareto es {@code p^((α-1)/α)}: con α = 1.16, el 20% superior
     * posee ~80%. Con α &lt;= 1 la media es infinita y el reparto tiende a concentrarse por completo
     * en la cola, por lo que se devuelve 1.
     *
     * @param percentile Fracción superior de la población, en (0, 1).
     * @throws PatternDomainException si el percentil está fuera de (0, 1).
     */
    public double getPercentileOwnership(double percentile) {
        if (!(percentile > 0 && percentile < 1)) {
            throw new PatternDomainException("El percentil debe estar entre 0 y 1 (exclusivo), recibido " + percentile);
        }
        if (alpha <= 1) {
            return 1.0;
        }
        return Math.pow(percentile, (alpha - 1) / alpha);
    }

    public double getAlpha() {
        return alpha;
    }

    public double getXmin() {
        return xmin;
    }
}
