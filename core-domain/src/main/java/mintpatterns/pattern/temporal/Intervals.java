package mintpatterns.pattern.temporal;

import java.time.Duration;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAmount;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversión de intervalos textuales ({@code "1 hour"}, {@code "15 minutes"}, {@code "1 month"})
 * a {@link TemporalAmount}. Segundos, minutos y horas son {@link Duration}; días, semanas, meses
 * y años son {@link Period} de calendario. También acepta ISO-8601 ({@code PT1H}, {@code P1M}).
 */
public final class Intervals {

    private static final Pattern TEXTUAL = Pattern.compile("^(\\d+)?\\s*([a-z]+?)s?$");

    private Intervals() {
    }

    public static TemporalAmount parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("El intervalo no puede estar vacío");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);

        if (normalized.startsWith("p")) {
            return parseIso(text.trim());
        }

        Matcher matcher = TEXTUAL.matcher(normalized);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Intervalo no reconocido: '" + text + "'");
        }
        long amount = matcher.group(1) == null ? 1L : Long.parseLong(matcher.group(1));
        if (amount <= 0) {
            throw new IllegalArgumentException("El intervalo debe ser positivo: '" + text + "'");
        }

        switch (matcher.group(2)) {
            case "second":
            case "sec":
                return Duration.ofSeconds(amount);
            case "minute":
            case "min":
                return Duration.ofMinutes(amount);
            case "hour":
                return Duration.ofHours(amount);
            case "day":
                return Period.ofDays(Math.toIntExact(amount));
            case "week":
                return Period.ofWeeks(Math.toIntExact(amount));
            case "month":
                return Period.ofMonths(Math.toIntExact(amount));
            case "year":
                return Period.ofYears(Math.toIntExact(amount));
            default:
                throw new IllegalArgumentException("Unidad de intervalo no reconocida: '" + text + "'");
        }
    }

    private static TemporalAmount parseIso(String text) {
        try {
            if (text.toUpperCase(Locale.ROOT).contains("T")) {
                return Duration.parse(text);
            }
            return Period.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Intervalo ISO-8601 no válido: '" + text + "'", e);
        }
    }
}
