package mintpatterns.pattern.temporal;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Unidades de tiempo con longitud fija en segundos. Mes y año son aproximados (30 y 365 días).
 */
@Getter
@RequiredArgsConstructor
public enum TimeScale {

    SECOND("second", 1L),
    MINUTE("minute", 60L),
    HOUR("hour", 3_600L),
    DAY("day", 86_400L),
    WEEK("week", 604_800L),
    MONTH("month", 2_592_000L),
    YEAR("year", 31_536_000L);

    private final String code;
    private final long seconds;

    private static final Map<String, TimeScale> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(scale -> scale.code, scale -> scale))
    );

    public static Optional<TimeScale> fromCode(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(text.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Tiempo transcurrido entre dos instantes expresado en esta unidad (negativo si {@code to} es anterior).
     */
    public double between(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0 / seconds;
    }
}
