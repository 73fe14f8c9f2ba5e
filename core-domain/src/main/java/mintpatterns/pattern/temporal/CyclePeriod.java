package mintpatterns.pattern.temporal;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Getter
@RequiredArgsConstructor
public enum CyclePeriod {

    DAY("day", TimeScale.DAY),
    WEEK("week", TimeScale.WEEK),
    MONTH("month", TimeScale.MONTH),
    YEAR("year", TimeScale.YEAR);

    private final String code;
    // Duración aproximada de un ciclo (mes = 30 días, año = 365 días)
    private final TimeScale scale;

    private static final Map<String, CyclePeriod> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(period -> period.code, period -> period))
    );

    public static Optional<CyclePeriod> fromCode(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(text.trim().toLowerCase(Locale.ROOT)));
    }
}
