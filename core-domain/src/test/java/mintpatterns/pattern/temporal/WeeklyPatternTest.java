package mintpatterns.pattern.temporal;

import mintpatterns.config.PatternConfig;
import mintpatterns.pattern.GenerationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeeklyPatternTest {

    private static final List<Double> MONDAY_ONLY = List.of(0.0, 1.0, 0.0, 0.0, 0.0, 0.0, 0.0);

    // 2024-01-01 es lunes
    private static final Instant WINDOW_START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant WINDOW_END = Instant.parse("2024-01-14T23:59:59Z");

    @Test
    @DisplayName("Solo lunes: todos los instantes generados caen en lunes dentro de la ventana")
    void generateTimestamp_withMondayOnlyWeights_shouldOnlyProduceMondays() {
        WeeklyPattern weekly = new WeeklyPattern(PatternConfig.of("weekday_weights", MONDAY_ONLY, "seed", 10));
        GenerationContext window = GenerationContext.builder().windowStart(WINDOW_START).windowEnd(WINDOW_END).build();

        List<Instant> timestamps = weekly.generateTimestamps(300, window);

        assertEquals(300, timestamps.size());
        for (Instant timestamp : timestamps) {
            assertEquals(DayOfWeek.MONDAY, timestamp.atZone(ZoneOffset.UTC).getDayOfWeek());
            assertFalse(timestamp.isBefore(WINDOW_START) || timestamp.isAfter(WINDOW_END));
        }
    }

    @Test
    @DisplayName("Pesos horarios: solo se aceptan instantes de las horas con peso")
    void generateTimestamp_withHourlyWeights_shouldFollowHours() {
        List<Double> nineToTen = IntStream.range(0, 24).mapToObj(h -> h == 9 ? 1.0 : 0.0).collect(Collectors.toList());
        WeeklyPattern weekly = new WeeklyPattern(PatternConfig.of("hourly_weights", nineToTen, "seed", 12));
        GenerationContext window = GenerationContext.builder().windowStart(WINDOW_START).windowEnd(WINDOW_END).build();

        for (Instant timestamp : weekly.generateTimestamps(100, window)) {
            assertEquals(9, timestamp.atZone(ZoneOffset.UTC).getHour());
        }
    }

    @Test
    @DisplayName("Intentos agotados: devuelve el último candidato, dentro de la ventana")
    void generateTimestamp_whenAttemptsRunOut_shouldFallBackToLastDraw() {
        WeeklyPattern weekly = new WeeklyPattern(PatternConfig.of("weekday_weights", MONDAY_ONLY, "max_attempts", 5, "seed", 1));
        // Ventana completamente en martes: ningún candidato puede aceptarse
        Instant tuesdayStart = Instant.parse("2024-01-02T00:00:00Z");
        Instant tuesdayEnd = Instant.parse("2024-01-02T23:00:00Z");
        GenerationContext window = GenerationContext.builder().windowStart(tuesdayStart).windowEnd(tuesdayEnd).build();

        Instant timestamp = weekly.generateTimestamp(window);

        assertEquals(DayOfWeek.TUESDAY, timestamp.atZone(ZoneOffset.UTC).getDayOfWeek());
        assertFalse(timestamp.isBefore(tuesdayStart) || timestamp.isAfter(tuesdayEnd));
    }

    @Test
    @DisplayName("Sin ventana: la semana anterior al instante base")
    void generateTimestamp_withoutWindow_shouldUseLastWeekBeforeBaseTime() {
        WeeklyPattern weekly = new WeeklyPattern(PatternConfig.of("base_time", WINDOW_END, "seed", 3));

        Instant timestamp = weekly.generateTimestamp(GenerationContext.empty());

        assertFalse(timestamp.isAfter(WINDOW_END));
        assertFalse(timestamp.isBefore(WINDOW_END.minus(Duration.ofDays(7))));
    }

    @Test
    @DisplayName("Ventana invertida lanza IllegalArgumentException")
    void generateTimestamp_withInvertedWindow_shouldThrow() {
        WeeklyPattern weekly = new WeeklyPattern();
        GenerationContext window = GenerationContext.builder().windowStart(WINDOW_END).windowEnd(WINDOW_START).build();

        assertThrows(IllegalArgumentException.class, () -> weekly.generateTimestamp(window));
    }

    @Test
    @DisplayName("Valor por periodo: peso del día (0 = domingo) y peso combinado día·hora")
    void getValueForPeriod_shouldReturnWeights() {
        List<Double> hourly = IntStream.range(0, 24).mapToObj(h -> h < 12 ? 0.5 : 1.0).collect(Collectors.toList());
        WeeklyPattern weekly = new WeeklyPattern(PatternConfig.of("hourly_weights", hourly));

        assertEquals(0.6, weekly.getValueForPeriod(0));
        assertEquals(0.9, weekly.getValueForPeriod(5));
        // Domingo 7 ene 2024 a las 08:00 -> 0.6 · 0.5
        assertEquals(0.3, weekly.getValueForPeriod(Instant.parse("2024-01-07T08:00:00Z")), 1e-12);
        assertEquals(0.3, weekly.generateAt(Instant.parse("2024-01-07T08:00:00Z")), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> weekly.getValueForPeriod(7));
    }

    @Test
    @DisplayName("Días y horas punta: índices con el peso máximo")
    void peaks_shouldListIndicesWithMaxWeight() {
        WeeklyPattern weekly = new WeeklyPattern();

        assertEquals(List.of(1, 2, 3, 4), weekly.getPeakDays());
        assertEquals(24, weekly.getPeakHours().size());
        assertEquals(CyclePeriod.WEEK, weekly.getPeriod().orElseThrow());
    }

    @Test
    @DisplayName("Validación: 7 y 24 pesos no negativos, no todos a cero, y al menos un intento")
    void validate_shouldCheckWeightVectors() {
        WeeklyPattern weekly = new WeeklyPattern();

        assertFalse(weekly.validate(PatternConfig.of("weekday_weights", List.of(1, 1, 1, 1, 1, 1))));
        assertFalse(weekly.validate(PatternConfig.of("weekday_weights", List.of(1, 1, 1, -1, 1, 1, 1))));
        assertFalse(weekly.validate(PatternConfig.of("weekday_weights", Collections.nCopies(7, 0))));
        assertFalse(weekly.validate(PatternConfig.of("hourly_weights", Collections.nCopies(23, 1))));
        assertFalse(weekly.validate(PatternConfig.of("max_attempts", 0)));
        assertTrue(weekly.validate(PatternConfig.of("weekday_weights", MONDAY_ONLY)));
    }
}
