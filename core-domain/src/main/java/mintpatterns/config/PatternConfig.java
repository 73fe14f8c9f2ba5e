package mintpatterns.config;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;
import mintpatterns.domain.exception.PatternConfigurationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Mapa plano e inmutable de parámetros con nombre que configura un patrón.
 * <p>
 * Las claves siguen la convención snake_case de las definiciones externas
 * ({@code base_value}, {@code peak_value}...). Los valores pueden venir de código Java o de JSON,
 * por lo que los accesores tipados convierten números, cadenas numéricas y fechas ISO-8601.
 * Los valores {@code null} se descartan: un parámetro nulo equivale a no configurado.
 */
@EqualsAndHashCode
@ToString
public final class PatternConfig {

    public static final String SEED = "seed";
    public static final String TYPE = "type";

    private static final PatternConfig EMPTY = new PatternConfig(Map.of());

    private final Map<String, Object> values;

    @Builder
    private PatternConfig(@Singular Map<String, Object> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        this.values = Collections.unmodifiableMap(copy);
    }

    public static PatternConfig empty() {
        return EMPTY;
    }

    public static PatternConfig from(Map<String, ?> values) {
        return values == null || values.isEmpty() ? EMPTY : new PatternConfig(new LinkedHashMap<String, Object>(values));
    }

    public static PatternConfig of(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return new PatternConfig(map);
    }

    public static PatternConfig of(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(k1, v1);
        map.put(k2, v2);
        return new PatternConfig(map);
    }

    public static PatternConfig of(String k1, Object v1, String k2, Object v2, String k3, Object v3) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(k1, v1);
        map.put(k2, v2);
        map.put(k3, v3);
        return new PatternConfig(map);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    // --- Fusión ---

    /**
     * Fusión parcial: las claves de {@code update} sustituyen a las existentes, el resto se conserva.
     */
    public PatternConfig merge(PatternConfig update) {
        if (update == null || update.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(update.values);
        return new PatternConfig(merged);
    }

    public PatternConfig with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new PatternConfig(copy);
    }

    public PatternConfig without(String key) {
        if (!values.containsKey(key)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove(key);
        return new PatternConfig(copy);
    }

    // --- Accesores tipados ---

    public OptionalLong getSeed() {
        if (!has(SEED)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(toNumber(SEED, values.get(SEED)).longValue());
    }

    public double getDouble(String key, double defaultValue) {
        return has(key) ? toNumber(key, values.get(key)).doubleValue() : defaultValue;
    }

    /**
     * @return el valor numérico o {@code null} si no está configurado (límites opcionales).
     */
    public Double getNullableDouble(String key) {
        return has(key) ? toNumber(key, values.get(key)).doubleValue() : null;
    }

    public int getInt(String key, int defaultValue) {
        return has(key) ? toNumber(key, values.get(key)).intValue() : defaultValue;
    }

    public Integer getNullableInt(String key) {
        return has(key) ? toNumber(key, values.get(key)).intValue() : null;
    }

    public String getString(String key, String defaultValue) {
        return has(key) ? values.get(key).toString() : defaultValue;
    }

    public List<Object> getList(String key, List<?> defaultValue) {
        if (!has(key)) {
            return defaultValue == null ? List.of() : new ArrayList<>(defaultValue);
        }
        Object raw = values.get(key);
        if (raw instanceof List) {
            return new ArrayList<>((List<?>) raw);
        }
        if (raw instanceof Object[]) {
            return new ArrayList<>(List.of((Object[]) raw));
        }
        if (raw instanceof double[]) {
            List<Object> list = new ArrayList<>();
            for (double d : (double[]) raw) {
                list.add(d);
            }
            return list;
        }
        throw new PatternConfigurationException("El parámetro '" + key + "' debe ser una lista");
    }

    public List<Double> getDoubleList(String key, List<Double> defaultValue) {
        List<Object> raw = getList(key, defaultValue);
        List<Double> result = new ArrayList<>(raw.size());
        for (Object element : raw) {
            result.add(toNumber(key, element).doubleValue());
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key, Map<String, ?> defaultValue) {
        if (!has(key)) {
            return defaultValue == null ? Map.of() : new LinkedHashMap<>(defaultValue);
        }
        Object raw = values.get(key);
        if (raw instanceof Map) {
            return new LinkedHashMap<>((Map<String, Object>) raw);
        }
        throw new PatternConfigurationException("El parámetro '" + key + "' debe ser un mapa");
    }

    /**
     * Acepta {@link Instant}, fechas con zona, milisegundos epoch o texto ISO-8601
     * (instante completo o solo fecha, interpretada a medianoche UTC).
     *
     * @return el instante o {@code null} si no está configurado.
     */
    public Instant getInstant(String key) {
        if (!has(key)) {
            return null;
        }
        return toInstant(key, values.get(key));
    }

    // --- Conversión ---

    static Number toNumber(String key, Object raw) {
        if (raw instanceof Number) {
            return (Number) raw;
        }
        if (raw instanceof String) {
            try {
                return Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new PatternConfigurationException("El parámetro '" + key + "' debe ser numérico: " + raw, e);
            }
        }
        throw new PatternConfigurationException("El parámetro '" + key + "' debe ser numérico: " + raw);
    }

    static Instant toInstant(String key, Object raw) {
        if (raw instanceof Instant) {
            return (Instant) raw;
        }
        if (raw instanceof ZonedDateTime) {
            return ((ZonedDateTime) raw).toInstant();
        }
        if (raw instanceof OffsetDateTime) {
            return ((OffsetDateTime) raw).toInstant();
        }
        if (raw instanceof Number) {
            return Instant.ofEpochMilli(((Number) raw).longValue());
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim();
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException notOffset) {
                try {
                    return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
                } catch (DateTimeParseException e) {
                    throw new PatternConfigurationException("El parámetro '" + key + "' no es una fecha ISO-8601: " + raw, e);
                }
            }
        }
        throw new PatternConfigurationException("El parámetro '" + key + "' debe ser una fecha: " + raw);
    }
}
