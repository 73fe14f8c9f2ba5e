package mintpatterns.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mintpatterns.config.EngineConfig;
import mintpatterns.factory.PatternRegistry;
import mintpatterns.pattern.Pattern;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lee definiciones de patrones y la configuración del motor desde archivos JSON.
 * <p>
 * Un archivo de definiciones es un objeto cuyos campos son nombres y cuyos valores son
 * definiciones {@code {"type": ..., ...parámetros}} que se construyen con {@link PatternRegistry#load}.
 * <pre>
 * {
 *   "pedidos":  {"type": "poisson", "lambda": 12, "seed": 7},
 *   "trafico":  {"type": "business_hours", "timezone": "Europe/Madrid"}
 * }
 * </pre>
 */
@Slf4j
public class PatternDefinitionLoader {

    private static final TypeReference<LinkedHashMap<String, Map<String, Object>>> DEFINITIONS = new TypeReference<>() {
    };

    // Costoso de crear y thread-safe: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private final PatternRegistry registry;

    public PatternDefinitionLoader(PatternRegistry registry) {
        this.registry = registry;
    }

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Lee las definiciones sin construir los patrones.
     *
     * @throws IOException si el archivo no existe o no es JSON válido.
     */
    public Map<String, Map<String, Object>> readDefinitions(Path path) throws IOException {
        log.info("Leyendo definiciones de patrones desde {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), DEFINITIONS);
        } catch (IOException e) {
            log.error("Error al leer o parsear las definiciones desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee y construye todos los patrones del archivo, conservando el orden de declaración.
     */
    public Map<String, Pattern> load(Path path) throws IOException {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        readDefinitions(path).forEach((name, definition) -> patterns.put(name, registry.load(definition)));
        log.debug("{} patrones construidos desde {}", patterns.size(), path.getFileName());
        return patterns;
    }

    public EngineConfig readEngineConfig(Path path) throws IOException {
        log.info("Leyendo configuración del motor desde {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), EngineConfig.class);
        } catch (IOException e) {
            log.error("Error al leer o parsear la configuración del motor desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
