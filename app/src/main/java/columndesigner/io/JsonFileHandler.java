package columndesigner.io;

import columndesigner.config.ColumnDesignConfig;
import columndesigner.domain.component.ComponentTable;
import columndesigner.domain.design.ColumnDesignResult;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura de configuraciones y tablas de componentes, y escritura de resultados, en JSON.
 * <p>
 * Los registros del dominio se (de)serializan directamente a través de sus constructores
 * canónicos, sin DTOs intermedios.
 */
@Slf4j
public class JsonFileHandler {

    // Thread-safe una vez configurado; se comparte entre todas las instancias
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Los ficheros de caso pueden llevar campos descriptivos que el cálculo ignora
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public ColumnDesignConfig readConfig(Path path) throws IOException {
        return read(path, ColumnDesignConfig.class);
    }

    public ComponentTable readComponentTable(Path path) throws IOException {
        return read(path, ComponentTable.class);
    }

    /**
     * Lee una tabla de componentes desde un recurso ya abierto (ej: classpath).
     * El llamador es responsable de cerrar el flujo.
     */
    public ComponentTable readComponentTable(InputStream input, String sourceName) throws IOException {
        log.info("Leyendo tabla de componentes desde {}", sourceName);
        try {
            return objectMapper.readValue(input, ComponentTable.class);
        } catch (IOException e) {
            log.error("Tabla de componentes ilegible en {}", sourceName, e);
            throw e;
        }
    }

    /**
     * Escribe el resultado agregado como JSON indentado. Sobrescribe el fichero si existe.
     */
    public void writeResult(ColumnDesignResult result, Path path) throws IOException {
        log.info("Escribiendo resultado del diseño en {}", path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), result);
        } catch (IOException e) {
            log.error("Error al escribir el resultado en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    private <T> T read(Path path, Class<T> type) throws IOException {
        log.info("Leyendo {} desde {}", type.getSimpleName(), path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.error("Error al leer o parsear {} desde {}", type.getSimpleName(), path.toAbsolutePath(), e);
            throw e;
        }
    }
}
