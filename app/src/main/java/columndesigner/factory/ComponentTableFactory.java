package columndesigner.factory;

import columndesigner.domain.component.Component;
import columndesigner.domain.component.ComponentTable;
import columndesigner.io.JsonFileHandler;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * Carga la tabla de componentes y la ordena de más a menos volátil.
 * <p>
 * El orden resultante es el que deben seguir los vectores de composición y de
 * volatilidad relativa del caso de diseño.
 */
public class ComponentTableFactory {

    public static final String DEFAULT_RESOURCE = "/components.json";

    private static final Comparator<Component> MOST_VOLATILE_FIRST =
            Comparator.comparingDouble(Component::referenceVolatility).reversed()
                    .thenComparingInt(Component::code);

    private final JsonFileHandler jsonFileHandler;

    public ComponentTableFactory(JsonFileHandler jsonFileHandler) {
        this.jsonFileHandler = jsonFileHandler;
    }

    /**
     * Tabla por defecto del classpath (n-C5, n-C6, n-C7, n-C9, n-C10).
     */
    public ComponentTable createDefaultTable() throws IOException {
        try (InputStream input = ComponentTableFactory.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IOException("Recurso no encontrado en el classpath: " + DEFAULT_RESOURCE);
            }
            return sorted(jsonFileHandler.readComponentTable(input, DEFAULT_RESOURCE));
        }
    }

    public ComponentTable createFromFile(Path path) throws IOException {
        return sorted(jsonFileHandler.readComponentTable(path));
    }

    static ComponentTable sorted(ComponentTable table) {
        List<Component> ordered = table.components().stream()
                .sorted(MOST_VOLATILE_FIRST)
                .toList();
        return new ComponentTable(ordered);
    }
}
