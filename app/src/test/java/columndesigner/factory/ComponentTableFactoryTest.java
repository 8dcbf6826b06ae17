package columndesigner.factory;

import columndesigner.config.ColumnDesignConfig;
import columndesigner.domain.component.Component;
import columndesigner.domain.component.ComponentTable;
import columndesigner.io.JsonFileHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentTableFactoryTest {

    @TempDir
    Path tempDir;

    private final ComponentTableFactory factory = new ComponentTableFactory(new JsonFileHandler());

    @Test
    @DisplayName("La tabla por defecto está alineada con el caso de referencia")
    void createDefaultTable_matchesReferenceCase() throws IOException {
        ComponentTable table = factory.createDefaultTable();

        assertEquals(5, table.size());
        assertArrayEquals(ColumnDesignConfig.getReferenceCase().relativeVolatilities(), table.referenceVolatilities(), 1e-12);
        assertEquals(100.21, table.get(2).molecularWeight(), 1e-12);
    }

    @Test
    @DisplayName("Una tabla leída de fichero se ordena de más a menos volátil")
    void createFromFile_sortsByVolatility() throws IOException {
        // ARRANGE
        Path file = tempDir.resolve("componentes.json");
        Files.writeString(file, """
                {
                  "components": [
                    {"name": "tolueno", "code": 2, "molecularWeight": 92.14, "referenceVolatility": 1.0, "viscosityCp": 0.56},
                    {"name": "benceno", "code": 1, "molecularWeight": 78.11, "referenceVolatility": 2.5, "viscosityCp": 0.60},
                    {"name": "xileno",  "code": 3, "molecularWeight": 106.17, "referenceVolatility": 0.4, "viscosityCp": 0.62}
                  ]
                }
                """);

        // ACT
        ComponentTable table = factory.createFromFile(file);

        // ASSERT
        assertEquals(List.of("benceno", "tolueno", "xileno"), table.names());
    }

    @Test
    @DisplayName("A igual volatilidad desempata el código")
    void sorted_breaksTiesByCode() {
        ComponentTable table = new ComponentTable(List.of(
                component("b", 8, 1.0),
                component("a", 4, 1.0),
                component("c", 1, 0.5)));

        assertEquals(List.of("a", "b", "c"), ComponentTableFactory.sorted(table).names());
    }

    @Test
    @DisplayName("CorrelationFactory traduce la forma de Gilliland configurada")
    void correlationFactory_mapsForms() {
        assertEquals("Molokanov", CorrelationFactory.gilliland(ColumnDesignConfig.GillilandForm.MOLOKANOV).getName());
        assertEquals("Eduljee", CorrelationFactory.gilliland(ColumnDesignConfig.GillilandForm.EDULJEE).getName());
        assertEquals("Molokanov", CorrelationFactory.gilliland(null).getName());
        assertEquals("O'Connell", CorrelationFactory.efficiency().getName());
    }

    private static Component component(String name, int code, double alpha) {
        return Component.builder()
                .name(name).code(code).molecularWeight(50.0).referenceVolatility(alpha).viscosityCp(0.3).build();
    }
}
