package columndesigner;

import columndesigner.config.ColumnDesignConfig;
import columndesigner.domain.component.ComponentTable;
import columndesigner.domain.design.ColumnDesignResult;
import columndesigner.domain.design.RefluxSweepRow;
import columndesigner.domain.exception.ColumnDesignException;
import columndesigner.factory.ComponentTableFactory;
import columndesigner.io.JsonFileHandler;
import columndesigner.io.RefluxSweepChartExporter;
import columndesigner.physics.designer.ShortcutColumnDesigner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Punto de entrada de línea de comandos.
 * <p>
 * Uso: {@code ColumnDesignerApp [caso.json] [directorioSalida] [componentes.json]}. Sin argumentos
 * ejecuta el caso de referencia con la tabla de componentes del classpath y sólo muestra el
 * resumen. Un caso con otros componentes debe acompañarse de su propia tabla, alineada por
 * índice con la composición y el vector α del caso.
 */
@Slf4j
public class ColumnDesignerApp {

    public static final String RESULT_FILE = "column-design.json";
    public static final String CHART_FILE = "reflux-sweep.png";

    private final JsonFileHandler jsonFileHandler;
    private final ComponentTableFactory componentTableFactory;
    private final RefluxSweepChartExporter chartExporter;

    public ColumnDesignerApp() {
        this(new JsonFileHandler());
    }

    private ColumnDesignerApp(JsonFileHandler jsonFileHandler) {
        this(jsonFileHandler, new ComponentTableFactory(jsonFileHandler), new RefluxSweepChartExporter());
    }

    ColumnDesignerApp(JsonFileHandler jsonFileHandler, ComponentTableFactory componentTableFactory,
                      RefluxSweepChartExporter chartExporter) {
        this.jsonFileHandler = jsonFileHandler;
        this.componentTableFactory = componentTableFactory;
        this.chartExporter = chartExporter;
    }

    public static void main(String[] args) {
        int status = new ColumnDesignerApp().run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return Código de salida: 0 éxito, 1 diseño inviable o fallo inesperado del cálculo,
     * 2 error de entrada/salida.
     */
    public int run(String[] args) {
        try {
            ColumnDesignConfig config = args.length > 0
                    ? jsonFileHandler.readConfig(Paths.get(args[0]))
                    : ColumnDesignConfig.getReferenceCase();
            ComponentTable components = args.length > 2
                    ? componentTableFactory.createFromFile(Paths.get(args[2]))
                    : componentTableFactory.createDefaultTable();

            ColumnDesignResult result;
            try (ShortcutColumnDesigner designer = new ShortcutColumnDesigner(config)) {
                result = designer.design(components);
            }
            logSummary(result);

            if (args.length > 1) {
                Path outputDir = Paths.get(args[1]);
                jsonFileHandler.writeResult(result, outputDir.resolve(RESULT_FILE));
                if (!result.refluxSweep().isEmpty()) {
                    chartExporter.saveChart(result.refluxSweep(), outputDir.resolve(CHART_FILE));
                }
            }
            return 0;
        } catch (ColumnDesignException e) {
            log.warn("Diseño inviable ({}): {}", e.getClass().getSimpleName(), e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Error de entrada/salida: {}", e.getMessage(), e);
            return 2;
        } catch (RuntimeException e) {
            log.warn("Diseño abortado por un error inesperado ({}): {}", e.getClass().getSimpleName(), e.getMessage(), e);
            return 1;
        }
    }

    private void logSummary(ColumnDesignResult r) {
        log.info("=== Resumen del diseño ===");
        log.info(String.format("N_min = %.3f | RR_min = %.4f | theta = %.4f",
                r.fug().minimumStages(), r.fug().minimumRefluxRatio(), r.fug().underwoodRoot()));
        log.info(String.format("RR = %.4f (f_R = %.2f) | N_teo = %.3f",
                r.fug().operatingRefluxRatio(), r.fug().refluxFactor(), r.fug().theoreticalStages()));
        log.info(String.format("eta_G = %.4f | N_real = %.3f | N_pratos = %d | plato de alimentación = %d",
                r.efficiency().overallEfficiency(), r.efficiency().realStages(),
                r.efficiency().adoptedTrays(), r.feedStage().adoptedFeedTray()));
        log.info(String.format("Platos:  D = %.3f m | H = %.2f m",
                r.trayColumn().diameter(), r.trayColumn().totalHeight()));
        log.info(String.format("Relleno: D = %.3f m | H = %.2f m (%s)",
                r.packedColumn().diameter(), r.packedColumn().totalHeight(), r.packedColumn().packingName()));

        log.info("--- Sensibilidad al reflujo ---");
        log.info(String.format("%6s %8s %8s %8s %6s %8s %8s", "f_R", "RR", "N_teo", "N_real", "N", "D [m]", "H [m]"));
        for (RefluxSweepRow row : r.refluxSweep()) {
            log.info(String.format("%6.2f %8.4f %8.3f %8.3f %6d %8.3f %8.2f",
                    row.refluxFactor(), row.refluxRatio(), row.theoreticalStages(), row.realStages(),
                    row.adoptedTrays(), row.trayColumnDiameter(), row.trayColumnTotalHeight()));
        }
    }
}
