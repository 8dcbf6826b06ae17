package columndesigner.io;

import columndesigner.domain.design.RefluxSweepRow;
import lombok.extern.slf4j.Slf4j;
import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYChartBuilder;
import org.knowm.xchart.XYSeries;
import org.knowm.xchart.style.Styler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * Genera la gráfica de sensibilidad al reflujo (platos adoptados y diámetro frente a RR).
 */
@Slf4j
public class RefluxSweepChartExporter {

    public static final String TRAYS_SERIES = "N pratos";
    public static final String DIAMETER_SERIES = "Diámetro [m]";

    /**
     * Construye la gráfica. Los puntos se ordenan por RR para dibujar la curva; la tabla
     * del resultado conserva el orden de entrada.
     */
    public XYChart buildChart(List<RefluxSweepRow> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("El barrido de reflujo no tiene filas que representar.");
        }
        List<RefluxSweepRow> sorted = rows.stream()
                .sorted(Comparator.comparingDouble(RefluxSweepRow::refluxRatio))
                .toList();

        double[] rr = sorted.stream().mapToDouble(RefluxSweepRow::refluxRatio).toArray();
        double[] trays = sorted.stream().mapToDouble(RefluxSweepRow::adoptedTrays).toArray();
        double[] diameters = sorted.stream().mapToDouble(RefluxSweepRow::trayColumnDiameter).toArray();

        XYChart chart = new XYChartBuilder()
                .width(800).height(500)
                .title("Sensibilidad al reflujo")
                .xAxisTitle("RR")
                .yAxisTitle("N pratos")
                .build();
        chart.getStyler().setLegendPosition(Styler.LegendPosition.InsideNE);
        chart.getStyler().setMarkerSize(6);

        chart.addSeries(TRAYS_SERIES, rr, trays);
        XYSeries diameterSeries = chart.addSeries(DIAMETER_SERIES, rr, diameters);
        diameterSeries.setYAxisGroup(1);
        chart.setYAxisGroupTitle(1, "Diámetro [m]");
        return chart;
    }

    /**
     * Guarda la gráfica como PNG.
     */
    public void saveChart(List<RefluxSweepRow> rows, Path path) throws IOException {
        XYChart chart = buildChart(rows);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BitmapEncoder.saveBitmap(chart, path.toString(), BitmapEncoder.BitmapFormat.PNG);
        log.info("Gráfica de sensibilidad guardada en {}", path.toAbsolutePath());
    }
}
