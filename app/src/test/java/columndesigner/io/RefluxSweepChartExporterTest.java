package columndesigner.io;

import columndesigner.domain.design.RefluxSweepRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYSeries;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RefluxSweepChartExporterTest {

    private final RefluxSweepChartExporter exporter = new RefluxSweepChartExporter();

    private static RefluxSweepRow row(double factor, double rr, int trays, double diameter) {
        return RefluxSweepRow.builder()
                .refluxFactor(factor)
                .refluxRatio(rr)
                .theoreticalStages(trays / 2.0)
                .realStages(trays - 0.5)
                .adoptedTrays(trays)
                .trayColumnDiameter(diameter)
                .trayColumnTotalHeight(trays * 0.5 + 4.0)
                .build();
    }

    @Test
    @DisplayName("La gráfica tiene una serie de platos y otra de diámetro sobre el eje secundario")
    void buildChart_createsBothSeries() {
        List<RefluxSweepRow> rows = List.of(
                row(2.0, 7.17, 29, 4.12),
                row(1.1, 3.94, 51, 3.12),
                row(1.3, 4.66, 40, 3.36));

        XYChart chart = exporter.buildChart(rows);

        XYSeries trays = chart.getSeriesMap().get(RefluxSweepChartExporter.TRAYS_SERIES);
        XYSeries diameter = chart.getSeriesMap().get(RefluxSweepChartExporter.DIAMETER_SERIES);
        assertNotNull(trays);
        assertNotNull(diameter);
        assertEquals(1, diameter.getYAxisGroup());
        // Puntos ordenados por RR para la curva
        assertArrayEquals(new double[]{3.94, 4.66, 7.17}, trays.getXData(), 1e-12);
        assertArrayEquals(new double[]{51, 40, 29}, trays.getYData(), 1e-12);
    }

    @Test
    @DisplayName("Un barrido vacío no se puede representar")
    void buildChart_rejectsEmptySweep() {
        assertThrows(IllegalArgumentException.class, () -> exporter.buildChart(List.of()));
    }
}
