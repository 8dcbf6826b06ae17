package columndesigner.domain.design;

import columndesigner.config.ColumnDesignConfig;
import columndesigner.domain.separation.SeparationSpec;
import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * Resultado agregado de una ejecución completa del diseño.
 * <p>
 * Se crea una única vez al final del pipeline a partir de los registros inmutables que
 * produce cada etapa; no hay estado compartido entre ejecuciones. La capa de presentación
 * sólo lo lee.
 *
 * @param config                 Entradas de la ejecución (eco).
 * @param componentNames         Nombres de los componentes en el orden de índice.
 * @param normalizedComposition  Composición de alimentación normalizada.
 * @param separation             Balance de materia y componentes clave.
 * @param fug                    Resultado Fenske-Underwood-Gilliland.
 * @param efficiency             Eficiencia de O'Connell y número de platos reales.
 * @param feedStage              Localización del plato de alimentación.
 * @param trayColumn             Columna de platos.
 * @param packedColumn           Columna de relleno.
 * @param refluxSweep            Filas del barrido en el orden de los factores de entrada.
 */
@Builder
public record ColumnDesignResult(
        ColumnDesignConfig config,
        List<String> componentNames,
        double[] normalizedComposition,
        SeparationSpec separation,
        FugResult fug,
        EfficiencyResult efficiency,
        FeedStageResult feedStage,
        TrayColumnSizing trayColumn,
        PackedColumnSizing packedColumn,
        List<RefluxSweepRow> refluxSweep
) {
    public ColumnDesignResult {
        Objects.requireNonNull(normalizedComposition, "La composición normalizada no puede ser nula.");
        componentNames = componentNames == null ? List.of() : List.copyOf(componentNames);
        normalizedComposition = normalizedComposition.clone();
        refluxSweep = refluxSweep == null ? List.of() : List.copyOf(refluxSweep);
    }

    @Override
    public double[] normalizedComposition() {
        return normalizedComposition.clone();
    }
}
