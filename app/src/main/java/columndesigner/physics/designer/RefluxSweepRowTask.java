package columndesigner.physics.designer;

import columndesigner.config.TrayDesignConditions;
import columndesigner.domain.design.EfficiencyResult;
import columndesigner.domain.design.FugResult;
import columndesigner.domain.design.RefluxSweepRow;
import columndesigner.domain.design.TrayColumnSizing;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.physics.sizing.TrayColumnSizer;
import columndesigner.physics.solver.EfficiencyEstimator;
import columndesigner.physics.solver.FugSolver;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Callable;

/**
 * Tarea ejecutable que calcula una fila del barrido de reflujo.
 * No depende de ninguna otra fila, por lo que puede ejecutarse en un pool de hilos.
 */
@RequiredArgsConstructor
public class RefluxSweepRowTask implements Callable<RefluxSweepRow> {

    // --- Colaboradores (sin estado mutable, compartidos) ---
    private final FugSolver fugSolver;
    private final EfficiencyEstimator efficiencyEstimator;
    private final TrayColumnSizer trayColumnSizer;

    // --- Punto de operación base ---
    private final SeparationSpec spec;
    private final FugResult minimums;
    private final EfficiencyResult efficiency;
    private final double liquidFraction;
    private final double pressureAtm;
    private final double[] molecularWeights;
    private final TrayDesignConditions trayConditions;

    // --- Entrada de la fila ---
    private final double refluxFactor;

    @Override
    public RefluxSweepRow call() {
        FugResult fug = fugSolver.withRefluxFactor(minimums, refluxFactor);
        EfficiencyResult stages = efficiencyEstimator.withTheoreticalStages(efficiency, fug.theoreticalStages());
        TrayColumnSizing tray = trayColumnSizer.size(spec, fug.operatingRefluxRatio(), stages.adoptedTrays(),
                liquidFraction, pressureAtm, molecularWeights, trayConditions);

        return RefluxSweepRow.builder()
                .refluxFactor(refluxFactor)
                .refluxRatio(fug.operatingRefluxRatio())
                .theoreticalStages(fug.theoreticalStages())
                .realStages(stages.realStages())
                .adoptedTrays(stages.adoptedTrays())
                .trayColumnDiameter(tray.diameter())
                .trayColumnTotalHeight(tray.totalHeight())
                .build();
    }
}
