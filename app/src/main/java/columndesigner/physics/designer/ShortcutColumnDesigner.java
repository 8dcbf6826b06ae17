package columndesigner.physics.designer;

import columndesigner.config.ColumnDesignConfig;
import columndesigner.config.FeedConditions;
import columndesigner.domain.component.ComponentTable;
import columndesigner.domain.design.ColumnDesignResult;
import columndesigner.domain.design.EfficiencyResult;
import columndesigner.domain.design.FeedStageResult;
import columndesigner.domain.design.FugResult;
import columndesigner.domain.design.PackedColumnSizing;
import columndesigner.domain.design.RefluxSweepRow;
import columndesigner.domain.design.TrayColumnSizing;
import columndesigner.domain.exception.SpecificationException;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.factory.CorrelationFactory;
import columndesigner.physics.sizing.PackedColumnSizer;
import columndesigner.physics.sizing.TrayColumnSizer;
import columndesigner.physics.solver.CompositionNormalizer;
import columndesigner.physics.solver.EfficiencyEstimator;
import columndesigner.physics.solver.FeedStageLocator;
import columndesigner.physics.solver.FugSolver;
import columndesigner.physics.solver.SeparationSpecifier;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Orquesta el diseño abreviado de una columna de destilación.
 * <p>
 * Pipeline: normalización → especificación → FUG → eficiencia de O'Connell →
 * plato de alimentación (Kirkbride) → columna de platos → columna de relleno →
 * barrido de reflujo. Cada etapa devuelve un registro inmutable nuevo que consume la
 * siguiente; el resultado agregado se construye una única vez al final. Cualquier error
 * aborta la ejecución completa y se propaga sin capturar.
 */
@Slf4j
public class ShortcutColumnDesigner implements AutoCloseable {

    private final ColumnDesignConfig config;

    private final FugSolver fugSolver;
    private final EfficiencyEstimator efficiencyEstimator;
    private final TrayColumnSizer trayColumnSizer;
    private final PackedColumnSizer packedColumnSizer;
    private final RefluxSweepAnalyzer sweepAnalyzer;

    public ShortcutColumnDesigner(ColumnDesignConfig config) {
        this(config,
                new FugSolver(CorrelationFactory.gilliland(config.gillilandForm())),
                new EfficiencyEstimator(CorrelationFactory.efficiency()),
                new TrayColumnSizer(),
                new PackedColumnSizer());
    }

    ShortcutColumnDesigner(ColumnDesignConfig config, FugSolver fugSolver, EfficiencyEstimator efficiencyEstimator,
                           TrayColumnSizer trayColumnSizer, PackedColumnSizer packedColumnSizer) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.fugSolver = fugSolver;
        this.efficiencyEstimator = efficiencyEstimator;
        this.trayColumnSizer = trayColumnSizer;
        this.packedColumnSizer = packedColumnSizer;
        this.sweepAnalyzer = new RefluxSweepAnalyzer(fugSolver, efficiencyEstimator, trayColumnSizer, config.sweepParallelism());

        log.info("ShortcutColumnDesigner inicializado. Gilliland={}, Eficiencia={}",
                fugSolver.getGilliland().getName(), efficiencyEstimator.getCorrelation().getName());
    }

    /**
     * Ejecuta el diseño completo para la tabla de componentes dada.
     *
     * @param components Tabla de componentes alineada con la composición y el vector α.
     * @return Resultado agregado inmutable.
     */
    public ColumnDesignResult design(ComponentTable components) {
        Objects.requireNonNull(components, "La tabla de componentes no puede ser nula.");
        long startTime = System.currentTimeMillis();

        FeedConditions feed = config.feed();
        double[] alpha = config.relativeVolatilities();
        double q = feed.getLiquidFraction();
        double[] molecularWeights = components.molecularWeights();
        checkAlignment(components, feed.composition(), alpha);

        // 1. Normalización
        double[] z = CompositionNormalizer.normalize(feed.composition());

        // 2. Especificación de la separación
        SeparationSpec spec = SeparationSpecifier.specify(feed.feedFlow(), z, alpha, config.separation());
        log.info("Especificación: D={} kmol/h, B={} kmol/h, LK={}, HK={}",
                fmt(spec.distillateFlow()), fmt(spec.bottomsFlow()),
                components.get(spec.lightKeyIndex()).name(), components.get(spec.heavyKeyIndex()).name());

        // 3. Fenske-Underwood-Gilliland
        FugResult fug = fugSolver.solve(spec, alpha, q, config.refluxFactor());
        log.info("FUG: Nmin={}, RRmin={}, RR={}, Nteo={}",
                fmt(fug.minimumStages()), fmt(fug.minimumRefluxRatio()), fmt(fug.operatingRefluxRatio()), fmt(fug.theoreticalStages()));

        // 4. Eficiencia y platos reales
        EfficiencyResult efficiency = efficiencyEstimator.estimate(z, components.viscositiesCp(), alpha,
                spec.lightKeyIndex(), spec.heavyKeyIndex(), fug.theoreticalStages());
        log.info("Eficiencia: mu_F={} cP, eta_G={}, N_real={}, N_pratos={}",
                fmt(efficiency.feedViscosityCp()), fmt(efficiency.overallEfficiency()),
                fmt(efficiency.realStages()), efficiency.adoptedTrays());

        // 5. Plato de alimentación
        FeedStageResult feedStage = FeedStageLocator.locate(spec, fug, efficiency);
        log.info("Alimentación: plato {} de {} (j_real={})",
                feedStage.adoptedFeedTray(), efficiency.adoptedTrays(), fmt(feedStage.realFeedStage()));

        // 6. Columna de platos
        TrayColumnSizing tray = trayColumnSizer.size(spec, fug.operatingRefluxRatio(), efficiency.adoptedTrays(),
                q, feed.pressureAtm(), molecularWeights, config.tray());
        log.info("Platos: D={} m, H_total={} m", fmt(tray.diameter()), fmt(tray.totalHeight()));

        // 7. Columna de relleno
        PackedColumnSizing packed = packedColumnSizer.size(spec, fug.operatingRefluxRatio(), fug.theoreticalStages(),
                feed.pressureAtm(), molecularWeights, config.packing());
        log.info("Relleno: D={} m, H_total={} m", fmt(packed.diameter()), fmt(packed.totalHeight()));

        // 8. Barrido de reflujo
        List<RefluxSweepRow> sweep = sweepAnalyzer.sweep(config.sweepRefluxFactors(), spec, fug, efficiency,
                q, feed.pressureAtm(), molecularWeights, config.tray());

        log.info("Diseño completado en {} ms.", System.currentTimeMillis() - startTime);

        return ColumnDesignResult.builder()
                .config(config)
                .componentNames(components.names())
                .normalizedComposition(z)
                .separation(spec)
                .fug(fug)
                .efficiency(efficiency)
                .feedStage(feedStage)
                .trayColumn(tray)
                .packedColumn(packed)
                .refluxSweep(sweep)
                .build();
    }

    /**
     * La tabla de componentes, la composición y el vector α deben estar alineados por índice.
     */
    private static void checkAlignment(ComponentTable components, double[] composition, double[] alpha) {
        if (components.size() != composition.length || components.size() != alpha.length) {
            throw new SpecificationException(String.format(
                    "Vectores desalineados: %d componentes, %d fracciones molares, %d volatilidades.",
                    components.size(), composition.length, alpha.length));
        }
    }

    private static String fmt(double value) {
        return String.format("%.4f", value);
    }

    @Override
    public void close() {
        sweepAnalyzer.close();
        log.info("ShortcutColumnDesigner cerrado.");
    }
}
