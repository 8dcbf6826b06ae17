package columndesigner.physics.designer;

import columndesigner.config.TrayDesignConditions;
import columndesigner.domain.design.EfficiencyResult;
import columndesigner.domain.design.FugResult;
import columndesigner.domain.design.RefluxSweepRow;
import columndesigner.domain.exception.ColumnDesignException;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.physics.sizing.TrayColumnSizer;
import columndesigner.physics.solver.EfficiencyEstimator;
import columndesigner.physics.solver.FugSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Análisis de sensibilidad del diseño al reflujo de operación.
 * <p>
 * Para cada factor de reflujo repite Gilliland, la corrección de eficiencia y el
 * dimensionamiento de platos. N_min, RR_min y θ no cambian en el barrido. Las filas se
 * calculan como tareas independientes y se devuelven en el orden de los factores de
 * entrada, incluidos duplicados y factores desordenados. Un fallo en cualquier fila aborta
 * el barrido completo.
 */
@Slf4j
public class RefluxSweepAnalyzer implements AutoCloseable {

    private final FugSolver fugSolver;
    private final EfficiencyEstimator efficiencyEstimator;
    private final TrayColumnSizer trayColumnSizer;
    private final ExecutorService threadPool;

    public RefluxSweepAnalyzer(FugSolver fugSolver, EfficiencyEstimator efficiencyEstimator,
                               TrayColumnSizer trayColumnSizer, int parallelism) {
        this.fugSolver = Objects.requireNonNull(fugSolver);
        this.efficiencyEstimator = Objects.requireNonNull(efficiencyEstimator);
        this.trayColumnSizer = Objects.requireNonNull(trayColumnSizer);
        this.threadPool = Executors.newFixedThreadPool(Math.max(parallelism, 1));
        log.info("RefluxSweepAnalyzer inicializado. (Hilos: {})", Math.max(parallelism, 1));
    }

    public List<RefluxSweepRow> sweep(List<Double> refluxFactors, SeparationSpec spec, FugResult minimums,
                                      EfficiencyResult efficiency, double liquidFraction, double pressureAtm,
                                      double[] molecularWeights, TrayDesignConditions trayConditions) {
        Objects.requireNonNull(refluxFactors, "La lista de factores de reflujo no puede ser nula.");
        long startTime = System.currentTimeMillis();

        // Validación previa: un factor inválido aborta antes de lanzar tareas
        for (Double factor : refluxFactors) {
            FugSolver.validateRefluxFactor(factor == null ? Double.NaN : factor);
        }

        List<RefluxSweepRowTask> tasks = new ArrayList<>(refluxFactors.size());
        for (Double factor : refluxFactors) {
            tasks.add(new RefluxSweepRowTask(fugSolver, efficiencyEstimator, trayColumnSizer, spec, minimums,
                    efficiency, liquidFraction, pressureAtm, molecularWeights.clone(), trayConditions, factor));
        }

        List<Future<RefluxSweepRow>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Barrido de reflujo interrumpido.", e);
        }

        List<RefluxSweepRow> rows = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                rows.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Barrido de reflujo interrumpido.", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof ColumnDesignException) {
                    throw (ColumnDesignException) cause;
                }
                throw new IllegalStateException("Error en la fila " + i + " del barrido (f_R=" + refluxFactors.get(i) + ").", cause);
            }
        }

        log.info("Barrido de reflujo completado: {} filas en {} ms.", rows.size(), System.currentTimeMillis() - startTime);
        return List.copyOf(rows);
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("RefluxSweepAnalyzer cerrado.");
    }
}
