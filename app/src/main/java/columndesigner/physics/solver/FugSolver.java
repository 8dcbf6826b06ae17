package columndesigner.physics.solver;

import columndesigner.domain.design.FugResult;
import columndesigner.domain.exception.DegenerateSplitException;
import columndesigner.domain.exception.InvalidRefluxException;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.physics.i.IGillilandCorrelation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Método abreviado Fenske-Underwood-Gilliland (FUG) con volatilidades relativas constantes.
 * <p>
 * Fenske da las etapas mínimas en reflujo total, Underwood el reflujo mínimo con infinitas
 * etapas y Gilliland interpola el número de etapas teóricas para el reflujo de operación.
 * Las instancias no guardan estado mutable y pueden compartirse entre hilos.
 */
@Slf4j
public class FugSolver {

    /**
     * Por encima de este número de etapas teóricas el reflujo se considera indistinguible del mínimo.
     */
    public static final double MAX_THEORETICAL_STAGES = 1e6;

    @Getter
    private final IGillilandCorrelation gilliland;

    public FugSolver(IGillilandCorrelation gilliland) {
        this.gilliland = Objects.requireNonNull(gilliland, "La correlación de Gilliland no puede ser nula.");
    }

    /**
     * Ejecuta los tres pasos para el punto de operación.
     *
     * @param spec           Especificación de la separación.
     * @param alpha          Volatilidades relativas alineadas con la especificación.
     * @param liquidFraction Condición térmica q de la alimentación.
     * @param refluxFactor   f_R = RR / RR_min (&gt; 1).
     */
    public FugResult solve(SeparationSpec spec, double[] alpha, double liquidFraction, double refluxFactor) {
        validateRefluxFactor(refluxFactor);

        double nMin = fenskeMinimumStages(spec, alpha);

        int lk = spec.lightKeyIndex();
        int hk = spec.heavyKeyIndex();
        double theta = UnderwoodRootSolver.solveTheta(alpha, spec.feedComposition(), liquidFraction, lk, hk);
        double rrMin = UnderwoodRootSolver.minimumReflux(alpha, spec.distillateComposition(), theta);
        log.debug("Fenske/Underwood: Nmin={}, theta={}, RRmin={}", nMin, theta, rrMin);

        if (!(rrMin > 0) || !Double.isFinite(rrMin)) {
            throw new InvalidRefluxException(String.format(
                    "Underwood devuelve RR_min=%.5f; no es posible fijar un reflujo de operación como múltiplo del mínimo.", rrMin));
        }

        FugResult minimums = FugResult.builder()
                .minimumStages(nMin)
                .minimumRefluxRatio(rrMin)
                .underwoodRoot(theta)
                .build();
        return withRefluxFactor(minimums, refluxFactor);
    }

    /**
     * Repite sólo el paso de Gilliland para otro factor de reflujo; N_min, RR_min y θ son
     * invariantes frente al reflujo de operación.
     */
    public FugResult withRefluxFactor(FugResult minimums, double refluxFactor) {
        validateRefluxFactor(refluxFactor);

        double nMin = minimums.minimumStages();
        double rrMin = minimums.minimumRefluxRatio();
        double rr = refluxFactor * rrMin;
        double x = (rr - rrMin) / (rr + 1.0);
        double y = gilliland.stageFraction(x);

        double nTeo = (nMin + y) / (1.0 - y);
        if (!(y < 1.0) || !(nTeo <= MAX_THEORETICAL_STAGES)) {
            throw new InvalidRefluxException(String.format(
                    "f_R=%.8f es numéricamente indistinguible del reflujo mínimo (X=%.3e, N_teo=%.3e).", refluxFactor, x, nTeo));
        }

        return minimums
                .withRefluxFactor(refluxFactor)
                .withOperatingRefluxRatio(rr)
                .withGillilandAbscissa(x)
                .withGillilandOrdinate(y)
                .withTheoreticalStages(nTeo);
    }

    /**
     * Ecuación de Fenske:
     * N_min = ln[(xD_LK/xD_HK)·(xB_HK/xB_LK)] / ln(α_LK/α_HK).
     *
     * @throws DegenerateSplitException si alguna de las cuatro fracciones clave es &lt;= 0 o
     *                                  la separación no enriquece el LK en el destilado.
     */
    public double fenskeMinimumStages(SeparationSpec spec, double[] alpha) {
        int lk = spec.lightKeyIndex();
        int hk = spec.heavyKeyIndex();
        double xdLk = spec.distillateFractionOf(lk);
        double xdHk = spec.distillateFractionOf(hk);
        double xbLk = spec.bottomsFractionOf(lk);
        double xbHk = spec.bottomsFractionOf(hk);

        if (!(xdLk > 0) || !(xdHk > 0) || !(xbLk > 0) || !(xbHk > 0)) {
            throw new DegenerateSplitException(String.format(
                    "Fenske: fracciones clave no positivas (xD_LK=%.3e, xD_HK=%.3e, xB_LK=%.3e, xB_HK=%.3e). "
                            + "La separación es inviable o con recuperación total.", xdLk, xdHk, xbLk, xbHk));
        }

        double separationFactor = (xdLk / xdHk) * (xbHk / xbLk);
        double nMin = Math.log(separationFactor) / Math.log(alpha[lk] / alpha[hk]);
        if (nMin < 0) {
            throw new DegenerateSplitException(String.format(
                    "Fenske: el destilado no está enriquecido en el clave ligero (factor de separación=%.4f).", separationFactor));
        }
        return nMin;
    }

    public static void validateRefluxFactor(double refluxFactor) {
        if (!(refluxFactor > 1.0) || Double.isInfinite(refluxFactor)) {
            throw new InvalidRefluxException(String.format(
                    "El factor de reflujo debe ser > 1 y finito (recibido %s): en o por debajo del mínimo la columna es infinita.", refluxFactor));
        }
    }
}
