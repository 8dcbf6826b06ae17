package columndesigner.physics.solver;

import columndesigner.domain.exception.SpecificationException;
import columndesigner.domain.separation.SeparationSpec;
import columndesigner.domain.separation.SeparationTarget;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Deriva los caudales y composiciones de destilado y fondo a partir de la alimentación y
 * de las recuperaciones objetivo, e identifica los componentes clave.
 */
@Slf4j
public final class SeparationSpecifier {

    private static final double RECOVERY_TOLERANCE = 1e-9;

    private SeparationSpecifier() {
    }

    /**
     * @param feedFlow             Caudal de alimentación F [kmol/h] (&gt; 0).
     * @param normalizedComposition Composición z ya normalizada.
     * @param relativeVolatilities Vector α alineado con z.
     * @param target               Recuperaciones y componentes clave.
     * @return Especificación con balance de materia exacto por componente.
     * @throws SpecificationException si los vectores no están alineados, las claves no son válidas
     *                                o alguna recuperación produce un caudal negativo.
     */
    public static SeparationSpec specify(double feedFlow, double[] normalizedComposition,
                                         double[] relativeVolatilities, SeparationTarget target) {
        Objects.requireNonNull(normalizedComposition, "La composición no puede ser nula.");
        Objects.requireNonNull(relativeVolatilities, "El vector de volatilidades no puede ser nulo.");
        Objects.requireNonNull(target, "El objetivo de separación no puede ser nulo.");

        int n = normalizedComposition.length;
        validateInputs(feedFlow, n, relativeVolatilities, target);

        double[] feedFlows = new double[n];
        double[] distillateFlows = new double[n];
        double[] bottomsFlows = new double[n];
        double[] recoveries = new double[n];
        double distillate = 0.0;
        double bottoms = 0.0;

        for (int i = 0; i < n; i++) {
            double recovery = target.recoveryOf(i);
            if (!(recovery >= 0.0 && recovery <= 1.0)) {
                throw new SpecificationException(String.format(
                        "La recuperación del componente %d (%.4f) produce un caudal negativo.", i, recovery));
            }
            recoveries[i] = recovery;
            feedFlows[i] = feedFlow * normalizedComposition[i];
            distillateFlows[i] = feedFlows[i] * recovery;
            // B_i se obtiene por diferencia para que el balance sea exacto
            bottomsFlows[i] = feedFlows[i] - distillateFlows[i];
            distillate += distillateFlows[i];
            bottoms += bottomsFlows[i];
        }

        if (!(distillate > 0.0) || !(bottoms > 0.0)) {
            throw new SpecificationException(String.format(
                    "Las recuperaciones dejan un producto vacío (D=%.4f, B=%.4f).", distillate, bottoms));
        }

        double[] xD = new double[n];
        double[] xB = new double[n];
        for (int i = 0; i < n; i++) {
            xD[i] = distillateFlows[i] / distillate;
            xB[i] = bottomsFlows[i] / bottoms;
        }

        log.debug("Especificación: D={} kmol/h, B={} kmol/h, LK={}, HK={}",
                distillate, bottoms, target.lightKeyIndex(), target.heavyKeyIndex());

        return SeparationSpec.builder()
                .feedFlow(feedFlow)
                .feedComposition(normalizedComposition)
                .feedFlows(feedFlows)
                .distillateFlow(distillate)
                .bottomsFlow(bottoms)
                .distillateFlows(distillateFlows)
                .bottomsFlows(bottomsFlows)
                .distillateComposition(xD)
                .bottomsComposition(xB)
                .distillateRecoveries(recoveries)
                .lightKeyIndex(target.lightKeyIndex())
                .heavyKeyIndex(target.heavyKeyIndex())
                .build();
    }

    private static void validateInputs(double feedFlow, int n, double[] alpha, SeparationTarget target) {
        if (!(feedFlow > 0) || Double.isInfinite(feedFlow)) {
            throw new SpecificationException("El caudal de alimentación debe ser positivo y finito (F=" + feedFlow + ").");
        }
        if (alpha.length != n) {
            throw new SpecificationException(String.format(
                    "El vector de volatilidades (%d) no está alineado con la composición (%d).", alpha.length, n));
        }
        double[] recoveries = target.distillateRecoveries();
        if (recoveries != null && recoveries.length != n) {
            throw new SpecificationException(String.format(
                    "El vector de recuperaciones (%d) no está alineado con la composición (%d).", recoveries.length, n));
        }

        int lk = target.lightKeyIndex();
        int hk = target.heavyKeyIndex();
        if (lk < 0 || hk >= n) {
            throw new SpecificationException(String.format("Índices de componentes clave fuera de rango: LK=%d, HK=%d.", lk, hk));
        }
        if (hk != lk + 1) {
            throw new SpecificationException(String.format(
                    "Los componentes clave deben ser adyacentes en volatilidad (LK=%d, HK=%d).", lk, hk));
        }
        if (!(alpha[lk] > alpha[hk])) {
            throw new SpecificationException(String.format(
                    "El clave ligero debe ser más volátil que el clave pesado (α_LK=%.4f, α_HK=%.4f).", alpha[lk], alpha[hk]));
        }
        if (recoveries != null) {
            requireSameRecovery("LK", target.lightKeyRecovery(), recoveries[lk]);
            requireSameRecovery("HK", target.heavyKeyRecovery(), recoveries[hk]);
        }
    }

    private static void requireSameRecovery(String key, double scalar, double fromVector) {
        if (!(Math.abs(scalar - fromVector) <= RECOVERY_TOLERANCE)) {
            throw new SpecificationException(String.format(
                    "La recuperación del %s (%.6f) contradice la del vector de recuperaciones (%.6f).", key, scalar, fromVector));
        }
    }
}
