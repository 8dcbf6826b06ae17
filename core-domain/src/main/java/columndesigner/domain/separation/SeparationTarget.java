package columndesigner.domain.separation;

import lombok.Builder;
import lombok.With;

/**
 * Objetivos de recuperación que definen la separación deseada.
 * <p>
 * Si {@code distillateRecoveries} es nulo, los componentes no clave se asignan al producto
 * del que están más cerca en volatilidad: los más ligeros que el LK salen íntegros por el
 * destilado y los más pesados que el HK íntegros por el fondo. Si se proporciona, el vector
 * completo manda; sus entradas de LK y HK deben coincidir con las recuperaciones escalares
 * (lo comprueba {@code SeparationSpecifier}).
 *
 * @param lightKeyIndex        Índice del componente clave ligero (LK).
 * @param heavyKeyIndex        Índice del componente clave pesado (HK), adyacente al LK.
 * @param lightKeyRecovery     Fracción del LK alimentado que se recupera en el destilado.
 * @param heavyKeyRecovery     Fracción del HK alimentado que escapa al destilado.
 * @param distillateRecoveries Recuperación en destilado de cada componente (opcional).
 */
@Builder
@With
public record SeparationTarget(
        int lightKeyIndex,
        int heavyKeyIndex,
        double lightKeyRecovery,
        double heavyKeyRecovery,
        double[] distillateRecoveries
) {
    public SeparationTarget {
        distillateRecoveries = distillateRecoveries == null ? null : distillateRecoveries.clone();
    }

    @Override
    public double[] distillateRecoveries() {
        return distillateRecoveries == null ? null : distillateRecoveries.clone();
    }

    /**
     * Recuperación en destilado que la política asigna al componente {@code i}.
     */
    public double recoveryOf(int i) {
        if (distillateRecoveries != null) {
            return distillateRecoveries[i];
        }
        if (i == lightKeyIndex) return lightKeyRecovery;
        if (i == heavyKeyIndex) return heavyKeyRecovery;
        return i < lightKeyIndex ? 1.0 : 0.0;
    }
}
