package columndesigner.physics.solver;

import columndesigner.domain.exception.InvalidCompositionException;

import java.util.Objects;

/**
 * Reescala un vector de fracciones molares para que sume 1.
 * Función pura: devuelve un array nuevo del mismo orden y longitud.
 */
public final class CompositionNormalizer {

    /**
     * Prohibido construir esta clase utilidad
     */
    private CompositionNormalizer() {
    }

    /**
     * @param composition Fracciones no negativas, no necesariamente normalizadas.
     * @return Composición normalizada.
     * @throws InvalidCompositionException si alguna entrada es negativa o no finita, o si la suma es &lt;= 0.
     */
    public static double[] normalize(double[] composition) {
        Objects.requireNonNull(composition, "La composición no puede ser nula.");

        // Se escala por la mayor fracción para que la suma no desborde
        double max = 0.0;
        for (int i = 0; i < composition.length; i++) {
            double zi = composition[i];
            if (!Double.isFinite(zi) || zi < 0.0) {
                throw new InvalidCompositionException(String.format(
                        "La fracción molar del componente %d no es válida: %s.", i, zi));
            }
            max = Math.max(max, zi);
        }
        if (!(max > 0.0)) {
            throw new InvalidCompositionException("La suma de la composición debe ser > 0 (todas las fracciones son nulas).");
        }

        double sum = 0.0;
        for (double zi : composition) {
            sum += zi / max;
        }

        double[] normalized = new double[composition.length];
        for (int i = 0; i < composition.length; i++) {
            normalized[i] = (composition[i] / max) / sum;
        }
        return normalized;
    }
}
