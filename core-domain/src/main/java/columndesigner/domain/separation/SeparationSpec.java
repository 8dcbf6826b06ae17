package columndesigner.domain.separation;

import lombok.Builder;

import java.util.Objects;

/**
 * Especificación de la separación derivada una vez por ejecución a partir de la
 * alimentación y de los objetivos de recuperación.
 * <p>
 * Invariantes garantizadas por {@code SeparationSpecifier}:
 * {@code D_i + B_i = F_i} para todo i, {@code D + B = F}, y {@code xD}, {@code xB} son
 * distribuciones válidas. Todos los arrays se copian a la entrada y a la salida.
 *
 * @param feedFlow             Caudal total de alimentación F [kmol/h].
 * @param feedComposition      Composición normalizada de la alimentación z [mol/mol].
 * @param feedFlows            Caudales por componente en la alimentación F_i [kmol/h].
 * @param distillateFlow       Caudal total de destilado D [kmol/h].
 * @param bottomsFlow          Caudal total de fondo B [kmol/h].
 * @param distillateFlows      Caudales por componente en el destilado D_i [kmol/h].
 * @param bottomsFlows         Caudales por componente en el fondo B_i [kmol/h].
 * @param distillateComposition Composición del destilado xD [mol/mol].
 * @param bottomsComposition   Composición del fondo xB [mol/mol].
 * @param distillateRecoveries Recuperación en destilado usada para cada componente.
 * @param lightKeyIndex        Índice del clave ligero.
 * @param heavyKeyIndex        Índice del clave pesado.
 */
@Builder
public record SeparationSpec(
        double feedFlow,
        double[] feedComposition,
        double[] feedFlows,
        double distillateFlow,
        double bottomsFlow,
        double[] distillateFlows,
        double[] bottomsFlows,
        double[] distillateComposition,
        double[] bottomsComposition,
        double[] distillateRecoveries,
        int lightKeyIndex,
        int heavyKeyIndex
) {
    public SeparationSpec {
        Objects.requireNonNull(feedComposition, "La composición de alimentación no puede ser nula.");
        Objects.requireNonNull(feedFlows, "Los caudales de alimentación no pueden ser nulos.");
        Objects.requireNonNull(distillateFlows, "Los caudales de destilado no pueden ser nulos.");
        Objects.requireNonNull(bottomsFlows, "Los caudales de fondo no pueden ser nulos.");
        Objects.requireNonNull(distillateComposition, "La composición de destilado no puede ser nula.");
        Objects.requireNonNull(bottomsComposition, "La composición de fondo no puede ser nula.");
        Objects.requireNonNull(distillateRecoveries, "Las recuperaciones no pueden ser nulas.");

        int n = feedComposition.length;
        if (feedFlows.length != n || distillateFlows.length != n || bottomsFlows.length != n
                || distillateComposition.length != n || bottomsComposition.length != n || distillateRecoveries.length != n) {
            throw new IllegalArgumentException("Todos los vectores de la especificación deben tener la misma longitud.");
        }

        feedComposition = feedComposition.clone();
        feedFlows = feedFlows.clone();
        distillateFlows = distillateFlows.clone();
        bottomsFlows = bottomsFlows.clone();
        distillateComposition = distillateComposition.clone();
        bottomsComposition = bottomsComposition.clone();
        distillateRecoveries = distillateRecoveries.clone();
    }

    public int componentCount() {
        return feedComposition.length;
    }

    @Override
    public double[] feedComposition() {
        return feedComposition.clone();
    }

    @Override
    public double[] feedFlows() {
        return feedFlows.clone();
    }

    @Override
    public double[] distillateFlows() {
        return distillateFlows.clone();
    }

    @Override
    public double[] bottomsFlows() {
        return bottomsFlows.clone();
    }

    @Override
    public double[] distillateComposition() {
        return distillateComposition.clone();
    }

    @Override
    public double[] bottomsComposition() {
        return bottomsComposition.clone();
    }

    @Override
    public double[] distillateRecoveries() {
        return distillateRecoveries.clone();
    }

    // --- Accesos directos sin copia para los componentes clave ---

    public double feedFractionOf(int i) {
        return feedComposition[i];
    }

    public double distillateFractionOf(int i) {
        return distillateComposition[i];
    }

    public double bottomsFractionOf(int i) {
        return bottomsComposition[i];
    }
}
