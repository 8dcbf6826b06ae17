package columndesigner.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Condiciones de la corriente de alimentación.
 *
 * @param feedFlow      Caudal molar total F [kmol/h].
 * @param composition   Fracciones molares tal y como las introduce el usuario (no necesariamente normalizadas).
 * @param vaporFraction Fracción vaporizada de la alimentación. La condición térmica es q = 1 - vaporFraction.
 * @param pressureAtm   Presión de operación de la columna [atm].
 */
@Builder
@With
public record FeedConditions(
        double feedFlow,
        double[] composition,
        double vaporFraction,
        double pressureAtm
) {
    public FeedConditions {
        Objects.requireNonNull(composition, "La composición de alimentación no puede ser nula.");
        composition = composition.clone();
    }

    @Override
    public double[] composition() {
        return composition.clone();
    }

    /**
     * Condición térmica q (fracción líquida de la alimentación).
     */
    @JsonIgnore
    public double getLiquidFraction() {
        return 1.0 - vaporFraction;
    }
}
