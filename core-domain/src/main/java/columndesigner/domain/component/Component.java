package columndesigner.domain.component;

import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Registro inmutable con las propiedades físicas de un componente puro.
 * <p>
 * Lo suministra la tabla de componentes externa; el núcleo de cálculo nunca lo modifica.
 *
 * @param name                Nombre del componente (ej: "n-heptano").
 * @param code                Código numérico de la tabla de origen (ej: 7 para n-C7).
 * @param boilingPointK       Punto de ebullición normal [K].
 * @param molecularWeight     Masa molar [kg/kmol] (> 0).
 * @param referenceVolatility Volatilidad relativa respecto al componente más pesado. Define el orden de la tabla.
 * @param liquidDensity       Densidad del líquido a 25 °C [kg/m³].
 * @param viscosityCp         Viscosidad del líquido a 25 °C [cP] (> 0). Base de la estimación de la viscosidad de la alimentación.
 */
@Builder
@With
public record Component(
        String name,
        int code,
        double boilingPointK,
        double molecularWeight,
        double referenceVolatility,
        double liquidDensity,
        double viscosityCp
) {
    public Component {
        Objects.requireNonNull(name, "El nombre del componente no puede ser nulo.");
        if (!(molecularWeight > 0) || Double.isInfinite(molecularWeight)) {
            throw new IllegalArgumentException("La masa molar de " + name + " debe ser positiva y finita.");
        }
        if (!(viscosityCp > 0) || Double.isInfinite(viscosityCp)) {
            throw new IllegalArgumentException("La viscosidad de " + name + " debe ser positiva y finita.");
        }
    }
}
