package columndesigner.domain.component;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Tabla ordenada e inmutable de componentes.
 * <p>
 * El orden de la tabla fija el índice usado por los vectores de composición y de
 * volatilidad relativa en todo el cálculo (más volátil primero). Se carga una vez y se
 * trata como de solo lectura a partir de entonces, por lo que puede compartirse entre
 * cualquier número de ejecuciones concurrentes.
 *
 * @param components Componentes en el orden de índice del cálculo.
 */
public record ComponentTable(List<Component> components) {

    @JsonCreator
    public ComponentTable(@JsonProperty("components") List<Component> components) {
        Objects.requireNonNull(components, "La lista de componentes no puede ser nula.");
        if (components.isEmpty()) {
            throw new IllegalArgumentException("La tabla de componentes no puede estar vacía.");
        }
        this.components = List.copyOf(components);
    }

    public int size() {
        return components.size();
    }

    public Component get(int index) {
        if (index < 0 || index >= components.size()) {
            throw new IndexOutOfBoundsException("El índice de componente " + index + " está fuera de los límites [0, " + (components.size() - 1) + "].");
        }
        return components.get(index);
    }

    public double[] molecularWeights() {
        return components.stream().mapToDouble(Component::molecularWeight).toArray();
    }

    public double[] viscositiesCp() {
        return components.stream().mapToDouble(Component::viscosityCp).toArray();
    }

    /**
     * Volatilidades relativas tabuladas, útiles como vector α por defecto.
     */
    public double[] referenceVolatilities() {
        return components.stream().mapToDouble(Component::referenceVolatility).toArray();
    }

    public List<String> names() {
        return components.stream().map(Component::name).toList();
    }
}
