package columndesigner.physics.i;

/**
 * Contrato base para cualquier correlación empírica del sistema.
 * Permite registrar en el log qué ajuste publicado se ha utilizado en un diseño,
 * ya que existen varias versiones ligeramente distintas de cada correlación.
 */
public interface ICorrelation {
    /**
     * Nombre corto del ajuste (ej: "Molokanov", "O'Connell").
     */
    String getName();

    /**
     * Forma explícita y referencia bibliográfica del ajuste.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
