package columndesigner.domain.exception;

/**
 * Raíz de la taxonomía de errores del diseño de columnas.
 * <p>
 * Todas las etapas del cálculo fallan rápido lanzando una subclase de esta excepción;
 * no existen resultados parciales ni degradados. Es responsabilidad del llamador
 * presentar el error al usuario.
 */
public abstract class ColumnDesignException extends RuntimeException {

    protected ColumnDesignException(String message) {
        super(message);
    }
}
