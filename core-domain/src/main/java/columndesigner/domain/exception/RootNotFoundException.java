package columndesigner.domain.exception;

/**
 * El intervalo de Underwood (α[HK], α[LK]) no contiene un cambio de signo o la bisección no converge.
 */
public class RootNotFoundException extends ColumnDesignException {

    public RootNotFoundException(String message) {
        super(message);
    }
}
