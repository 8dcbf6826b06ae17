package columndesigner.domain.exception;

/**
 * Las recuperaciones objetivo o la alineación de vectores producen una especificación de separación imposible.
 */
public class SpecificationException extends ColumnDesignException {

    public SpecificationException(String message) {
        super(message);
    }
}
