package columndesigner.domain.exception;

/**
 * Alguna precondición física del dimensionamiento (densidades, temperaturas, fracciones) no se cumple.
 */
public class InvalidSizingInputException extends ColumnDesignException {

    public InvalidSizingInputException(String message) {
        super(message);
    }
}
