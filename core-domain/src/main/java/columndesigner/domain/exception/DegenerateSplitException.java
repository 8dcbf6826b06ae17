package columndesigner.domain.exception;

/**
 * Una fracción molar de los componentes clave es &lt;= 0 al evaluar la ecuación de Fenske.
 */
public class DegenerateSplitException extends ColumnDesignException {

    public DegenerateSplitException(String message) {
        super(message);
    }
}
