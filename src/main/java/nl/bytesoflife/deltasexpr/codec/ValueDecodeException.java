package nl.bytesoflife.deltasexpr.codec;

import nl.bytesoflife.deltasexpr.error.ErrorKind;
import nl.bytesoflife.deltasexpr.error.SExpressionException;

/**
 * Thrown by a {@link ValueCodec} when text does not represent a value of its
 * type. Carries no location; the node being decoded adds that.
 */
public class ValueDecodeException extends SExpressionException {

    public ValueDecodeException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public ValueDecodeException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public ValueDecodeException(ErrorKind kind) {
        super(kind, kind.getDescription());
    }
}
