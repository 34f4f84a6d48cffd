package nl.bytesoflife.deltasexpr.error;

/**
 * Base class of all failures raised while building, navigating, reading or
 * decoding S-expression trees.
 */
public class SExpressionException extends RuntimeException {

    private final ErrorKind kind;

    public SExpressionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SExpressionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
