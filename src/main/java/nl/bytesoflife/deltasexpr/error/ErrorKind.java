package nl.bytesoflife.deltasexpr.error;

/**
 * Distinguishes every failure the S-expression layer can report.
 */
public enum ErrorKind {
    // malformed raw text
    SYNTAX_ERROR("Syntax error"),

    // structural construction violations
    MISSING_LIST_NAME("List has no name"),
    INVALID_IDENTIFIER("Invalid list name"),
    INVALID_TOKEN("Invalid token"),

    // navigation misuse
    NOT_A_LIST("Node is not a list"),
    NOT_A_TOKEN_OR_STRING("Node is not a token or string"),
    INDEX_OUT_OF_RANGE("Child index out of range"),
    NO_CHILDREN("Node does not have children"),
    CHILD_NOT_FOUND("Child not found"),

    // value coercion
    EMPTY_VALUE("Node value is empty"),
    INVALID_BOOLEAN("Not a valid boolean"),
    INVALID_INTEGER("Not a valid integer"),
    INVALID_COLOR("Not a valid color"),
    INVALID_URL("Not a valid URL"),
    INVALID_DATE_TIME("Not a valid datetime"),
    DECODE_FAILURE("Value could not be decoded");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
