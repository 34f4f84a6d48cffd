package nl.bytesoflife.deltasexpr.sexpr;

public enum SExpressionType {
    /** Has a name and any number of children, e.g. {@code (pin 1 "GND")}. */
    LIST,
    /** Value without quotes, e.g. {@code -12.34}. */
    TOKEN,
    /** Value with double quotes, e.g. {@code "Foo!"}. */
    STRING,
    /** Manual line break inside a list. */
    LINE_BREAK
}
