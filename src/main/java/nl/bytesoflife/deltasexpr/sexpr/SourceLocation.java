package nl.bytesoflife.deltasexpr.sexpr;

import java.nio.file.Path;

/**
 * Where a node came from. Line and column are 1-based, {@code -1} when unknown;
 * {@code file} is {@code null} for text that was not read from a file.
 */
public record SourceLocation(Path file, int line, int column) {

    private static final SourceLocation UNKNOWN = new SourceLocation(null, -1, -1);

    public static SourceLocation unknown() {
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return (file != null ? file.toString() : "(unknown)") + ":" + line + ":" + column;
    }
}
