package nl.bytesoflife.deltasexpr.error;

import java.nio.file.Path;

/**
 * A failure tied to a position in a document: syntax errors, malformed
 * structure found while reading, and values that could not be decoded.
 * <p>
 * The message is meant to be shown to the user as is. Line and column are
 * 1-based, or {@code -1} when unknown.
 */
public class FileParseException extends SExpressionException {

    private final Path file;
    private final int line;
    private final int column;
    private final String invalidContent;
    private final String reason;

    public FileParseException(ErrorKind kind, Path file, int line, int column,
                              String invalidContent, String reason) {
        this(kind, file, line, column, invalidContent, reason, null);
    }

    public FileParseException(ErrorKind kind, Path file, int line, int column,
                              String invalidContent, String reason, Throwable cause) {
        super(kind, formatMessage(file, line, column, invalidContent, reason), cause);
        this.file = file;
        this.line = line;
        this.column = column;
        this.invalidContent = invalidContent;
        this.reason = reason;
    }

    /** The document the failure refers to, or {@code null} for trees built in memory. */
    public Path getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getInvalidContent() {
        return invalidContent;
    }

    public String getReason() {
        return reason;
    }

    private static String formatMessage(Path file, int line, int column, String invalidContent, String reason) {
        StringBuilder sb = new StringBuilder("File parse error: ").append(reason);
        sb.append("\n\nFile: ").append(file != null ? file.toString() : "(unknown)");
        sb.append("\nLine,Column: ").append(line).append(',').append(column);
        sb.append("\nInvalid Content: \"").append(invalidContent != null ? invalidContent : "").append('"');
        return sb.toString();
    }
}
