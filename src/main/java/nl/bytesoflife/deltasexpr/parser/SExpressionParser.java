package nl.bytesoflife.deltasexpr.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizes raw S-expression text into a tree of {@link SNode}s.
 * <p>
 * Quoted atoms support the escapes {@code \n}, {@code \t} and {@code \r};
 * any other escaped character stands for itself.
 */
public class SExpressionParser {

    private String input;
    private int pos;
    private int line;
    private int column;
    private boolean newlineSeen;

    public List<SNode> parse(String text) {
        // byte order mark left over from UTF-8 editors
        this.input = text.startsWith("\uFEFF") ? text.substring(1) : text;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.newlineSeen = false;
        List<SNode> nodes = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) break;
            if (input.charAt(pos) == ')') {
                throw error("Unexpected ')' without matching '('");
            }
            nodes.add(parseElement());
        }
        return nodes;
    }

    private SNode parseElement() {
        int startLine = line;
        int startColumn = column;
        boolean newlineBefore = newlineSeen;
        newlineSeen = false;
        char c = input.charAt(pos);
        if (c == '(') {
            return parseList(startLine, startColumn, newlineBefore);
        } else if (c == '"') {
            return parseQuotedString(startLine, startColumn, newlineBefore);
        } else {
            return parseAtom(startLine, startColumn, newlineBefore);
        }
    }

    private SNode.SList parseList(int startLine, int startColumn, boolean newlineBefore) {
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                throw new ParseException("Unexpected end of input, expected ')' to close list opened at line "
                        + startLine + ", column " + startColumn, pos, startLine, startColumn);
            }
            if (input.charAt(pos) == ')') {
                advance();
                newlineSeen = false;
                return new SNode.SList(children, startLine, startColumn, newlineBefore);
            }
            children.add(parseElement());
        }
    }

    private SNode.SAtom parseQuotedString(int startLine, int startColumn, boolean newlineBefore) {
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                advance();
                return new SNode.SAtom(sb.toString(), true, startLine, startColumn, newlineBefore);
            }
            if (c == '\\' && pos + 1 < input.length()) {
                advance();
                char escaped = input.charAt(pos);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
            advance();
        }
        throw new ParseException("Unterminated quoted string", pos, startLine, startColumn);
    }

    private SNode.SAtom parseAtom(int startLine, int startColumn, boolean newlineBefore) {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                break;
            }
            advance();
        }
        if (pos == start) {
            throw error("Expected atom");
        }
        return new SNode.SAtom(input.substring(start, pos), false, startLine, startColumn, newlineBefore);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            if (input.charAt(pos) == '\n') {
                newlineSeen = true;
            }
            advance();
        }
    }

    private void advance() {
        if (input.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw error("Expected '" + expected + "'");
        }
        advance();
    }

    private ParseException error(String message) {
        return new ParseException(message + " at line " + line + ", column " + column, pos, line, column);
    }

    public static class ParseException extends RuntimeException {
        private final int position;
        private final int line;
        private final int column;

        public ParseException(String message, int position, int line, int column) {
            super(message);
            this.position = position;
            this.line = line;
            this.column = column;
        }

        public int getPosition() {
            return position;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }
}
