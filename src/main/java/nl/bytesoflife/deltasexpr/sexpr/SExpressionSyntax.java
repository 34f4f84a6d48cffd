package nl.bytesoflife.deltasexpr.sexpr;

import java.util.regex.Pattern;

/**
 * Lexical rules of the format: which list names and tokens are valid, and
 * how string leaves are escaped.
 */
public final class SExpressionSyntax {

    private static final Pattern LIST_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9._:-]*");

    private SExpressionSyntax() {
    }

    public static boolean isValidListName(String name) {
        return name != null && LIST_NAME.matcher(name).matches();
    }

    /**
     * A token must be non-empty and contain no whitespace, parentheses or
     * double quotes, otherwise it would read back as something else.
     */
    public static boolean isValidToken(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Escapes a string leaf for output without the surrounding quotes.
     * CR LF and lone CR become LF, which is then written as {@code \n}.
     */
    public static String escapeString(String string) {
        String normalized = string.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder sb = new StringBuilder(normalized.length() + 8);
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
