package nl.bytesoflife.deltasexpr.parser;

import java.util.List;

/**
 * Generic token tree produced by {@link SExpressionParser}.
 * Knows nothing about list names, tokens or value types; it only records
 * what the source text looked like and where each element started.
 */
public sealed interface SNode permits SNode.SAtom, SNode.SList {

    /** 1-based line of the first character of this element. */
    int line();

    /** 1-based column of the first character of this element. */
    int column();

    /** Whether at least one newline separates this element from the previous one. */
    boolean newlineBefore();

    record SAtom(String value, boolean quoted, int line, int column, boolean newlineBefore) implements SNode {
        @Override
        public String toString() {
            if (!quoted) {
                return value;
            }
            return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
    }

    record SList(List<SNode> children, int line, int column, boolean newlineBefore) implements SNode {
        public SList {
            children = List.copyOf(children);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
