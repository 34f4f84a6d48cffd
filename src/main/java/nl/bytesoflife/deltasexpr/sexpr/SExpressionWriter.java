package nl.bytesoflife.deltasexpr.sexpr;

/**
 * Renders {@link SExpression} trees to their canonical text.
 * <p>
 * Children of a list follow each other separated by one space. A line break
 * child starts a new line, indented one level deeper than the list; several
 * line breaks in a row still give a single new line. A list that is
 * multi-line (see {@link SExpression#isMultiLineList()}) closes on its own
 * line at its own indentation:
 * <pre>
 * (symbol "Resistor"
 *   (pin 1 (name "A"))
 *   (pin 2 (name "B"))
 * )
 * </pre>
 * The output depends on nothing but the tree and the indent width, and never
 * contains trailing whitespace.
 */
public class SExpressionWriter {

    public static final int DEFAULT_INDENT_WIDTH = 2;

    private int indentWidth = DEFAULT_INDENT_WIDTH;

    public SExpressionWriter setIndentWidth(int indentWidth) {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("Indent width must not be negative: " + indentWidth);
        }
        this.indentWidth = indentWidth;
        return this;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    /**
     * @param indent nesting level of {@code node}, used for the lines it breaks onto
     */
    public String write(SExpression node, int indent) {
        StringBuilder sb = new StringBuilder();
        writeNode(node, indent, sb);
        return sb.toString();
    }

    /**
     * Renders a whole file: the root at level 0 followed by a newline.
     */
    public String writeDocument(SExpression root) {
        return write(root, 0) + '\n';
    }

    private void writeNode(SExpression node, int indent, StringBuilder sb) {
        switch (node.getType()) {
            case LIST -> writeList(node, indent, sb);
            case TOKEN -> sb.append(node.getText());
            case STRING -> sb.append('"').append(SExpressionSyntax.escapeString(node.getText())).append('"');
            case LINE_BREAK -> {
                // only affects the layout of the parent list
            }
        }
    }

    private void writeList(SExpression list, int indent, StringBuilder sb) {
        sb.append('(').append(list.getName());
        boolean pendingLineBreak = false;
        for (SExpression child : list.getChildren()) {
            if (child.isLineBreak()) {
                pendingLineBreak = true;
                continue;
            }
            if (pendingLineBreak) {
                sb.append('\n');
                appendIndent(indent + 1, sb);
                pendingLineBreak = false;
            } else {
                sb.append(' ');
            }
            writeNode(child, indent + 1, sb);
        }
        if (list.isMultiLineList()) {
            sb.append('\n');
            appendIndent(indent, sb);
        }
        sb.append(')');
    }

    private void appendIndent(int level, StringBuilder sb) {
        sb.append(" ".repeat(level * indentWidth));
    }
}
