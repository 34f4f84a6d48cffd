package nl.bytesoflife.deltasexpr.sexpr;

import nl.bytesoflife.deltasexpr.error.ErrorKind;
import nl.bytesoflife.deltasexpr.error.FileParseException;
import nl.bytesoflife.deltasexpr.parser.SExpressionParser;
import nl.bytesoflife.deltasexpr.parser.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds an {@link SExpression} tree from text.
 * <p>
 * Quoted atoms become strings and bare atoms tokens. The first element of
 * every list is its name. Elements that start on a new line in the source
 * get a line break node in front of them, so reading and writing a file
 * keeps its line structure. All nodes carry their position in the source.
 */
public class SExpressionReader {

    private static final Logger log = LoggerFactory.getLogger(SExpressionReader.class);

    private static final int MAX_CONTENT_EXCERPT = 60;

    /**
     * @param file the file the content was read from, used in error messages; may be {@code null}
     * @throws FileParseException if the content is not exactly one well-formed root list
     */
    public SExpression read(String content, Path file) {
        List<SNode> nodes;
        try {
            nodes = new SExpressionParser().parse(content);
        } catch (SExpressionParser.ParseException e) {
            log.debug("Syntax error in {} at {},{}: {}", displayName(file), e.getLine(), e.getColumn(), e.getMessage());
            throw new FileParseException(ErrorKind.SYNTAX_ERROR, file, e.getLine(), e.getColumn(),
                    lineAt(content, e.getLine()), e.getMessage(), e);
        }

        if (nodes.isEmpty()) {
            throw new FileParseException(ErrorKind.SYNTAX_ERROR, file, -1, -1, "",
                    "File does not contain a root node.");
        }
        if (nodes.size() > 1) {
            SNode extra = nodes.get(1);
            throw new FileParseException(ErrorKind.SYNTAX_ERROR, file, extra.line(), extra.column(),
                    excerpt(extra), "File does not have exactly one root node.");
        }
        if (!(nodes.get(0) instanceof SNode.SList rootList)) {
            SNode root = nodes.get(0);
            throw new FileParseException(ErrorKind.SYNTAX_ERROR, file, root.line(), root.column(),
                    excerpt(root), "Root node is not a list.");
        }

        SExpression root = convertList(rootList, file);
        log.debug("Read '{}' with {} children from {}", root.getName(), root.getChildren().size(), displayName(file));
        return root;
    }

    private SExpression convertList(SNode.SList list, Path file) {
        List<SNode> elements = list.children();
        if (elements.isEmpty() || !(elements.get(0) instanceof SNode.SAtom nameAtom) || nameAtom.quoted()) {
            throw new FileParseException(ErrorKind.MISSING_LIST_NAME, file, list.line(), list.column(),
                    excerpt(list), "List does not start with a name.");
        }
        if (!SExpressionSyntax.isValidListName(nameAtom.value())) {
            throw new FileParseException(ErrorKind.INVALID_IDENTIFIER, file, nameAtom.line(), nameAtom.column(),
                    nameAtom.value(), "Invalid list name.");
        }

        SExpression result = new SExpression(SExpressionType.LIST, nameAtom.value(),
                new SourceLocation(file, list.line(), list.column()));
        for (SNode element : elements.subList(1, elements.size())) {
            SourceLocation location = new SourceLocation(file, element.line(), element.column());
            if (element.newlineBefore()) {
                result.addParsedChild(new SExpression(SExpressionType.LINE_BREAK, "", location));
            }
            result.addParsedChild(convert(element, file, location));
        }
        return result;
    }

    private SExpression convert(SNode element, Path file, SourceLocation location) {
        if (element instanceof SNode.SList list) {
            return convertList(list, file);
        }
        SNode.SAtom atom = (SNode.SAtom) element;
        if (atom.quoted()) {
            return new SExpression(SExpressionType.STRING, atom.value(), location);
        }
        if (!SExpressionSyntax.isValidToken(atom.value())) {
            throw new FileParseException(ErrorKind.INVALID_TOKEN, file, atom.line(), atom.column(),
                    atom.value(), "Invalid token.");
        }
        return new SExpression(SExpressionType.TOKEN, atom.value(), location);
    }

    private static String excerpt(SNode node) {
        String text = node.toString();
        return text.length() > MAX_CONTENT_EXCERPT ? text.substring(0, MAX_CONTENT_EXCERPT) + "..." : text;
    }

    private static String lineAt(String content, int line) {
        if (line < 1) {
            return "";
        }
        String[] lines = content.split("\n", -1);
        return line <= lines.length ? lines[line - 1].strip() : "";
    }

    private static String displayName(Path file) {
        return file != null ? file.toString() : "(memory)";
    }
}
