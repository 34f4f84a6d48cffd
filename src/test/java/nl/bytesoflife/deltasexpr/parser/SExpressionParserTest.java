package nl.bytesoflife.deltasexpr.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseSimpleList() {
        List<SNode> nodes = parser.parse("(version 1)");
        assertEquals(1, nodes.size());
        assertInstanceOf(SNode.SList.class, nodes.get(0));
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals(2, list.children().size());
        assertEquals("version", ((SNode.SAtom) list.children().get(0)).value());
        assertEquals("1", ((SNode.SAtom) list.children().get(1)).value());
        assertFalse(((SNode.SAtom) list.children().get(1)).quoted());
    }

    @Test
    void parseNestedLists() {
        List<SNode> nodes = parser.parse("(pad 1 (size 0.8 0.8))");
        assertEquals(1, nodes.size());
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals(3, list.children().size());
        assertInstanceOf(SNode.SList.class, list.children().get(2));
    }

    @Test
    void parseQuotedString() {
        List<SNode> nodes = parser.parse("(description \"Resistor (0603)\")");
        SNode.SList list = (SNode.SList) nodes.get(0);
        SNode.SAtom atom = (SNode.SAtom) list.children().get(1);
        assertEquals("Resistor (0603)", atom.value());
        assertTrue(atom.quoted());
    }

    @Test
    void parseEscapeSequences() {
        List<SNode> nodes = parser.parse("(s \"a\\\"b\\\\c\\nd\\te\\x\")");
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals("a\"b\\c\nd\tex", ((SNode.SAtom) list.children().get(1)).value());
    }

    @Test
    void emptyQuotedStringIsAnAtom() {
        SNode.SList list = (SNode.SList) parser.parse("(name \"\")").get(0);
        SNode.SAtom atom = (SNode.SAtom) list.children().get(1);
        assertEquals("", atom.value());
        assertTrue(atom.quoted());
    }

    @Test
    void parseMultipleTopLevelExpressions() {
        List<SNode> nodes = parser.parse("(version 1)(rule \"test\"(constraint clearance (min 0.1mm)))");
        assertEquals(2, nodes.size());
    }

    @Test
    void parseEmptyInput() {
        assertTrue(parser.parse("").isEmpty());
    }

    @Test
    void parseWhitespaceOnlyInput() {
        assertTrue(parser.parse("   \n\n \t ").isEmpty());
    }

    @Test
    void hashIsPartOfAnAtom() {
        SNode.SList list = (SNode.SList) parser.parse("(color #ff0000)").get(0);
        assertEquals("#ff0000", ((SNode.SAtom) list.children().get(1)).value());
    }

    @Test
    void tracksLinesAndColumns() {
        SNode.SList root = (SNode.SList) parser.parse("(a\n  (b \"x\"))").get(0);
        assertEquals(1, root.line());
        assertEquals(1, root.column());

        SNode.SList b = (SNode.SList) root.children().get(1);
        assertEquals(2, b.line());
        assertEquals(3, b.column());

        SNode.SAtom x = (SNode.SAtom) b.children().get(1);
        assertEquals(2, x.line());
        assertEquals(6, x.column());
    }

    @Test
    void recordsNewlineBeforeElements() {
        SNode.SList root = (SNode.SList) parser.parse("(a 1\n  2 3\n\n  (b)\n)").get(0);
        assertFalse(root.children().get(1).newlineBefore());
        assertTrue(root.children().get(2).newlineBefore());
        assertFalse(root.children().get(3).newlineBefore());
        assertTrue(root.children().get(4).newlineBefore());
    }

    @Test
    void skipsByteOrderMark() {
        List<SNode> nodes = parser.parse("\uFEFF(a)");
        assertEquals(1, nodes.size());
    }

    @Test
    void unterminatedListReportsWhereItStarted() {
        SExpressionParser.ParseException e =
                assertThrows(SExpressionParser.ParseException.class, () -> parser.parse("(a\n (b)"));
        assertEquals(1, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void unterminatedString() {
        SExpressionParser.ParseException e =
                assertThrows(SExpressionParser.ParseException.class, () -> parser.parse("(a \"open"));
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
    }

    @Test
    void strayClosingParenthesis() {
        SExpressionParser.ParseException e =
                assertThrows(SExpressionParser.ParseException.class, () -> parser.parse("(a))"));
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
        assertEquals(3, e.getPosition());
    }

    @Test
    void toStringQuotesStrings() {
        SNode node = parser.parse("(a b \"c d\")").get(0);
        assertEquals("(a b \"c d\")", node.toString());
    }
}
