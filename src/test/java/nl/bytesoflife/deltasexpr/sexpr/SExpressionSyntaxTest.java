package nl.bytesoflife.deltasexpr.sexpr;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionSyntaxTest {

    @ParameterizedTest
    @ValueSource(strings = {"a", "_", "librepcb_symbol", "valid_name-1.2", "ns:tag", "A1"})
    void validListNames(String name) {
        assertTrue(SExpressionSyntax.isValidListName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1bad", "-x", ".x", "a b", "a(b", "ä", "a\"b"})
    void invalidListNames(String name) {
        assertFalse(SExpressionSyntax.isValidListName(name));
    }

    @Test
    void nullIsNeitherANameNorAToken() {
        assertFalse(SExpressionSyntax.isValidListName(null));
        assertFalse(SExpressionSyntax.isValidToken(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "-12.34", "#ff0000ff", "2017-10-17T12:34:56Z", "a'b", "none", "ä"})
    void validTokens(String token) {
        assertTrue(SExpressionSyntax.isValidToken(token));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "a b", "a\nb", "(", ")", "\"quoted\"", "a\"b"})
    void invalidTokens(String token) {
        assertFalse(SExpressionSyntax.isValidToken(token));
    }

    @Test
    void escapeQuotesAndBackslashes() {
        assertEquals("a\\\"b\\\\c", SExpressionSyntax.escapeString("a\"b\\c"));
    }

    @Test
    void escapeNormalizesLineEndings() {
        assertEquals("a\\nb\\nc\\nd", SExpressionSyntax.escapeString("a\r\nb\rc\nd"));
    }

    @Test
    void escapeTabs() {
        assertEquals("a\\tb", SExpressionSyntax.escapeString("a\tb"));
    }

    @Test
    void plainTextIsUnchanged() {
        assertEquals("Résistance (0603) 'x'", SExpressionSyntax.escapeString("Résistance (0603) 'x'"));
    }
}
