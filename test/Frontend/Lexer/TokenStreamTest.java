package Frontend.Lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenStreamTest {

    private static TokenStream streamOf(String source) {
        return new CScanner(source).tokenize().stream();
    }

    @Test
    void testNextWalksInOrder() {
        TokenStream stream = streamOf("int x;");

        assertTrue(stream.hasMore());
        assertEquals(new Token(TokenKind.KEYWORD, "int", 1, 1), stream.next());
        assertEquals(new Token(TokenKind.IDENTIFIER, "x", 1, 5), stream.next());
        assertEquals(new Token(TokenKind.DELIMITER, ";", 1, 6), stream.next());
        assertFalse(stream.hasMore());
        assertNull(stream.next());
    }

    @Test
    void testResetRestartsIteration() {
        TokenStream stream = streamOf("a b");
        while (stream.hasMore()) {
            stream.next();
        }

        stream.reset();
        assertEquals("a", stream.next().getValue());
    }

    @Test
    void testAddAllAppends() {
        TokenStream stream = new TokenStream();
        stream.addAll(List.of(new Token(TokenKind.IDENTIFIER, "a", 1, 1)));
        stream.addAll(List.of(new Token(TokenKind.IDENTIFIER, "b", 1, 3)));

        assertEquals("a", stream.next().getValue());
        assertEquals("b", stream.next().getValue());
    }

    @Test
    void testDumpFormat() {
        TokenStream stream = streamOf("a $");

        assertEquals("1: IDENTIFIER a @1:1\n"
            + "2: ERROR $ @1:3  [C Error] Unknown character '$' (ASCII 36)\n", stream.toString());
    }
}
