package Frontend.Syntax;

import Frontend.Lexer.Language;
import Frontend.Lexer.Token;
import Frontend.Lexer.TokenKind;
import Frontend.Lexer.TokenStream;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CFamilySyntaxCheckerTest {

    private static List<Token> checkC(String source) throws SyntaxException {
        return new CFamilySyntaxChecker("C").check(Language.C.tokenize(source).stream());
    }

    @Test
    void testBalancedProgramHasNoErrors() throws SyntaxException {
        assertTrue(checkC("int main() { int a[2] = {1, 2}; if (a[0]) { a[1]++; } return 0; }").isEmpty());
    }

    @Test
    void testMissingSemicolon() throws SyntaxException {
        List<Token> errors = checkC("int main() {\n    int x = 5\n    return x;\n}\n");

        assertEquals(1, errors.size());
        Token error = errors.get(0);
        assertEquals("[C Error] Missing semicolon ';' at end of statement", error.getMessage());
        assertEquals("5", error.getValue());
        assertEquals(2, error.getLine());
        assertEquals(14, error.getColumn());
    }

    @Test
    void testBlockHeadersNeedNoSemicolon() throws SyntaxException {
        String source = "void f(int n) {\n"
            + "    if (n > 0)\n"
            + "        g(n);\n"
            + "    for (;;)\n"
            + "        break;\n"
            + "    do\n"
            + "        n++;\n"
            + "    while (n < 10);\n"
            + "}\n";

        assertTrue(checkC(source).isEmpty());
    }

    @Test
    void testTrailingOperatorContinuesStatement() throws SyntaxException {
        assertTrue(checkC("int f() {\n    int y = 1 +\n        2;\n}\n").isEmpty());
    }

    @Test
    void testStatementEndingsFlagged() throws SyntaxException {
        List<Token> errors = checkC("void f() {\n    g()\n    i++\n    return\n}\n");

        assertEquals(3, errors.size());
        assertEquals(2, errors.get(0).getLine());
        assertEquals(3, errors.get(1).getLine());
        assertEquals(4, errors.get(2).getLine());
    }

    @Test
    void testFileScopeNotChecked() throws SyntaxException {
        assertTrue(checkC("int x = 5\nint y = 6\n").isEmpty());
    }

    @Test
    void testPreprocessorLinesSkipped() throws SyntaxException {
        assertTrue(checkC("void f() {\n#ifdef X\n    g();\n#endif\n}\n").isEmpty());
    }

    @Test
    void testMismatchedBracket() throws SyntaxException {
        List<Token> errors = checkC("int f() { (a]; }");

        assertEquals(1, errors.size());
        assertEquals("[C Error] Mismatched bracket: ']' at line 1 does not close '(' opened at line 1",
            errors.get(0).getMessage());
    }

    @Test
    void testUnexpectedClosingBrace() throws SyntaxException {
        List<Token> errors = checkC("}");

        assertEquals(1, errors.size());
        assertEquals("[C Error] Unexpected '}' – no matching '{'", errors.get(0).getMessage());
    }

    @Test
    void testUnclosedBracketsInSourceOrder() throws SyntaxException {
        List<Token> errors = checkC("void f() {\n    g(1;\n");

        assertEquals(2, errors.size());
        assertEquals("[C Error] Unclosed '{' – missing matching closing bracket", errors.get(0).getMessage());
        assertEquals(1, errors.get(0).getLine());
        assertEquals(10, errors.get(0).getColumn());
        assertEquals("[C Error] Unclosed '(' – missing matching closing bracket", errors.get(1).getMessage());
        assertEquals(2, errors.get(1).getLine());
        assertEquals(6, errors.get(1).getColumn());
    }

    @Test
    void testCppLabelAndAccessSpecifiers() throws SyntaxException {
        SyntaxChecker checker = SyntaxChecker.forLanguage(Language.CPP);
        List<Token> errors = checker.check(Language.CPP.tokenize("class A {\npublic:\n    int x\n};\n").stream());

        assertEquals(1, errors.size());
        assertEquals("[C++ Error] Missing semicolon ';' at end of statement", errors.get(0).getMessage());
        assertEquals(3, errors.get(0).getLine());
    }

    @Test
    void testOutOfOrderStreamRejected() {
        TokenStream stream = new TokenStream();
        stream.addAll(List.of(
            new Token(TokenKind.IDENTIFIER, "b", 2, 1),
            new Token(TokenKind.IDENTIFIER, "a", 1, 1)));

        assertThrows(SyntaxException.class, () -> new CFamilySyntaxChecker("C").check(stream));
    }

    @Test
    void testInvalidPositionRejected() {
        TokenStream stream = new TokenStream();
        stream.addAll(List.of(new Token(TokenKind.IDENTIFIER, "a", 0, 1)));

        assertThrows(SyntaxException.class, () -> SyntaxChecker.requireSourceOrder(stream));
    }

    @Test
    void testNoCheckerForUnknown() {
        assertThrows(IllegalArgumentException.class, () -> SyntaxChecker.forLanguage(Language.UNKNOWN));
    }
}
