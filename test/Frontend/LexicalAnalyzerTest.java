package Frontend;

import Frontend.Lexer.Language;
import Frontend.Lexer.ScanResult;
import Frontend.Lexer.Token;
import Frontend.Lexer.TokenKind;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class LexicalAnalyzerTest {

    private static final String C_SAMPLE = "int main(void) {\n"
        + "    char *s = \"a\\tb\";\n"
        + "    return s[0] == 'a' ? 1 : 0;\n"
        + "}\n";

    private static final String PYTHON_SAMPLE = "def f(x):\n"
        + "    return [i ** 2 for i in range(x)]  # squares\n"
        + "print(f(3))\n";

    private static final String CPP_SAMPLE = "template<typename T>\n"
        + "T maxOf(T a, T b) { return std::max(a, b); }\n";

    @ParameterizedTest
    @ValueSource(strings = {"", "  \n\t"})
    void testBlankSourceRejected(String source) {
        AnalysisException e = assertThrows(AnalysisException.class, () -> LexicalAnalyzer.analyze(source, "c"));
        assertEquals("No source code provided", e.getMessage());
    }

    @Test
    void testUndetectableLanguage() {
        AnalysisException e = assertThrows(AnalysisException.class,
            () -> LexicalAnalyzer.analyze("hello world", null));

        assertEquals("Could not auto-detect the programming language. Please select C, C++, or Python explicitly.",
            e.getMessage());
        assertNotNull(e.getDetection());
        assertTrue(e.getDetection().isUnknown());
    }

    @Test
    void testHelloWorldInC() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze("int main() { printf(\"hi\"); return 0; }", "c");

        assertEquals(Language.C, result.getLanguage());
        assertEquals(AnalysisResult.USER_SPECIFIED, result.getConfidence());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void testHintAliases() throws AnalysisException {
        assertEquals(Language.PYTHON, LexicalAnalyzer.analyze(PYTHON_SAMPLE, "py").getLanguage());
        assertEquals(Language.CPP, LexicalAnalyzer.analyze(CPP_SAMPLE, "C++").getLanguage());
    }

    @Test
    void testAutoDetection() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze(CPP_SAMPLE, null);

        assertEquals(Language.CPP, result.getLanguage());
        assertEquals("high", result.getConfidence());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void testUnsupportedHintFallsBackToDetection() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze(PYTHON_SAMPLE, "java");

        assertEquals(Language.PYTHON, result.getLanguage());
        assertNotEquals(AnalysisResult.USER_SPECIFIED, result.getConfidence());
    }

    @Test
    void testAnalyzeAsSkipsDetection() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyzeAs("hello world", Language.C);

        assertEquals(Language.C, result.getLanguage());
        assertEquals(AnalysisResult.USER_SPECIFIED, result.getConfidence());
        assertThrows(AnalysisException.class, () -> LexicalAnalyzer.analyzeAs(" ", Language.PYTHON));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\n", "\r\n", "\r"})
    void testStructuralErrorsForEveryLineEnding(String eol) throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze("if x" + eol + "    y(" + eol, "python");

        assertEquals(2, result.getErrors().size());
        Token colon = result.getErrors().get(0);
        assertEquals("[Python Error] Missing colon ':' after 'if' statement header", colon.getMessage());
        assertEquals(1, colon.getLine());
        assertEquals(5, colon.getColumn());
        Token unclosed = result.getErrors().get(1);
        assertEquals("[Python Error] Unclosed '(' – missing matching closing bracket", unclosed.getMessage());
        assertEquals(2, unclosed.getLine());
        assertEquals(6, unclosed.getColumn());
        assertEquals(new Token(TokenKind.INDENT, "", 2, 1), result.getTokens().get(2));
    }

    @Test
    void testMissingColonReportedOnce() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze("if x > 0\n    print(x)\n", "python");

        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).getMessage().contains("Missing colon"));
    }

    @Test
    void testMissingSemicolonReportedOnce() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze("int main() {\n    int x = 5\n    return x;\n}\n", "c");

        assertEquals(1, result.getErrors().size());
        assertEquals("[C Error] Missing semicolon ';' at end of statement", result.getErrors().get(0).getMessage());
    }

    @Test
    void testUnterminatedStringAtEndOfFile() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze("\"abc", "c");

        assertEquals(1, result.getErrors().size());
        assertEquals("[C Error] Unterminated string literal – reached end of file",
            result.getErrors().get(0).getMessage());
        assertTrue(result.getTokens().stream().noneMatch(t -> t.is(TokenKind.STRING)));
    }

    @Test
    void testCheckerErrorAtLexicalErrorPositionDropped() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze("x)\n", "python");

        assertEquals(1, result.getErrors().size());
        assertEquals("[Python Error] Unmatched closing bracket ')'", result.getErrors().get(0).getMessage());
    }

    @Test
    void testErrorsSortedByPosition() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze(
            "int main() {\n    int x = 5\n    char c = '';\n}\n", "c");

        assertEquals(2, result.getErrors().size());
        assertEquals(2, result.getErrors().get(0).getLine());
        assertEquals(3, result.getErrors().get(1).getLine());
        assertEquals(14, result.getErrors().get(1).getColumn());
    }

    @Test
    void testStats() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze("int a;", "c");
        AnalysisStats stats = result.getStats();

        assertEquals(3, stats.getTotal());
        assertEquals(1, stats.count(TokenKind.KEYWORD));
        assertEquals(1, stats.count(TokenKind.IDENTIFIER));
        assertEquals(1, stats.count(TokenKind.DELIMITER));
        assertEquals(0, stats.count(TokenKind.STRING));
        assertEquals(0, stats.getErrorCount());
        assertEquals(List.of(TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.DELIMITER),
            new ArrayList<>(stats.getByKind().keySet()));
    }

    @Test
    void testIndentsBalanceDedents() throws AnalysisException {
        AnalysisResult result = LexicalAnalyzer.analyze(PYTHON_SAMPLE, "python");

        long indents = result.getTokens().stream().filter(t -> t.is(TokenKind.INDENT)).count();
        long dedents = result.getTokens().stream().filter(t -> t.is(TokenKind.DEDENT)).count();
        assertEquals(indents, dedents);
        assertEquals(1, indents);
    }

    @Test
    void testLexemesMatchSourceText() throws AnalysisException {
        for (String[] sample : new String[][]{{C_SAMPLE, "c"}, {PYTHON_SAMPLE, "python"}, {CPP_SAMPLE, "cpp"}}) {
            String source = sample[0];
            List<Integer> lineStarts = new ArrayList<>();
            lineStarts.add(0);
            for (int i = 0; i < source.length(); i++) {
                if (source.charAt(i) == '\n') {
                    lineStarts.add(i + 1);
                }
            }

            for (Token token : LexicalAnalyzer.analyze(source, sample[1]).getTokens()) {
                assertTrue(token.getLine() >= 1 && token.getColumn() >= 1, token::toString);
                if (token.is(TokenKind.INDENT) || token.is(TokenKind.DEDENT)) {
                    continue;
                }
                int offset = lineStarts.get(token.getLine() - 1) + token.getColumn() - 1;
                assertEquals(token.getValue(), source.substring(offset, offset + token.getValue().length()),
                    token::toString);
            }
        }
    }

    @Test
    void testCheckerFailureYieldsNoStructuralErrors() {
        ScanResult outOfOrder = new ScanResult(List.of(
            new Token(TokenKind.IDENTIFIER, "b", 2, 1),
            new Token(TokenKind.DELIMITER, "(", 1, 1)), List.of());

        assertTrue(LexicalAnalyzer.structuralErrors(Language.C, outOfOrder, List.of()).isEmpty());
    }

    @Test
    void testConcurrentCallsAreIndependent() throws Exception {
        String[] sources = {C_SAMPLE, PYTHON_SAMPLE, CPP_SAMPLE};
        String[] hints = {"c", "python", "cpp"};
        List<List<Token>> expected = new ArrayList<>();
        for (int i = 0; i < sources.length; i++) {
            expected.add(LexicalAnalyzer.analyze(sources[i], hints[i]).getTokens());
        }

        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<List<Token>>> futures = new ArrayList<>();
            for (int round = 0; round < 30; round++) {
                int index = round % sources.length;
                futures.add(pool.submit(() -> LexicalAnalyzer.analyze(sources[index], hints[index]).getTokens()));
            }
            for (int round = 0; round < futures.size(); round++) {
                assertEquals(expected.get(round % sources.length), futures.get(round).get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
