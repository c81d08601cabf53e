package Frontend.Syntax;

import Frontend.Lexer.Token;
import Frontend.Lexer.TokenKind;
import Frontend.Lexer.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Python 结构检查：括号配对 + 复合语句头缺少冒号
 */
public class PythonSyntaxChecker implements SyntaxChecker {
    private static final String PREFIX = "[Python Error]";

    static final Set<String> COMPOUND_KEYWORDS = Set.of(
        "if", "elif", "else", "for", "while",
        "def", "class", "with", "try", "except",
        "finally", "async"
    );

    private final BracketMatcher brackets = new BracketMatcher(PREFIX);

    @Override
    public List<Token> check(TokenStream tokens) throws SyntaxException {
        SyntaxChecker.requireSourceOrder(tokens);
        List<Token> errors = new ArrayList<>(brackets.check(tokens));
        for (List<Token> logicalLine : logicalLines(tokens)) {
            Token error = checkColon(logicalLine);
            if (error != null) {
                errors.add(error);
            }
        }
        return errors;
    }

    /**
     * 物理行变化且括号深度为 0 时开始新的逻辑行。INDENT / DEDENT 不参与分组，
     * 错误记录跟随当前逻辑行但不影响分行。
     */
    static List<List<Token>> logicalLines(TokenStream tokens) {
        List<List<Token>> result = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        int lastLine = -1;

        tokens.reset();
        while (tokens.hasMore()) {
            Token token = tokens.next();
            if (token.is(TokenKind.INDENT) || token.is(TokenKind.DEDENT)) {
                continue;
            }
            if (token.isError()) {
                current.add(token);
                continue;
            }
            if (lastLine != -1 && token.getLine() != lastLine && depth == 0 && !current.isEmpty()) {
                result.add(current);
                current = new ArrayList<>();
            }
            current.add(token);

            if (token.is(TokenKind.DELIMITER)) {
                String v = token.getValue();
                if (v.equals("(") || v.equals("[") || v.equals("{")) {
                    depth++;
                } else if (v.equals(")") || v.equals("]") || v.equals("}")) {
                    depth = Math.max(0, depth - 1);
                }
            }
            lastLine = token.getLine();
        }
        if (!current.isEmpty()) {
            result.add(current);
        }
        return result;
    }

    private static Token checkColon(List<Token> logicalLine) {
        Token first = null;
        Token last = null;
        for (Token token : logicalLine) {
            if (token.isError()) {
                continue;
            }
            if (first == null) {
                first = token;
            }
            last = token;
        }
        if (first == null) {
            return null;
        }
        if (!first.is(TokenKind.KEYWORD) || !COMPOUND_KEYWORDS.contains(first.getValue())) {
            return null;
        }
        if (last.is(TokenKind.DELIMITER, ":")) {
            return null;
        }
        String keyword = first.getValue();
        return Token.error(PREFIX + " Missing colon ':' after '" + keyword + "' statement header",
            keyword, first.getLine(), last.endColumn());
    }
}
