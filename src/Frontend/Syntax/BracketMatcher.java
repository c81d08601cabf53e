package Frontend.Syntax;

import Frontend.Lexer.Token;
import Frontend.Lexer.TokenKind;
import Frontend.Lexer.TokenStream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 括号配对检查，各语言共用，只是错误前缀不同。
 * 遇到不匹配的闭括号时仍然弹栈，每处不匹配只报一次。
 */
final class BracketMatcher {
    private static final String OPENERS = "([{";
    private static final String CLOSERS = ")]}";

    private final String prefix;

    BracketMatcher(String prefix) {
        this.prefix = prefix;
    }

    List<Token> check(TokenStream tokens) {
        List<Token> errors = new ArrayList<>();
        Deque<Token> stack = new ArrayDeque<>();

        tokens.reset();
        while (tokens.hasMore()) {
            Token token = tokens.next();
            if (!token.is(TokenKind.DELIMITER) || token.getValue().length() != 1) {
                continue;
            }
            char ch = token.getValue().charAt(0);
            if (OPENERS.indexOf(ch) >= 0) {
                stack.push(token);
            } else if (CLOSERS.indexOf(ch) >= 0) {
                String expected = String.valueOf(OPENERS.charAt(CLOSERS.indexOf(ch)));
                if (stack.isEmpty()) {
                    errors.add(Token.error(
                        prefix + " Unexpected '" + ch + "' – no matching '" + expected + "'",
                        token.getValue(), token.getLine(), token.getColumn()));
                    continue;
                }
                Token open = stack.pop();
                if (!open.getValue().equals(expected)) {
                    errors.add(Token.error(String.format(
                        "%s Mismatched bracket: '%c' at line %d does not close '%s' opened at line %d",
                        prefix, ch, token.getLine(), open.getValue(), open.getLine()),
                        token.getValue(), token.getLine(), token.getColumn()));
                }
            }
        }

        // 栈底是最早打开的括号，按源码顺序报告
        Iterator<Token> it = stack.descendingIterator();
        while (it.hasNext()) {
            Token open = it.next();
            errors.add(Token.error(
                prefix + " Unclosed '" + open.getValue() + "' – missing matching closing bracket",
                open.getValue(), open.getLine(), open.getColumn()));
        }
        return errors;
    }
}
