package Frontend.Syntax;

import Frontend.Lexer.Language;
import Frontend.Lexer.Token;
import Frontend.Lexer.TokenStream;

import java.util.List;

/**
 * 词法分析之后的结构检查。只读取已完成的词法单元流，不重新扫描源码，只产生 ERROR 记录。
 */
public interface SyntaxChecker {

    List<Token> check(TokenStream tokens) throws SyntaxException;

    static SyntaxChecker forLanguage(Language language) {
        switch (language) {
            case C:
                return new CFamilySyntaxChecker("C");
            case CPP:
                return new CFamilySyntaxChecker("C++");
            case PYTHON:
                return new PythonSyntaxChecker();
            default:
                throw new IllegalArgumentException("no syntax checker for language " + language.getId());
        }
    }

    /**
     * 非 ERROR 词法单元的位置必须有效且按源码顺序排列
     */
    static void requireSourceOrder(TokenStream tokens) throws SyntaxException {
        int lastLine = 1;
        int lastColumn = 1;
        tokens.reset();
        while (tokens.hasMore()) {
            Token token = tokens.next();
            if (token.getLine() < 1 || token.getColumn() < 1) {
                throw new SyntaxException(String.format("token %s has an invalid position", token));
            }
            if (token.isError()) {
                continue;
            }
            if (token.getLine() < lastLine || (token.getLine() == lastLine && token.getColumn() < lastColumn)) {
                throw new SyntaxException(String.format(
                    "token stream out of source order at line %d, column %d", token.getLine(), token.getColumn()));
            }
            lastLine = token.getLine();
            lastColumn = token.getColumn();
        }
        tokens.reset();
    }
}
