package Frontend.Syntax;

import Frontend.Lexer.Token;
import Frontend.Lexer.TokenKind;
import Frontend.Lexer.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * C / C++ 结构检查：括号配对 + 缺少分号的启发式判断。
 * 没有语法分析，只看每个物理行的最后一个词法单元，会有误报和漏报。
 */
public class CFamilySyntaxChecker implements SyntaxChecker {

    // 以这些关键字结尾的行不需要分号；同时也是 ")" 结尾时判断块头的依据
    static final Set<String> BLOCK_HEADER_KEYWORDS = Set.of(
        "if", "else", "for", "while", "do", "switch",
        "class", "namespace", "struct", "union", "enum",
        "try", "catch", "finally",
        "public", "private", "protected",
        "default"
    );

    // 以这些关键字结尾的行必须有分号
    static final Set<String> TERMINATING_KEYWORDS = Set.of(
        "return", "break", "continue", "goto", "throw", "delete"
    );

    private static final Set<String> LINE_END_DELIMITERS = Set.of(";", "{", "}", ",", ":");

    private final String prefix;
    private final BracketMatcher brackets;

    public CFamilySyntaxChecker(String languageLabel) {
        this.prefix = "[" + languageLabel + " Error]";
        this.brackets = new BracketMatcher(prefix);
    }

    @Override
    public List<Token> check(TokenStream tokens) throws SyntaxException {
        SyntaxChecker.requireSourceOrder(tokens);
        List<Token> errors = new ArrayList<>(brackets.check(tokens));
        errors.addAll(checkSemicolons(tokens));
        return errors;
    }

    private List<Token> checkSemicolons(TokenStream tokens) {
        // 按物理行分组（忽略错误记录）
        Map<Integer, List<Token>> lines = new TreeMap<>();
        tokens.reset();
        while (tokens.hasMore()) {
            Token token = tokens.next();
            if (!token.isError()) {
                lines.computeIfAbsent(token.getLine(), k -> new ArrayList<>()).add(token);
            }
        }

        // 进入每一行时的花括号深度
        Map<Integer, Integer> depthOnEntry = new TreeMap<>();
        int depth = 0;
        for (Map.Entry<Integer, List<Token>> entry : lines.entrySet()) {
            depthOnEntry.put(entry.getKey(), depth);
            for (Token token : entry.getValue()) {
                if (token.is(TokenKind.DELIMITER, "{")) {
                    depth++;
                } else if (token.is(TokenKind.DELIMITER, "}")) {
                    depth = Math.max(0, depth - 1);
                }
            }
        }

        List<Token> errors = new ArrayList<>();
        for (Map.Entry<Integer, List<Token>> entry : lines.entrySet()) {
            List<Token> lineTokens = entry.getValue();
            if (lineTokens.get(0).is(TokenKind.PREPROCESSOR)) {
                continue;
            }
            // 文件作用域不检查
            if (depthOnEntry.get(entry.getKey()) <= 0) {
                continue;
            }
            Token last = lineTokens.get(lineTokens.size() - 1);
            if (needsSemicolon(lineTokens, last)) {
                errors.add(Token.error(prefix + " Missing semicolon ';' at end of statement",
                    last.getValue(), entry.getKey(), last.endColumn()));
            }
        }
        return errors;
    }

    static boolean needsSemicolon(List<Token> lineTokens, Token last) {
        TokenKind kind = last.getKind();
        String value = last.getValue();

        if (kind == TokenKind.DELIMITER && LINE_END_DELIMITERS.contains(value)) {
            return false;
        }
        if (kind == TokenKind.KEYWORD && BLOCK_HEADER_KEYWORDS.contains(value)) {
            return false;
        }
        if (kind == TokenKind.OPERATOR) {
            // 行尾的二元运算符表示表达式延续到下一行，只有 ++ / -- 算语句结束
            return value.equals("++") || value.equals("--");
        }

        if (kind == TokenKind.IDENTIFIER || kind.isLiteral()) {
            return true;
        }
        if (kind == TokenKind.DELIMITER && (value.equals(")") || value.equals("]"))) {
            // if (...) / while (...) 之类的块头
            return !BLOCK_HEADER_KEYWORDS.contains(firstKeyword(lineTokens));
        }
        return kind == TokenKind.KEYWORD && TERMINATING_KEYWORDS.contains(value);
    }

    private static String firstKeyword(List<Token> lineTokens) {
        for (Token token : lineTokens) {
            if (token.is(TokenKind.KEYWORD)) {
                return token.getValue();
            }
        }
        return "";
    }
}
