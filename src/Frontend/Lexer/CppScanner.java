package Frontend.Lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * C++ 扫描器。先查 C++ 专有规则（原始字符串），再落到与 C 共用的规则表；
 * 关键字、运算符表以及用户定义字面量由 {@link CDialect#CPP} 提供。
 */
public class CppScanner extends CursorScanner {
    private static final int MAX_RAW_DELIMITER = 16;

    // 带前缀的原始字符串，长前缀在前
    private static final List<String> RAW_PREFIXES = List.of("u8R", "LR", "uR", "UR", "R");

    private static final List<ScanRule<CursorScanner>> RULES = buildRules();

    public CppScanner(String source) {
        super(source);
    }

    @Override
    protected void scanToken() {
        CFamilyRules.dispatch(this, RULES, CDialect.CPP);
    }

    private static List<ScanRule<CursorScanner>> buildRules() {
        List<ScanRule<CursorScanner>> rules = new ArrayList<>();
        rules.add(CppScanner::readRawString);
        rules.addAll(CFamilyRules.rules(CDialect.CPP));
        return Collections.unmodifiableList(rules);
    }

    /**
     * R"delim( ... )delim"，delim 最长 16 个字符
     */
    static boolean readRawString(CursorScanner s, int line, int col) {
        String prefix = null;
        for (String candidate : RAW_PREFIXES) {
            if (s.lookingAt(candidate) && s.peek(candidate.length()) == '"') {
                prefix = candidate;
                break;
            }
        }
        if (prefix == null) {
            return false;
        }

        StringBuilder content = new StringBuilder(s.consume(prefix));
        content.append(s.advance());            // "

        StringBuilder delimiter = new StringBuilder();
        while (!s.atEnd() && s.currentChar() != '('
                && s.currentChar() != '\n' && s.currentChar() != '\r') {
            if (delimiter.length() >= MAX_RAW_DELIMITER) {
                s.addError(CDialect.CPP.error("Raw string delimiter too long (max 16 characters)"),
                    content.toString() + delimiter, line, col);
                return true;
            }
            delimiter.append(s.advance());
        }

        if (s.currentChar() != '(') {
            s.addError(CDialect.CPP.error("Malformed raw string literal – expected '(' after delimiter"),
                content.toString() + delimiter, line, col);
            return true;
        }
        content.append(delimiter).append(s.advance());

        String closing = ")" + delimiter + "\"";
        while (!s.atEnd()) {
            if (s.lookingAt(closing)) {
                content.append(s.consume(closing));
                s.addToken(TokenKind.STRING, content.toString(), line, col);
                return true;
            }
            content.append(s.advance());
        }

        s.addError(CDialect.CPP.error("Unterminated raw string literal – expected '" + closing + "'"),
            content.toString(), line, col);
        return true;
    }
}
