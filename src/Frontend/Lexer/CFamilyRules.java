package Frontend.Lexer;

import java.util.List;

/**
 * C 与 C++ 共用的扫描规则。规则按固定顺序排列，第一条命中的规则生效。
 */
final class CFamilyRules {

    private CFamilyRules() {
    }

    /**
     * 共享分派表：预处理 → 行注释 → 块注释 → 字符串 → 字符 → 数字 → 标识符 → 运算符 → 分隔符
     */
    static List<ScanRule<CursorScanner>> rules(CDialect dialect) {
        return List.of(
            (s, line, col) -> s.currentChar() == '#' && readPreprocessor(s, line, col),
            (s, line, col) -> s.lookingAt("//") && readLineComment(s, line, col),
            (s, line, col) -> s.lookingAt("/*") && readBlockComment(s, dialect, line, col),
            (s, line, col) -> readString(s, dialect, line, col),
            (s, line, col) -> readChar(s, dialect, line, col),
            (s, line, col) -> startsNumber(s) && readNumber(s, dialect, line, col),
            (s, line, col) -> CursorScanner.isIdentifierStart(s.currentChar()) && readIdentifier(s, dialect, line, col),
            (s, line, col) -> readOperator(s, dialect.operators(), line, col),
            (s, line, col) -> readDelimiter(s, line, col)
        );
    }

    /**
     * 依次尝试规则；都不匹配时报告未知字符
     */
    static <S extends CursorScanner> void dispatch(S s, List<ScanRule<S>> rules, CDialect dialect) {
        char ch = s.currentChar();
        if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\n') {
            s.skipBlankSpaceAndNewlines();
            return;
        }

        int line = s.line;
        int col = s.column;
        for (ScanRule<S> rule : rules) {
            if (rule.apply(s, line, col)) {
                return;
            }
        }

        int codePoint = s.source.codePointAt(s.pos);
        String text = s.advanceCodePoint();
        s.addError(dialect.error("Unknown character '" + text + "' (ASCII " + codePoint + ")"), text, line, col);
    }

    // ---------------------------------------------------------------- 预处理与注释

    /**
     * 一条预处理指令占一个词法单元，支持反斜杠续行（\n、\r\n、\r）
     */
    static boolean readPreprocessor(CursorScanner s, int line, int col) {
        StringBuilder text = new StringBuilder();
        while (!s.atEnd() && !s.atLineBreak()) {
            if (s.currentChar() == '\\' && s.peek() == '\r' && s.peek(2) == '\n') {
                s.consume("\\\r\n");
                continue;
            }
            if (s.currentChar() == '\\' && (s.peek() == '\n' || s.peek() == '\r')) {
                s.advance();
                s.advance();
                continue;
            }
            text.append(s.advance());
        }
        s.addToken(TokenKind.PREPROCESSOR, text.toString().strip(), line, col);
        return true;
    }

    static boolean readLineComment(CursorScanner s, int line, int col) {
        int start = s.pos;
        while (!s.atEnd() && !s.atLineBreak()) {
            s.advance();
        }
        s.addToken(TokenKind.COMMENT, s.source.substring(start, s.pos), line, col);
        return true;
    }

    static boolean readBlockComment(CursorScanner s, CDialect dialect, int line, int col) {
        int start = s.pos;
        s.consume("/*");
        while (!s.atEnd()) {
            if (s.lookingAt("*/")) {
                s.consume("*/");
                s.addToken(TokenKind.COMMENT, s.source.substring(start, s.pos), line, col);
                return true;
            }
            s.advance();
        }
        s.addError(dialect.error("Unterminated block comment – missing closing '*/'"), "/*", line, col);
        return true;
    }

    // ---------------------------------------------------------------- 字符串与字符

    /**
     * 编码前缀 L / u / U / u8 后紧跟 quote 时返回前缀，否则返回 null
     */
    static String encodingPrefix(CursorScanner s, char quote) {
        if (s.currentChar() == quote) {
            return "";
        }
        if (s.lookingAt("u8") && s.peek(2) == quote) {
            return "u8";
        }
        char ch = s.currentChar();
        if ((ch == 'L' || ch == 'u' || ch == 'U') && s.peek() == quote) {
            return String.valueOf(ch);
        }
        return null;
    }

    static boolean readString(CursorScanner s, CDialect dialect, int line, int col) {
        String prefix = encodingPrefix(s, '"');
        if (prefix == null) {
            return false;
        }
        StringBuilder value = new StringBuilder(s.consume(prefix));
        value.append(s.advance());          // 开头的 "

        while (!s.atEnd()) {
            char ch = s.currentChar();
            if (ch == '\n' || ch == '\r') {
                s.addError(dialect.error("Unterminated string literal – newline inside string"),
                    value.toString(), line, col);
                return true;
            }
            if (ch == '\\') {
                s.advance();
                value.append(s.readEscape());
                continue;
            }
            value.append(s.advance());
            if (ch == '"') {
                s.addToken(TokenKind.STRING, value.toString(), line, col);
                return true;
            }
        }
        s.addError(dialect.error("Unterminated string literal – reached end of file"),
            value.toString(), line, col);
        return true;
    }

    /**
     * 字符字面量必须恰好包含一个逻辑字符（转义序列算一个）
     */
    static boolean readChar(CursorScanner s, CDialect dialect, int line, int col) {
        String prefix = encodingPrefix(s, '\'');
        if (prefix == null) {
            return false;
        }
        StringBuilder value = new StringBuilder(s.consume(prefix));
        value.append(s.advance());          // 开头的 '
        int charCount = 0;

        while (!s.atEnd()) {
            char ch = s.currentChar();
            if (ch == '\n' || ch == '\r') {
                s.addError(dialect.error("Unterminated character literal – newline inside char"),
                    value.toString(), line, col);
                return true;
            }
            if (ch == '\\') {
                s.advance();
                value.append(s.readEscape());
                charCount++;
                continue;
            }
            value.append(s.advance());
            if (ch == '\'') {
                if (charCount == 0) {
                    s.addError(dialect.error("Empty character literal ''"), value.toString(), line, col);
                } else if (charCount > 1) {
                    s.addError(dialect.error("Multi-character character literal '" + value
                        + "' (implementation-defined behavior)"), value.toString(), line, col);
                } else {
                    s.addToken(TokenKind.CHAR, value.toString(), line, col);
                }
                return true;
            }
            charCount++;
        }
        s.addError(dialect.error("Unterminated character literal – reached end of file"),
            value.toString(), line, col);
        return true;
    }

    // ---------------------------------------------------------------- 数字

    static boolean startsNumber(CursorScanner s) {
        char ch = s.currentChar();
        return CursorScanner.isDigit(ch) || (ch == '.' && CursorScanner.isDigit(s.peek()));
    }

    /**
     * 十六进制（含十六进制浮点）、二进制、以及十进制/八进制/浮点统一路径。
     * C++ 方言额外吸收紧随其后的用户定义字面量后缀。
     */
    static boolean readNumber(CursorScanner s, CDialect dialect, int line, int col) {
        StringBuilder value = new StringBuilder();
        boolean isFloat = false;

        if (s.currentChar() == '0' && (s.peek() == 'x' || s.peek() == 'X')) {
            value.append(s.advance()).append(s.advance());
            if (!CursorScanner.isHexDigit(s.currentChar())) {
                s.addError(dialect.error("Invalid hex literal – no digits after '0x'"), value.toString(), line, col);
                return true;
            }
            appendWhile(s, value, "0123456789abcdefABCDEF_");
            if (s.currentChar() == '.') {
                isFloat = true;
                value.append(s.advance());
                if (s.currentChar() == '.') {
                    value.append(s.advance());
                    s.addError(dialect.error("Malformed numeric literal – multiple decimal points"),
                        value.toString(), line, col);
                    return true;
                }
                appendWhile(s, value, "0123456789abcdefABCDEF_");
            }
            if (s.currentChar() == 'p' || s.currentChar() == 'P') {
                isFloat = true;
                value.append(s.advance());
                if (s.currentChar() == '+' || s.currentChar() == '-') {
                    value.append(s.advance());
                }
                appendWhile(s, value, "0123456789");
            }
            appendWhile(s, value, "uUlLfF");
            emitNumber(s, dialect, isFloat ? TokenKind.FLOAT : TokenKind.INTEGER, value, line, col);
            return true;
        }

        if (s.currentChar() == '0' && (s.peek() == 'b' || s.peek() == 'B')) {
            value.append(s.advance()).append(s.advance());
            if (s.currentChar() != '0' && s.currentChar() != '1') {
                s.addError(dialect.error("Invalid binary literal – no digits after '0b'"), value.toString(), line, col);
                return true;
            }
            appendWhile(s, value, "01_");
            appendWhile(s, value, "uUlL");
            emitNumber(s, dialect, TokenKind.INTEGER, value, line, col);
            return true;
        }

        appendWhile(s, value, "0123456789_");

        if (s.currentChar() == '.' && s.peek() != '.') {
            isFloat = true;
            value.append(s.advance());
            appendWhile(s, value, "0123456789");
            // 1.2.3 之类：第二个小数点连同其后的数字一起报错
            if (s.currentChar() == '.' && CursorScanner.isDigit(s.peek())) {
                value.append(s.advance());
                appendWhile(s, value, "0123456789");
                s.addError(dialect.error("Malformed numeric literal – multiple decimal points"),
                    value.toString(), line, col);
                return true;
            }
        }

        if (s.currentChar() == 'e' || s.currentChar() == 'E') {
            isFloat = true;
            value.append(s.advance());
            if (s.currentChar() == '+' || s.currentChar() == '-') {
                value.append(s.advance());
            }
            if (!CursorScanner.isDigit(s.currentChar())) {
                s.addError(dialect.error("Malformed float literal – expected digits after exponent"),
                    value.toString(), line, col);
                return true;
            }
            appendWhile(s, value, "0123456789");
        }

        while (CursorScanner.isOneOf(s.currentChar(), "uUlLfF")) {
            char suffix = s.advance();
            if (suffix == 'f' || suffix == 'F') {
                isFloat = true;
            }
            value.append(suffix);
        }

        String text = value.toString();
        if (!isFloat && text.length() > 1 && text.startsWith("0")
                && (text.indexOf('8') >= 0 || text.indexOf('9') >= 0)) {
            s.addError(dialect.error("Invalid octal literal '" + text + "' – digits 8 or 9 are not valid in octal"),
                text, line, col);
            return true;
        }

        emitNumber(s, dialect, isFloat ? TokenKind.FLOAT : TokenKind.INTEGER, value, line, col);
        return true;
    }

    private static void emitNumber(CursorScanner s, CDialect dialect, TokenKind kind,
                                   StringBuilder value, int line, int col) {
        if (dialect.allowsUserDefinedLiterals() && CursorScanner.isIdentifierStart(s.currentChar())) {
            // 10_km、1.5ms：后缀原样拼接，不改变类型
            value.append(s.readIdentifierText());
        }
        s.addToken(kind, value.toString(), line, col);
    }

    private static void appendWhile(CursorScanner s, StringBuilder value, String chars) {
        while (CursorScanner.isOneOf(s.currentChar(), chars)) {
            value.append(s.advance());
        }
    }

    // ---------------------------------------------------------------- 标识符、运算符、分隔符

    static boolean readIdentifier(CursorScanner s, CDialect dialect, int line, int col) {
        String word = s.readIdentifierText();
        s.addToken(dialect.classify(word), word, line, col);
        return true;
    }

    /**
     * 按表顺序（长的在前）取第一个匹配的运算符
     */
    static boolean readOperator(CursorScanner s, List<String> operators, int line, int col) {
        for (String op : operators) {
            if (s.lookingAt(op)) {
                s.addToken(TokenKind.OPERATOR, s.consume(op), line, col);
                return true;
            }
        }
        return false;
    }

    static boolean readDelimiter(CursorScanner s, int line, int col) {
        char ch = s.currentChar();
        if (!CursorScanner.isOneOf(ch, CDialect.DELIMITERS)) {
            return false;
        }
        s.advance();
        s.addToken(TokenKind.DELIMITER, String.valueOf(ch), line, col);
        return true;
    }
}
