package Frontend.Lexer;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Python 3 扫描器。在公共游标之上维护缩进栈与括号嵌套深度，
 * 逻辑行开头产生 INDENT / DEDENT。
 */
public class PythonScanner extends CursorScanner {
    private static final String ERROR_PREFIX = "[Python Error] ";
    private static final int TAB_WIDTH = 4;

    static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True",
        "and", "as", "assert", "async", "await",
        "break", "class", "continue", "def", "del",
        "elif", "else", "except", "finally", "for",
        "from", "global", "if", "import", "in",
        "is", "lambda", "nonlocal", "not", "or",
        "pass", "raise", "return", "try", "while",
        "with", "yield"
    );

    // 长的在前
    static final List<String> OPERATORS = List.of(
        "**=", "//=", "<<=", ">>=",
        "->", ":=", "**", "//", "<<", ">>",
        "<=", ">=", "==", "!=", "+=", "-=",
        "*=", "/=", "%=", "&=", "|=", "^=",
        "@=",
        "+", "-", "*", "/", "%", "=", "<", ">",
        "&", "|", "^", "~", "!", ".", "@"
    );

    static final String DELIMITERS = "(){}[];,:#\\";

    // 小写形式，比较时忽略大小写
    private static final Set<String> STRING_PREFIXES = Set.of(
        "r", "b", "f", "u", "rb", "br", "fr", "rf"
    );

    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private boolean atLineStart = true;
    private int bracketDepth = 0;

    public PythonScanner(String source) {
        super(source);
        indentStack.push(0);
    }

    @Override
    protected void scanToken() {
        if (atLineStart && bracketDepth == 0) {
            handleIndentation();
            if (atEnd()) {
                return;
            }
        }

        char ch = currentChar();

        // 换行不产生词法单元，只重新开启缩进检查
        if (ch == '\r' || ch == '\n') {
            if (ch == '\r' && peek() == '\n') {
                advance();
            }
            advance();
            if (bracketDepth == 0) {
                atLineStart = true;
            }
            return;
        }

        if (ch == ' ' || ch == '\t') {
            skipBlankSpace();
            return;
        }

        // 显式续行
        if (ch == '\\' && (peek() == '\n' || peek() == '\r')) {
            advance();
            if (currentChar() == '\r') {
                advance();
            }
            if (currentChar() == '\n') {
                advance();
            }
            return;
        }

        int line = this.line;
        int col = this.column;

        if (ch == '#') {
            int start = pos;
            while (!atEnd() && currentChar() != '\n' && currentChar() != '\r') {
                advance();
            }
            addToken(TokenKind.COMMENT, source.substring(start, pos), line, col);
            return;
        }

        String prefix = stringPrefix();
        if (prefix != null) {
            readString(line, col, prefix);
            return;
        }

        if (isDigit(ch) || (ch == '.' && isDigit(peek()))) {
            readNumber(line, col);
            return;
        }

        if (isIdentifierStart(ch)) {
            readIdentifier(line, col);
            return;
        }

        if (CFamilyRules.readOperator(this, OPERATORS, line, col)) {
            return;
        }

        if (isOneOf(ch, DELIMITERS)) {
            readDelimiter(ch, line, col);
            return;
        }

        int codePoint = source.codePointAt(pos);
        String text = advanceCodePoint();
        addError(String.format("%sInvalid character '%s' (U+%04X) in source code", ERROR_PREFIX, text, codePoint),
            text, line, col);
    }

    @Override
    protected void finish() {
        while (indentStack.size() > 1) {
            indentStack.pop();
            addToken(TokenKind.DEDENT, "", line, column);
        }
    }

    // ---------------------------------------------------------------- 缩进

    /**
     * 逻辑行开头：量出缩进宽度（tab 记 4），与栈顶比较后产生 INDENT / DEDENT。
     * 空行、纯注释行和文件末尾不参与缩进计算。
     */
    private void handleIndentation() {
        int width = 0;
        while (currentChar() == ' ' || currentChar() == '\t') {
            width += currentChar() == ' ' ? 1 : TAB_WIDTH;
            advance();
        }

        char ch = currentChar();
        if (atEnd() || ch == '\n' || ch == '\r' || ch == '#') {
            return;
        }

        int top = indentStack.peek();
        if (width > top) {
            indentStack.push(width);
            addToken(TokenKind.INDENT, "", line, 1);
        } else if (width < top) {
            while (indentStack.peek() > width) {
                indentStack.pop();
                addToken(TokenKind.DEDENT, "", line, 1);
            }
            if (indentStack.peek() != width) {
                addError(ERROR_PREFIX + "Indentation error – unindent does not match any outer indentation level",
                    "", line, 1);
            }
        }
        atLineStart = false;
    }

    // ---------------------------------------------------------------- 分隔符

    private void readDelimiter(char ch, int line, int col) {
        if (ch == '(' || ch == '[' || ch == '{') {
            bracketDepth++;
        } else if (ch == ')' || ch == ']' || ch == '}') {
            if (bracketDepth > 0) {
                bracketDepth--;
            } else {
                addError(ERROR_PREFIX + "Unmatched closing bracket '" + ch + "'", String.valueOf(ch), line, col);
            }
        }
        advance();
        addToken(TokenKind.DELIMITER, String.valueOf(ch), line, col);
    }

    // ---------------------------------------------------------------- 字符串

    /**
     * 依次尝试 3、2、1 个字符的前缀（忽略大小写），前缀之后必须是引号；
     * 无前缀的引号返回空串，不是字符串返回 null
     */
    private String stringPrefix() {
        for (int length = 3; length >= 1; length--) {
            if (pos + length > source.length()) {
                continue;
            }
            String candidate = source.substring(pos, pos + length);
            char after = peek(length);
            if (STRING_PREFIXES.contains(candidate.toLowerCase(Locale.ROOT)) && (after == '"' || after == '\'')) {
                return candidate;
            }
        }
        char ch = currentChar();
        return ch == '"' || ch == '\'' ? "" : null;
    }

    private void readString(int line, int col, String prefix) {
        consume(prefix);
        char quote = currentChar();

        boolean triple = peek() == quote && peek(2) == quote;
        String closing = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
        StringBuilder value = new StringBuilder(prefix).append(consume(closing));

        String lowered = prefix.toLowerCase(Locale.ROOT);
        boolean raw = lowered.indexOf('r') >= 0;
        TokenKind kind = lowered.indexOf('f') >= 0 ? TokenKind.F_STRING : TokenKind.STRING;

        while (!atEnd()) {
            if (lookingAt(closing)) {
                value.append(consume(closing));
                addToken(kind, value.toString(), line, col);
                return;
            }

            char ch = currentChar();
            if (!triple && (ch == '\n' || ch == '\r')) {
                addError(ERROR_PREFIX + "Unterminated string literal (single-line string cannot span multiple lines)",
                    value.toString(), line, col);
                return;
            }

            if (ch == '\\') {
                advance();
                if (raw) {
                    // 原始字符串不解码，反斜杠与下一个字符原样保留（\" 不结束字符串）
                    value.append('\\');
                    if (!atEnd()) {
                        value.append(advance());
                    }
                } else {
                    value.append(readEscape());
                }
                continue;
            }

            value.append(advance());
        }

        addError(ERROR_PREFIX + "Unterminated " + (triple ? "triple-quoted " : "")
            + "string literal – reached end of file", value.toString(), line, col);
    }

    // ---------------------------------------------------------------- 数字

    private void readNumber(int line, int col) {
        if (currentChar() == '0' && isOneOf(peek(), "xXbBoO")) {
            readPrefixedInteger(line, col);
            return;
        }

        StringBuilder value = new StringBuilder();
        boolean isFloat = false;
        boolean isComplex = false;

        appendWhile(value, "0123456789_");

        if (currentChar() == '.' && peek() != '.') {
            isFloat = true;
            value.append(advance());
            appendWhile(value, "0123456789_");
        }

        if (currentChar() == 'e' || currentChar() == 'E') {
            isFloat = true;
            value.append(advance());
            if (currentChar() == '+' || currentChar() == '-') {
                value.append(advance());
            }
            if (!isDigit(currentChar())) {
                addError(ERROR_PREFIX + "Malformed float literal – expected digits after exponent 'e'",
                    value.toString(), line, col);
                return;
            }
            appendWhile(value, "0123456789_");
        }

        if (currentChar() == 'j' || currentChar() == 'J') {
            value.append(advance());
            isComplex = true;
        }

        String text = value.toString();
        if (!isFloat && !isComplex && text.length() > 1 && text.charAt(0) == '0' && isDigit(text.charAt(1))) {
            addError(ERROR_PREFIX + "Invalid integer literal '" + text + "' – leading zeros are not allowed in Python 3 "
                + "(use 0o for octal, 0x for hex, 0b for binary)", text, line, col);
            return;
        }

        if (!isComplex && overflows(text.replace("_", ""), isFloat)) {
            addError(ERROR_PREFIX + "Numeric overflow – constant value too large for internal representation",
                text, line, col);
            return;
        }

        addToken(isFloat || isComplex ? TokenKind.FLOAT : TokenKind.INTEGER, text, line, col);
    }

    /**
     * 整数任意精度，不会溢出；浮点数解析为无穷大即视为溢出
     */
    private static boolean overflows(String digits, boolean isFloat) {
        try {
            if (isFloat) {
                return Double.isInfinite(Double.parseDouble(digits));
            }
            new BigInteger(digits);
            return false;
        } catch (NumberFormatException e) {
            return true;
        }
    }

    /**
     * 0x / 0b / 0o 开头的整数，允许下划线分隔
     */
    private void readPrefixedInteger(int line, int col) {
        StringBuilder value = new StringBuilder();
        value.append(advance()).append(advance());
        char radix = Character.toLowerCase(value.charAt(1));

        String digits;
        String message;
        switch (radix) {
            case 'x':
                digits = "0123456789abcdefABCDEF_";
                message = "Invalid hexadecimal literal – no digits after '0x'";
                break;
            case 'b':
                digits = "01_";
                message = "Invalid binary literal – no digits after '0b'";
                break;
            default:
                digits = "01234567_";
                message = "Invalid octal literal – no digits after '0o'";
                break;
        }

        if (!isOneOf(currentChar(), digits)) {
            addError(ERROR_PREFIX + message, value.toString(), line, col);
            return;
        }
        appendWhile(value, digits);
        addToken(TokenKind.INTEGER, value.toString(), line, col);
    }

    private void appendWhile(StringBuilder value, String chars) {
        while (isOneOf(currentChar(), chars)) {
            value.append(advance());
        }
    }

    // ---------------------------------------------------------------- 标识符

    private void readIdentifier(int line, int col) {
        String word = readIdentifierText();
        TokenKind kind;
        if (word.equals("True") || word.equals("False")) {
            kind = TokenKind.BOOLEAN;
        } else if (word.equals("None")) {
            kind = TokenKind.NONE;
        } else if (KEYWORDS.contains(word)) {
            kind = TokenKind.KEYWORD;
        } else {
            kind = TokenKind.IDENTIFIER;
        }
        addToken(kind, word, line, col);
    }
}
