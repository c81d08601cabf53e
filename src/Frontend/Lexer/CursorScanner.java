package Frontend.Lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * 所有语言扫描器的公共基类：源码游标、转义序列解码、词法单元与错误的累积。
 *
 * <p>一个实例只服务于一次 {@link #tokenize()} 调用，游标和缓冲区都归该调用独占，
 * 因此不同请求之间无需加锁，各自新建实例即可并行。
 */
public abstract class CursorScanner {
    /** 越过输入末尾时 {@link #currentChar()} / {@link #peek(int)} 的返回值 */
    protected static final char EOF = '\0';

    // 反斜杠之后可以出现的字符（C / C++ / Python 通用）
    private static final String VALID_ESCAPES = "nrtabfv0\\'\"?xuUN1234567";

    protected final String source;
    protected int pos = 0;
    protected int line = 1;
    protected int column = 1;

    private final List<Token> tokens = new ArrayList<>();
    private final List<Token> errors = new ArrayList<>();
    private boolean used = false;

    protected CursorScanner(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * 扫描整个输入。错误不会中断扫描，总是走到输入末尾。
     */
    public final ScanResult tokenize() {
        if (used) {
            throw new IllegalStateException("scanner instances are single-use, create a new one per input");
        }
        used = true;

        while (!atEnd()) {
            scanToken();
        }
        finish();

        List<Token> output = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.getKind() != TokenKind.COMMENT) {
                output.add(token);
            }
        }
        return new ScanResult(output, errors);
    }

    /**
     * 从当前位置识别一个词法单元（或跳过空白/注释）。每次调用至少消耗一个字符。
     */
    protected abstract void scanToken();

    /**
     * 输入结束后的收尾处理，例如补齐 DEDENT
     */
    protected void finish() {
    }

    // ---------------------------------------------------------------- 游标

    protected boolean atEnd() {
        return pos >= source.length();
    }

    protected char currentChar() {
        return pos < source.length() ? source.charAt(pos) : EOF;
    }

    protected char peek() {
        return peek(1);
    }

    protected char peek(int offset) {
        int index = pos + offset;
        return index >= 0 && index < source.length() ? source.charAt(index) : EOF;
    }

    /**
     * 消耗当前字符并维护行列号
     */
    protected char advance() {
        char ch = currentChar();
        pos++;
        // \n、单独的 \r 都算换行；\r\n 中的 \r 只前进一列，由后面的 \n 换行
        if (ch == '\n' || (ch == '\r' && currentChar() != '\n')) {
            line++;
            column = 1;
        } else {
            column++;
        }
        return ch;
    }

    /**
     * 当前字符是否结束一个物理行（\n，或不跟 \n 的 \r）。\r\n 在 \n 处结束
     */
    protected boolean atLineBreak() {
        char ch = currentChar();
        return ch == '\n' || (ch == '\r' && peek() != '\n');
    }

    protected boolean match(char expected) {
        if (!atEnd() && currentChar() == expected) {
            advance();
            return true;
        }
        return false;
    }

    protected boolean lookingAt(String text) {
        return source.startsWith(text, pos);
    }

    /**
     * 连续消耗 text.length() 个字符并原样返回
     */
    protected String consume(String text) {
        for (int i = 0; i < text.length(); i++) {
            advance();
        }
        return text;
    }

    protected void skipBlankSpace() {
        while (currentChar() == ' ' || currentChar() == '\t') {
            advance();
        }
    }

    protected void skipBlankSpaceAndNewlines() {
        while (currentChar() == ' ' || currentChar() == '\t' || currentChar() == '\r' || currentChar() == '\n') {
            advance();
        }
    }

    /**
     * 消耗当前完整码点（可能是代理对），用于报告无法识别的字符
     */
    protected String advanceCodePoint() {
        int cp = source.codePointAt(pos);
        int count = Character.charCount(cp);
        String text = source.substring(pos, Math.min(pos + count, source.length()));
        for (int i = 0; i < text.length(); i++) {
            advance();
        }
        return text;
    }

    /**
     * 读取最长的字母/数字/下划线序列
     */
    protected String readIdentifierText() {
        int start = pos;
        while (!atEnd() && isIdentifierPart(currentChar())) {
            advance();
        }
        return source.substring(start, pos);
    }

    // ---------------------------------------------------------------- 输出

    protected void addToken(TokenKind kind, String value, int line, int column) {
        tokens.add(new Token(kind, value, line, column));
    }

    /**
     * 错误同时进入词法单元序列和错误列表
     */
    protected void addError(String message, String value, int line, int column) {
        Token error = Token.error(message, value, line, column);
        errors.add(error);
        tokens.add(error);
    }

    // ---------------------------------------------------------------- 转义

    /**
     * 解码一个转义序列。调用时反斜杠已被消耗，游标停在转义字符上。
     * 返回源码中对应的原文（通常为两个字符），以便词素保持原样。
     */
    protected String readEscape() {
        int escLine = line;
        int escColumn = column - 1;
        if (atEnd()) {
            addError("Illegal escape sequence – unterminated escape at end of file",
                "\\", escLine, escColumn);
            return "\\";
        }
        char ch = advance();
        String sequence = "\\" + ch;
        if (VALID_ESCAPES.indexOf(ch) < 0) {
            addError("Illegal escape sequence '" + sequence + "' – unrecognized escape character",
                sequence, escLine, escColumn);
        }
        return sequence;
    }

    // ---------------------------------------------------------------- 字符分类

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    protected static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    protected static boolean isIdentifierStart(char c) {
        return c != EOF && (Character.isLetter(c) || c == '_');
    }

    protected static boolean isIdentifierPart(char c) {
        return c != EOF && (Character.isLetterOrDigit(c) || c == '_');
    }

    protected static boolean isOneOf(char c, String chars) {
        return c != EOF && chars.indexOf(c) >= 0;
    }
}
