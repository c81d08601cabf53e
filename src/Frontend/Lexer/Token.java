package Frontend.Lexer;

import java.util.Objects;

/**
 * 词法单元。ERROR 类型额外携带一条诊断信息，其余类型 message 为 null。
 */
public final class Token {
    private final TokenKind kind;
    private final String value;    // 原始词素
    private final int line;        // 从1开始
    private final int column;      // 从1开始，指向词素首字符
    private final String message;

    public Token(TokenKind kind, String value, int line, int column) {
        this(kind, value, line, column, null);
    }

    private Token(TokenKind kind, String value, int line, int column, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = value == null ? "" : value;
        this.line = line;
        this.column = column;
        this.message = message;
    }

    public static Token error(String message, String value, int line, int column) {
        return new Token(TokenKind.ERROR, value, line, column, Objects.requireNonNull(message, "message"));
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getMessage() {
        return message;
    }

    public boolean is(TokenKind kind) {
        return this.kind == kind;
    }

    public boolean is(TokenKind kind, String value) {
        return this.kind == kind && this.value.equals(value);
    }

    public boolean isError() {
        return kind == TokenKind.ERROR;
    }

    /**
     * 紧跟在词素末尾的列号，用于“缺少分号/冒号”一类的定位
     */
    public int endColumn() {
        return column + value.length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return kind == other.kind
            && line == other.line
            && column == other.column
            && value.equals(other.value)
            && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, line, column, message);
    }

    @Override
    public String toString() {
        return String.format("Token(%s, '%s', line=%d, col=%d%s)",
            kind, value, line, column,
            message != null ? ", message=" + message : "");
    }
}
