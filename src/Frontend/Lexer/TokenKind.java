package Frontend.Lexer;

/**
 * 词法单元类型（C / C++ / Python 共用的封闭集合）
 */
public enum TokenKind {
    // 关键字与标识符
    KEYWORD,
    IDENTIFIER,

    // 字面量
    INTEGER,
    FLOAT,
    STRING,
    CHAR,
    F_STRING,    // Python f-string，插值部分不再拆分
    BOOLEAN,     // Python True/False，C++ true/false
    NONE,        // Python None

    // 运算符与分隔符
    OPERATOR,
    DELIMITER,

    // 预处理指令（仅 C / C++）
    PREPROCESSOR,

    // 缩进（仅 Python）
    INDENT,
    DEDENT,

    // 仅内部使用，输出前剔除
    COMMENT,

    // 错误记录
    ERROR;

    public boolean isLiteral() {
        switch (this) {
            case INTEGER:
            case FLOAT:
            case STRING:
            case CHAR:
            case F_STRING:
            case BOOLEAN:
            case NONE:
                return true;
            default:
                return false;
        }
    }
}
