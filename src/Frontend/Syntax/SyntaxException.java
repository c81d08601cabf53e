package Frontend.Syntax;

/**
 * 语法检查无法进行时抛出（例如输入的词法单元流不满足源码顺序）
 */
public class SyntaxException extends Exception {
    public SyntaxException(String message) {
        super(message);
    }

    public SyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
