package Frontend.Lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * 词法单元流，按源码顺序遍历扫描结果
 */
public class TokenStream {
    private final List<Token> tokens = new ArrayList<>();
    private int currentPosition = 0;

    public void addAll(List<Token> tokens) {
        this.tokens.addAll(tokens);
    }

    // 获取当前位置的词法单元，并前进
    public Token next() {
        if (currentPosition >= tokens.size()) {
            return null;
        }
        return tokens.get(currentPosition++);
    }

    public boolean hasMore() {
        return currentPosition < tokens.size();
    }

    public void reset() {
        currentPosition = 0;
    }

    /**
     * 每行一个词法单元，格式: 序号: 类型 词素 @行:列
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int index = 1;
        for (Token token : tokens) {
            sb.append(String.format("%d: %s %s @%d:%d", index++,
                token.getKind(), token.getValue(), token.getLine(), token.getColumn()));
            if (token.isError()) {
                sb.append("  ").append(token.getMessage());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
