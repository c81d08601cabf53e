package Frontend.Lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次扫描的结果：词法单元序列（错误记录按出现位置内联其中）以及单独的错误列表
 */
public final class ScanResult {
    private final List<Token> tokens;
    private final List<Token> errors;

    public ScanResult(List<Token> tokens, List<Token> errors) {
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public List<Token> getErrors() {
        return errors;
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }

    public TokenStream stream() {
        TokenStream stream = new TokenStream();
        stream.addAll(tokens);
        return stream;
    }
}
