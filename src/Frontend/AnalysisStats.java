package Frontend;

import Frontend.Lexer.Token;
import Frontend.Lexer.TokenKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 词法单元统计：总数、按类型计数（按首次出现顺序）、错误数
 */
public final class AnalysisStats {
    private final int total;
    private final Map<TokenKind, Integer> byKind;
    private final int errorCount;

    private AnalysisStats(int total, Map<TokenKind, Integer> byKind, int errorCount) {
        this.total = total;
        this.byKind = Collections.unmodifiableMap(byKind);
        this.errorCount = errorCount;
    }

    public static AnalysisStats of(List<Token> tokens, List<Token> errors) {
        Map<TokenKind, Integer> byKind = new LinkedHashMap<>();
        for (Token token : tokens) {
            byKind.merge(token.getKind(), 1, Integer::sum);
        }
        return new AnalysisStats(tokens.size(), byKind, errors.size());
    }

    public int getTotal() {
        return total;
    }

    public Map<TokenKind, Integer> getByKind() {
        return byKind;
    }

    public int count(TokenKind kind) {
        return byKind.getOrDefault(kind, 0);
    }

    public int getErrorCount() {
        return errorCount;
    }
}
