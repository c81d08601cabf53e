package Frontend;

import Frontend.Lexer.Language;
import Frontend.Lexer.Token;

import java.util.Collections;
import java.util.List;

public final class AnalysisResult {
    public static final String USER_SPECIFIED = "user-specified";

    private final Language language;
    private final String confidence;
    private final List<Token> tokens;
    private final List<Token> errors;
    private final AnalysisStats stats;

    public AnalysisResult(Language language, String confidence, List<Token> tokens, List<Token> errors) {
        this.language = language;
        this.confidence = confidence;
        this.tokens = Collections.unmodifiableList(tokens);
        this.errors = Collections.unmodifiableList(errors);
        this.stats = AnalysisStats.of(tokens, errors);
    }

    public Language getLanguage() {
        return language;
    }

    /**
     * "user-specified"，或者自动识别时的可信度（high / medium / low）
     */
    public String getConfidence() {
        return confidence;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * 词法错误与结构错误，按 (行, 列) 排序
     */
    public List<Token> getErrors() {
        return errors;
    }

    public AnalysisStats getStats() {
        return stats;
    }
}
