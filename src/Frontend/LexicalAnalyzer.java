package Frontend;

import Frontend.Detector.DetectionResult;
import Frontend.Detector.LanguageDetector;
import Frontend.Lexer.Language;
import Frontend.Lexer.ScanResult;
import Frontend.Lexer.Token;
import Frontend.Syntax.SyntaxChecker;
import Frontend.Syntax.SyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 分析流程：（可选）语言识别 → 扫描 → 结构检查 → 合并并排序错误 → 统计。
 * 无状态，每次调用独立创建扫描器，可被多个线程同时使用。
 */
public final class LexicalAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(LexicalAnalyzer.class);

    private static final Comparator<Token> BY_POSITION =
        Comparator.comparingInt(Token::getLine).thenComparingInt(Token::getColumn);

    private LexicalAnalyzer() {
    }

    /**
     * @param source       源码
     * @param languageHint c / cpp / python（可带别名），为 null 或无法识别时自动检测
     */
    public static AnalysisResult analyze(String source, String languageHint) throws AnalysisException {
        requireSource(source);

        Optional<Language> hinted = Language.fromId(languageHint);
        if (hinted.isPresent()) {
            return analyzeAs(source, hinted.get());
        }

        DetectionResult detection = LanguageDetector.detect(source);
        if (detection.isUnknown()) {
            throw new AnalysisException("Could not auto-detect the programming language. "
                + "Please select C, C++, or Python explicitly.", detection);
        }
        Language language = detection.getLanguage();
        String confidence = detection.getConfidence().id();
        log.debug("detected {} with {} confidence, scores {}", language.getId(), confidence, detection.getScores());
        return run(source, language, confidence);
    }

    /**
     * 以指定语言分析，不做语言识别
     */
    public static AnalysisResult analyzeAs(String source, Language language) throws AnalysisException {
        requireSource(source);
        return run(source, language, AnalysisResult.USER_SPECIFIED);
    }

    private static void requireSource(String source) throws AnalysisException {
        if (source == null || source.isBlank()) {
            throw new AnalysisException("No source code provided");
        }
    }

    private static AnalysisResult run(String source, Language language, String confidence) {
        ScanResult scan = language.tokenize(source);
        List<Token> errors = new ArrayList<>(scan.getErrors());
        errors.addAll(structuralErrors(language, scan, errors));
        errors.sort(BY_POSITION);

        log.debug("{}: {} tokens, {} errors", language.getLabel(), scan.getTokens().size(), errors.size());
        return new AnalysisResult(language, confidence, scan.getTokens(), errors);
    }

    /**
     * 结构检查的错误中，与已有词法错误位置相同的不再重复报告。
     * 检查器自身出错时记录警告并视为没有结构错误。
     */
    static List<Token> structuralErrors(Language language, ScanResult scan, List<Token> lexicalErrors) {
        List<Token> checked;
        try {
            checked = SyntaxChecker.forLanguage(language).check(scan.stream());
        } catch (SyntaxException | RuntimeException e) {
            log.warn("syntax check skipped for {}: {}", language.getId(), e.getMessage(), e);
            return List.of();
        }

        Set<Long> taken = new HashSet<>();
        for (Token error : lexicalErrors) {
            taken.add(positionKey(error));
        }
        List<Token> result = new ArrayList<>();
        for (Token error : checked) {
            if (!taken.contains(positionKey(error))) {
                result.add(error);
            }
        }
        return result;
    }

    private static long positionKey(Token token) {
        return ((long) token.getLine() << 32) | (token.getColumn() & 0xffffffffL);
    }
}
