package Frontend.Detector;

import Frontend.Lexer.Language;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class DetectionResult {
    private final Language language;
    private final Confidence confidence;
    private final Map<Language, Integer> scores;

    public DetectionResult(Language language, Confidence confidence, Map<Language, Integer> scores) {
        this.language = language;
        this.confidence = confidence;
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public Language getLanguage() {
        return language;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    /**
     * 各语言的原始模式得分（不含 C++ 加成），顺序为 cpp、c、python
     */
    public Map<Language, Integer> getScores() {
        return scores;
    }

    int scoreOf(Language language) {
        return scores.getOrDefault(language, 0);
    }

    public boolean isUnknown() {
        return language == Language.UNKNOWN;
    }

    @Override
    public String toString() {
        return String.format("DetectionResult(%s, %s, scores=%s)", language.getId(), confidence.id(), scores);
    }
}
