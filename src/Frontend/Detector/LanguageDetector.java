package Frontend.Detector;

import Frontend.Lexer.Language;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 基于模式打分的语言识别：强模式每命中一次 +3，弱模式 +1，
 * 出现 C++ 独有特征时 C++ 额外 +5（C++ 代码同样会命中大量 C 模式）。
 */
public final class LanguageDetector {
    static final int STRONG_WEIGHT = 3;
    static final int WEAK_WEIGHT = 1;
    static final int CPP_EXCLUSIVE_BONUS = 5;

    static final int HIGH_SCORE = 9;
    static final int HIGH_MARGIN = 3;
    static final int MEDIUM_SCORE = 5;
    static final int MEDIUM_MARGIN = 2;

    private static final List<Pattern> CPP_STRONG = compile(
        "\\bclass\\b",
        "\\bnamespace\\b",
        "\\btemplate\\s*<",
        "\\bcout\\b",
        "\\bcin\\b",
        "\\bstd\\s*::",
        "\\bnullptr\\b",
        "\\bpublic\\s*:",
        "\\bprivate\\s*:",
        "\\bprotected\\s*:",
        "#include\\s*<[^>]+>",
        "\\bnew\\s+\\w",
        "\\bdelete\\s+\\w",
        "\\boverride\\b",
        "\\bvirtual\\b",
        "\\bconstexpr\\b",
        "\\bauto\\s+\\w+\\s*=",
        "->",
        "::",
        "\\[\\["
    );

    private static final List<Pattern> CPP_WEAK = compile(
        "\\bbool\\b",
        "<<",
        ">>"
    );

    private static final List<Pattern> C_STRONG = compile(
        "#include\\s*<stdio\\.h>",
        "#include\\s*<stdlib\\.h>",
        "#include\\s*<string\\.h>",
        "#include\\s*<math\\.h>",
        "\\bprintf\\s*\\(",
        "\\bscanf\\s*\\(",
        "\\bmalloc\\s*\\(",
        "\\bfree\\s*\\(",
        "\\bstruct\\s+\\w+\\s*\\{",
        "\\btypedef\\s+struct\\b",
        "\\bvoid\\s+\\w+\\s*\\(",
        "\\bint\\s+main\\s*\\("
    );

    private static final List<Pattern> C_WEAK = compile(
        "[{};]",
        "#include",
        "#define",
        "\\bint\\b",
        "\\bfor\\s*\\(",
        "\\bwhile\\s*\\(",
        "\\bif\\s*\\("
    );

    private static final List<Pattern> PYTHON_STRONG = compile(
        "\\bdef\\s+\\w+\\s*\\(",
        "\\bimport\\s+\\w",
        "\\bfrom\\s+\\w+\\s+import\\b",
        "\\bprint\\s*\\(",
        "\\bclass\\s+\\w+\\s*[:(]",
        "\\bself\\b",
        "\\bNone\\b",
        "\\bTrue\\b",
        "\\bFalse\\b",
        "\\belif\\b",
        "\\blambda\\b",
        "^\\s*#.*$",
        "\"\"\"",
        "f['\"]",
        "\\brange\\s*\\(",
        "\\blen\\s*\\(",
        "\\blist\\s*\\(",
        "\\bdict\\s*\\("
    );

    private static final List<Pattern> PYTHON_WEAK = compile(
        ":\\s*$",
        "\\bfor\\s+\\w+\\s+in\\b",
        "\\bwith\\b",
        "\\byield\\b",
        "\\basync\\b",
        "\\bawait\\b"
    );

    // 任一命中即给 C++ 加成
    private static final List<Pattern> CPP_EXCLUSIVE = compile(
        "::",
        "\\bnamespace\\b",
        "\\btemplate\\b",
        "\\bcout\\b",
        "\\bnullptr\\b",
        "\\boverride\\b"
    );

    private LanguageDetector() {
    }

    public static DetectionResult detect(String source) {
        Map<Language, Integer> scores = new LinkedHashMap<>();
        if (source == null || source.isBlank()) {
            for (Language language : candidates()) {
                scores.put(language, 0);
            }
            return new DetectionResult(Language.UNKNOWN, Confidence.NONE, scores);
        }

        scores.put(Language.CPP, score(source, CPP_STRONG, CPP_WEAK));
        scores.put(Language.C, score(source, C_STRONG, C_WEAK));
        scores.put(Language.PYTHON, score(source, PYTHON_STRONG, PYTHON_WEAK));

        Map<Language, Integer> adjusted = new EnumMap<>(scores);
        if (anyMatch(source, CPP_EXCLUSIVE)) {
            adjusted.merge(Language.CPP, CPP_EXCLUSIVE_BONUS, Integer::sum);
        }

        // 同分时按 cpp、c、python 的顺序取先出现者
        Language best = Language.UNKNOWN;
        int bestScore = 0;
        for (Language language : candidates()) {
            int value = adjusted.get(language);
            if (value > bestScore) {
                best = language;
                bestScore = value;
            }
        }
        if (bestScore == 0) {
            return new DetectionResult(Language.UNKNOWN, Confidence.NONE, scores);
        }

        List<Integer> ranked = new ArrayList<>(adjusted.values());
        ranked.sort((a, b) -> Integer.compare(b, a));
        int margin = bestScore - ranked.get(1);

        return new DetectionResult(best, confidenceFor(bestScore, margin), scores);
    }

    static Confidence confidenceFor(int bestScore, int margin) {
        if (bestScore <= 0) {
            return Confidence.NONE;
        }
        if (bestScore >= HIGH_SCORE && margin >= HIGH_MARGIN) {
            return Confidence.HIGH;
        }
        if (bestScore >= MEDIUM_SCORE || margin >= MEDIUM_MARGIN) {
            return Confidence.MEDIUM;
        }
        return Confidence.LOW;
    }

    private static List<Language> candidates() {
        return List.of(Language.CPP, Language.C, Language.PYTHON);
    }

    private static int score(String source, List<Pattern> strong, List<Pattern> weak) {
        int score = 0;
        for (Pattern p : strong) {
            if (p.matcher(source).find()) {
                score += STRONG_WEIGHT;
            }
        }
        for (Pattern p : weak) {
            if (p.matcher(source).find()) {
                score += WEAK_WEIGHT;
            }
        }
        return score;
    }

    private static boolean anyMatch(String source, List<Pattern> patterns) {
        for (Pattern p : patterns) {
            if (p.matcher(source).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.MULTILINE));
        }
        return List.copyOf(patterns);
    }
}
