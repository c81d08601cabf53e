package Frontend.Lexer;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * 支持的源语言以及对应的扫描器。UNKNOWN 仅作为语言识别的结果出现。
 */
public enum Language {
    CPP("cpp", "C++", CppScanner::new),
    C("c", "C", CScanner::new),
    PYTHON("python", "Python", PythonScanner::new),
    UNKNOWN("unknown", "Unknown", null);

    private final String id;
    private final String label;
    private final Function<String, CursorScanner> factory;

    Language(String id, String label, Function<String, CursorScanner> factory) {
        this.id = id;
        this.label = label;
        this.factory = factory;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 每次调用都返回新的扫描器实例
     */
    public CursorScanner newScanner(String source) {
        if (factory == null) {
            throw new IllegalStateException("no scanner for language " + id);
        }
        return factory.apply(source);
    }

    public ScanResult tokenize(String source) {
        return newScanner(source).tokenize();
    }

    public static List<Language> supported() {
        return List.of(C, CPP, PYTHON);
    }

    /**
     * 按 id 查找（忽略大小写与首尾空白），接受别名 py 与 c++
     */
    public static Optional<Language> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        switch (id.trim().toLowerCase(Locale.ROOT)) {
            case "c":
                return Optional.of(C);
            case "cpp":
            case "c++":
                return Optional.of(CPP);
            case "python":
            case "py":
                return Optional.of(PYTHON);
            default:
                return Optional.empty();
        }
    }
}
