package Frontend.Lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * C 系语言的差异点：错误前缀、关键字集合、运算符表、标识符分类以及是否允许用户定义字面量后缀。
 * C++ 在 C 的表之上叠加自己的条目，而不是覆写 C 扫描器的方法。
 */
final class CDialect {

    static final Set<String> C_KEYWORDS = Set.of(
        "auto", "break", "case", "char", "const", "continue", "default",
        "do", "double", "else", "enum", "extern", "float", "for", "goto",
        "if", "inline", "int", "long", "register", "restrict", "return",
        "short", "signed", "sizeof", "static", "struct", "switch", "typedef",
        "union", "unsigned", "void", "volatile", "while",
        // C99 / C11
        "_Alignas", "_Alignof", "_Atomic", "_Bool", "_Complex",
        "_Generic", "_Imaginary", "_Noreturn", "_Static_assert",
        "_Thread_local"
    );

    static final Set<String> CPP_EXTRA_KEYWORDS = Set.of(
        // 类与类型系统
        "class", "namespace", "template", "typename", "virtual", "override",
        "final", "explicit", "friend", "operator", "this", "using",
        "public", "private", "protected", "new", "delete",
        "bool", "true", "false",
        // 异常
        "try", "catch", "throw", "noexcept",
        // 类型转换
        "static_cast", "dynamic_cast", "reinterpret_cast", "const_cast",
        // C++11 起
        "nullptr", "constexpr", "consteval", "constinit",
        "decltype", "static_assert", "thread_local",
        "alignas", "alignof", "typeid", "mutable",
        // C++20
        "concept", "requires", "co_await", "co_return", "co_yield",
        "export", "import", "module",
        "wchar_t", "char8_t", "char16_t", "char32_t"
    );

    // 按长度从长到短排列，保证最长匹配
    static final List<String> C_OPERATORS = List.of(
        "<<=", ">>=", "...",
        "->", "++", "--", "<<", ">>", "<=", ">=", "==", "!=",
        "&&", "||", "+=", "-=", "*=", "/=", "%=",
        "&=", "|=", "^=",
        "+", "-", "*", "/", "%", "=", "<", ">",
        "&", "|", "^", "~", "!", ".", "?"
    );

    // C++ 额外运算符排在前面，"->*" 先于 "->"，".*" 先于 "."
    static final List<String> CPP_EXTRA_OPERATORS = List.of("->*", ".*", "::");

    static final String DELIMITERS = "(){};,[]:#";

    static final CDialect C = new CDialect("C", C_KEYWORDS, C_OPERATORS, false);

    static final CDialect CPP = new CDialect("C++",
        union(C_KEYWORDS, CPP_EXTRA_KEYWORDS),
        concat(CPP_EXTRA_OPERATORS, C_OPERATORS),
        true);

    private final String label;
    private final Set<String> keywords;
    private final List<String> operators;
    private final boolean userDefinedLiterals;

    private CDialect(String label, Set<String> keywords, List<String> operators, boolean userDefinedLiterals) {
        this.label = label;
        this.keywords = keywords;
        this.operators = operators;
        this.userDefinedLiterals = userDefinedLiterals;
    }

    /**
     * 错误信息统一加上语言前缀，例如 "[C++ Error] ..."
     */
    String error(String message) {
        return "[" + label + " Error] " + message;
    }

    List<String> operators() {
        return operators;
    }

    boolean allowsUserDefinedLiterals() {
        return userDefinedLiterals;
    }

    TokenKind classify(String word) {
        if (!keywords.contains(word)) {
            return TokenKind.IDENTIFIER;
        }
        // C 中 true/false 不是关键字，走不到这里
        return word.equals("true") || word.equals("false") ? TokenKind.BOOLEAN : TokenKind.KEYWORD;
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> result = new HashSet<>(a);
        result.addAll(b);
        return Collections.unmodifiableSet(result);
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> result = new ArrayList<>(a);
        result.addAll(b);
        return Collections.unmodifiableList(result);
    }
}
