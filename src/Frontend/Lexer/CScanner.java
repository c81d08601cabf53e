package Frontend.Lexer;

import java.util.List;

/**
 * C 语言扫描器（C89 / C99 / C11 关键字，C23 二进制字面量）
 */
public class CScanner extends CursorScanner {
    private static final List<ScanRule<CursorScanner>> RULES = CFamilyRules.rules(CDialect.C);

    public CScanner(String source) {
        super(source);
    }

    @Override
    protected void scanToken() {
        CFamilyRules.dispatch(this, RULES, CDialect.C);
    }
}
