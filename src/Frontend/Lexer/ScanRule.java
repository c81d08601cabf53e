package Frontend.Lexer;

/**
 * 分派表中的一条规则：若当前位置属于本规则则消耗输入并返回 true
 */
@FunctionalInterface
interface ScanRule<S extends CursorScanner> {
    boolean apply(S scanner, int line, int column);
}
