package com.pivotcalc.backend.formula;

import com.pivotcalc.common.Error;

/**
 * FormulaScanner 将公式文本按顺序切分为 {@link FormulaToken}。
 * 支持：
 * <ul>
 *     <li>数字：整数、小数、指数形式，按固定格式解析</li>
 *     <li>裸标识符：字母或下划线开头，后续可含字母/数字/下划线/点</li>
 *     <li>方括号标识符：[任意字符]，可包含空格与标点</li>
 *     <li>合计函数：RowTotal / ColumnTotal / GrandTotal / ParentRowTotal / ParentColumnTotal，参数必须是单个字段引用</li>
 *     <li>运算符与括号：+ - * / ( )</li>
 * </ul>
 * <p>
 * 与 SQL Tokenizer 一样维护游标、peek 缓冲与错误状态：
 * <ul>
 *     <li>peek() 预读 token，但不移动游标</li>
 *     <li>pop() 消费 token，使下次 peek() 获取下一个</li>
 *     <li>一旦出错，后续每次 peek() 都抛出同一个错误</li>
 * </ul>
 */
public class FormulaScanner {

    /** 原始公式文本 */
    private final String formula;

    /** 字段名解析表 */
    private final FieldLookup lookup;

    /** 识别到合计函数时登记使用标志 */
    private final FormulaUsage usage;

    /** 当前读取位置 */
    private int pos;

    /** peek 后缓存的 token */
    private FormulaToken currentToken;

    /** 是否需要读取新 token */
    private boolean flushToken;

    /** 扫描过程中遇到的错误，发生后持续抛出 */
    private Exception err;

    /** 出错时的游标位置 */
    private int errPos = -1;

    public FormulaScanner(String formula, FieldLookup lookup, FormulaUsage usage) {
        this.formula = formula == null ? "" : formula;
        this.lookup = lookup;
        this.usage = usage;
        this.pos = 0;
        this.currentToken = FormulaToken.END;
        this.flushToken = true;
    }

    /**
     * 返回当前 token（不推进游标）。输入耗尽时返回 {@link FormulaToken#END}。
     *
     * @throws Exception 扫描出错时抛出，之后的调用抛出同一个错误
     */
    public FormulaToken peek() throws Exception {
        if(err != null) {
            throw err;
        }
        if(flushToken) {
            currentToken = next();
            flushToken = false;
        }
        return currentToken;
    }

    /** 消费掉当前 token */
    public void pop() {
        flushToken = true;
    }

    public boolean hasError() {
        return err != null;
    }

    /** 出错位置（未出错时为当前游标） */
    public int errorPosition() {
        return errPos >= 0 ? errPos : pos;
    }

    /** 返回在出错位置前插入 "<< " 的公式文本 */
    public String errFormula() {
        return FormulaException.mark(formula, errorPosition());
    }

    public String getFormula() {
        return formula;
    }

    private FormulaToken fail(Exception e) throws Exception {
        err = e;
        errPos = pos;
        throw e;
    }

    private FormulaToken next() throws Exception {
        skipBlank();
        if(pos >= formula.length()) {
            return FormulaToken.END;
        }
        char c = formula.charAt(pos);
        if(isDigit(c) || c == '.') {
            return nextNumberState();
        }
        if(isIdentifierStart(c)) {
            return nextIdentifierState();
        }
        if(c == '[') {
            return FormulaToken.value(resolve(nextBracketName()));
        }
        switch (c) {
            case '+':
                pos++;
                return FormulaToken.operator(FormulaTokenKind.ADD);
            case '-':
                pos++;
                return FormulaToken.operator(FormulaTokenKind.SUBTRACT);
            case '*':
                pos++;
                return FormulaToken.operator(FormulaTokenKind.MULTIPLY);
            case '/':
                pos++;
                return FormulaToken.operator(FormulaTokenKind.DIVIDE);
            case '(':
                pos++;
                return FormulaToken.operator(FormulaTokenKind.LEFT_PAREN);
            case ')':
                pos++;
                return FormulaToken.operator(FormulaTokenKind.RIGHT_PAREN);
            default:
                return fail(Error.InvalidCharacterException);
        }
    }

    /**
     * 数字：若干数字，可选一个小数点，可选指数（e/E 后接数字或正负号）。
     */
    private FormulaToken nextNumberState() throws Exception {
        int start = pos;
        boolean hasDecimal = false;
        while(pos < formula.length()) {
            char c = formula.charAt(pos);
            if(isDigit(c)) {
                pos++;
                continue;
            }
            if(c == '.' && !hasDecimal) {
                hasDecimal = true;
                pos++;
                continue;
            }
            if((c == 'e' || c == 'E') && pos + 1 < formula.length()) {
                char n = formula.charAt(pos + 1);
                if(isDigit(n) || n == '+' || n == '-') {
                    pos += 2;
                    while(pos < formula.length() && isDigit(formula.charAt(pos))) {
                        pos++;
                    }
                }
            }
            break;
        }
        String text = formula.substring(start, pos);
        try {
            return FormulaToken.constant(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            pos = start;
            return fail(Error.InvalidNumberException);
        }
    }

    /**
     * 裸标识符；紧跟 '(' 时按合计函数解析。
     */
    private FormulaToken nextIdentifierState() throws Exception {
        String name = readIdentifier();
        skipBlank();
        if(pos < formula.length() && formula.charAt(pos) == '(') {
            int nameEnd = pos;
            pos++;
            FormulaTokenKind kind = functionKind(name);
            if(kind == null) {
                pos = nameEnd;
                return fail(Error.UnknownFunctionException);
            }
            int index = nextFunctionArgument();
            skipBlank();
            if(pos >= formula.length() || formula.charAt(pos) != ')') {
                return fail(Error.InvalidArgumentException);
            }
            pos++;
            usage.mark(kind);
            return FormulaToken.total(kind, index);
        }
        return FormulaToken.value(resolve(name));
    }

    /** 函数参数：单个裸标识符或方括号标识符 */
    private int nextFunctionArgument() throws Exception {
        skipBlank();
        if(pos >= formula.length()) {
            fail(Error.InvalidArgumentException);
        }
        char c = formula.charAt(pos);
        if(c == '[') {
            return resolve(nextBracketName());
        }
        if(!isIdentifierStart(c)) {
            fail(Error.InvalidArgumentException);
        }
        return resolve(readIdentifier());
    }

    private String readIdentifier() {
        int start = pos;
        pos++;
        while(pos < formula.length() && isIdentifierPart(formula.charAt(pos))) {
            pos++;
        }
        return formula.substring(start, pos);
    }

    /** 读取 [ 与下一个 ] 之间的名称，游标停在 ] 之后 */
    private String nextBracketName() throws Exception {
        int open = pos;
        pos++;
        int start = pos;
        while(pos < formula.length() && formula.charAt(pos) != ']') {
            pos++;
        }
        if(pos >= formula.length()) {
            pos = open;
            fail(Error.UnterminatedBracketException);
        }
        String name = formula.substring(start, pos).trim();
        pos++;
        return name;
    }

    private int resolve(String name) throws Exception {
        int index = lookup.indexOf(name);
        if(index < 0) {
            fail(Error.FieldNotFoundException);
        }
        return index;
    }

    private static FormulaTokenKind functionKind(String name) {
        if(eq(name, "RowTotal")) {
            return FormulaTokenKind.ROW_TOTAL;
        } else if(eq(name, "ColumnTotal")) {
            return FormulaTokenKind.COLUMN_TOTAL;
        } else if(eq(name, "GrandTotal")) {
            return FormulaTokenKind.GRAND_TOTAL;
        } else if(eq(name, "ParentRowTotal")) {
            return FormulaTokenKind.PARENT_ROW_TOTAL;
        } else if(eq(name, "ParentColumnTotal")) {
            return FormulaTokenKind.PARENT_COLUMN_TOTAL;
        }
        return null;
    }

    private static boolean eq(String a, String b) {
        return a.equalsIgnoreCase(b);
    }

    private void skipBlank() {
        while(pos < formula.length() && Character.isWhitespace(formula.charAt(pos))) {
            pos++;
        }
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
