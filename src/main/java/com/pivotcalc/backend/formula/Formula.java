package com.pivotcalc.backend.formula;

import java.util.List;
import java.util.function.DoubleBinaryOperator;

import com.google.common.collect.ImmutableList;

/**
 * 编译后的公式：不可变的后缀 token 程序 + 它的 {@link FormulaUsage}。
 * <p>
 * 执行时使用显式操作数栈，栈元素为可空 double：
 * 任何一个操作数缺失，或除数为 0，运算结果即为缺失（null），并沿表达式向上传播。
 */
public final class Formula {
    private final ImmutableList<FormulaToken> tokens;
    private final FormulaUsage usage;
    private final String text;

    private Formula(String text, List<FormulaToken> tokens, FormulaUsage usage) {
        this.text = text;
        this.tokens = ImmutableList.copyOf(tokens);
        this.usage = usage;
    }

    /**
     * 编译公式。
     *
     * @throws FormulaException 公式为空、字段名无法解析、括号不匹配等
     */
    public static Formula compile(String text, FieldLookup lookup) throws FormulaException {
        FormulaUsage usage = new FormulaUsage();
        usage.setValueFieldCount(lookup.getFieldCount());
        List<FormulaToken> program = FormulaCompiler.compile(text, lookup, usage);
        return new Formula(text, program, usage);
    }

    /**
     * 编译公式，失败时返回 null。
     */
    public static Formula tryCompile(String text, FieldLookup lookup) {
        try {
            return compile(text, lookup);
        } catch (FormulaException e) {
            return null;
        }
    }

    public Double evaluate(FormulaContext context) {
        if(tokens.isEmpty()) {
            return null;
        }
        OperandStack stack = new OperandStack(tokens.size());
        for (FormulaToken token : tokens) {
            int index = token.getValueIndex();
            switch (token.getKind()) {
                case CONSTANT:
                    stack.push(token.getConstant());
                    break;
                case VALUE:
                    stack.push(context.toNumber(context.resolveValue(index)));
                    break;
                case ROW_TOTAL:
                    stack.push(context.toNumber(context.resolveRowTotal(index)));
                    break;
                case COLUMN_TOTAL:
                    stack.push(context.toNumber(context.resolveColumnTotal(index)));
                    break;
                case GRAND_TOTAL:
                    stack.push(context.toNumber(context.resolveGrandTotal(index)));
                    break;
                case PARENT_ROW_TOTAL:
                    stack.push(context.toNumber(context.resolveParentRowTotal(index)));
                    break;
                case PARENT_COLUMN_TOTAL:
                    stack.push(context.toNumber(context.resolveParentColumnTotal(index)));
                    break;
                case NEGATE:
                    if(stack.size() < 1) {
                        return null;
                    }
                    Double v = stack.pop();
                    stack.push(v == null ? null : -v);
                    break;
                case ADD:
                    if(!binary(stack, (a, b) -> a + b)) {
                        return null;
                    }
                    break;
                case SUBTRACT:
                    if(!binary(stack, (a, b) -> a - b)) {
                        return null;
                    }
                    break;
                case MULTIPLY:
                    if(!binary(stack, (a, b) -> a * b)) {
                        return null;
                    }
                    break;
                case DIVIDE:
                    if(!binary(stack, (a, b) -> b == 0d ? Double.NaN : a / b)) {
                        return null;
                    }
                    break;
                default:
                    return null;
            }
        }
        return stack.size() == 1 ? stack.pop() : null;
    }

    /**
     * 弹出两个操作数并压入运算结果；栈中不足两个元素时返回 false。
     * 结果为 NaN（除以 0）时压入 null。
     */
    private static boolean binary(OperandStack stack, DoubleBinaryOperator op) {
        if(stack.size() < 2) {
            return false;
        }
        Double right = stack.pop();
        Double left = stack.pop();
        if(left == null || right == null) {
            stack.push(null);
            return true;
        }
        double result = op.applyAsDouble(left, right);
        stack.push(Double.isNaN(result) ? null : result);
        return true;
    }

    public List<FormulaToken> getTokens() {
        return tokens;
    }

    public FormulaUsage getUsage() {
        return usage;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (FormulaToken token : tokens) {
            if(sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(token);
        }
        return sb.toString();
    }

    /** 可存放 null 的定长操作数栈，容量为程序长度 */
    private static final class OperandStack {
        private final Double[] items;
        private int top;

        OperandStack(int capacity) {
            this.items = new Double[capacity];
        }

        void push(Double value) {
            items[top++] = value;
        }

        Double pop() {
            Double v = items[--top];
            items[top] = null;
            return v;
        }

        int size() {
            return top;
        }
    }
}
