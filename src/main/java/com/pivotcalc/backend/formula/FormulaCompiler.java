package com.pivotcalc.backend.formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.pivotcalc.common.Error;

/**
 * 双栈调度场算法：把中缀 token 流转换为后缀（RPN）程序。
 * <pre>
 * expr      := term (('+'|'-') term)*
 * term      := unary (('*'|'/') unary)*
 * unary     := '-' unary | atom
 * atom      := number | fieldref | funccall | '(' expr ')'
 * fieldref  := bareIdent | '[' anyChars ']'
 * funccall  := ('RowTotal'|'ColumnTotal'|'GrandTotal'|'ParentRowTotal'|'ParentColumnTotal') '(' fieldref ')'
 * </pre>
 * 处于"期待操作数"状态（开头、运算符之后、左括号之后）时，'-' 被解释为一元取负。
 */
public class FormulaCompiler {

    private FormulaCompiler() {
    }

    /**
     * 编译公式。
     *
     * @param formula 公式文本
     * @param lookup  字段名解析表
     * @param usage   接收合计函数使用标志
     * @return 后缀 token 序列
     * @throws FormulaException 任何扫描或语法错误
     */
    public static List<FormulaToken> compile(String formula, FieldLookup lookup, FormulaUsage usage) throws FormulaException {
        FormulaScanner scanner = new FormulaScanner(formula, lookup, usage);
        List<FormulaToken> output = new ArrayList<>();
        Deque<FormulaToken> operators = new ArrayDeque<>();
        boolean expectOperand = true;
        try {
            if(formula == null || formula.isBlank()) {
                throw Error.EmptyFormulaException;
            }
            while(true) {
                FormulaToken token = scanner.peek();
                if(token.getKind() == FormulaTokenKind.END) {
                    break;
                }
                expectOperand = handleToken(token, output, operators, expectOperand);
                scanner.pop();
            }
            if(expectOperand) {
                throw Error.IncompleteFormulaException;
            }
            while(!operators.isEmpty()) {
                FormulaToken op = operators.pop();
                if(op.getKind() == FormulaTokenKind.LEFT_PAREN) {
                    throw Error.MismatchedParenthesisException;
                }
                output.add(op);
            }
            if(stackDepth(output) != 1) {
                throw Error.IncompleteFormulaException;
            }
        } catch (Exception e) {
            throw new FormulaException(scanner.getFormula(), scanner.errorPosition(), e);
        }
        return output;
    }

    /**
     * 处理一个 token，返回处理后是否期待操作数。
     */
    private static boolean handleToken(FormulaToken token,
                                       List<FormulaToken> output,
                                       Deque<FormulaToken> operators,
                                       boolean expectOperand) throws Exception {
        FormulaTokenKind kind = token.getKind();
        if(kind.isOperand()) {
            if(!expectOperand) {
                throw Error.UnexpectedTokenException;
            }
            output.add(token);
            return false;
        }
        switch (kind) {
            case LEFT_PAREN:
                if(!expectOperand) {
                    throw Error.UnexpectedTokenException;
                }
                operators.push(token);
                return true;
            case RIGHT_PAREN:
                // 覆盖 "()" 与 "(1+)"
                if(expectOperand) {
                    throw Error.UnexpectedTokenException;
                }
                while(!operators.isEmpty() && operators.peek().getKind() != FormulaTokenKind.LEFT_PAREN) {
                    output.add(operators.pop());
                }
                if(operators.isEmpty()) {
                    throw Error.MismatchedParenthesisException;
                }
                operators.pop();
                return false;
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
            case DIVIDE:
                FormulaToken op = token;
                if(expectOperand) {
                    if(kind != FormulaTokenKind.SUBTRACT) {
                        throw Error.UnexpectedTokenException;
                    }
                    op = FormulaToken.operator(FormulaTokenKind.NEGATE);
                }
                while(!operators.isEmpty() && operators.peek().getKind() != FormulaTokenKind.LEFT_PAREN) {
                    if(!shouldPopOperator(op, operators.peek())) {
                        break;
                    }
                    output.add(operators.pop());
                }
                operators.push(op);
                return true;
            default:
                throw Error.UnexpectedTokenException;
        }
    }

    private static boolean shouldPopOperator(FormulaToken current, FormulaToken top) {
        int currentPrecedence = current.getKind().precedence();
        int topPrecedence = top.getKind().precedence();
        if(currentPrecedence < topPrecedence) {
            return true;
        }
        return currentPrecedence == topPrecedence && current.getKind().isLeftAssociative();
    }

    /**
     * 模拟执行后缀程序时操作数栈的深度，下溢返回 -1。
     */
    static int stackDepth(List<FormulaToken> program) {
        int depth = 0;
        for (FormulaToken token : program) {
            FormulaTokenKind kind = token.getKind();
            if(kind.isOperand()) {
                depth++;
            } else if(kind == FormulaTokenKind.NEGATE) {
                if(depth < 1) {
                    return -1;
                }
            } else if(kind.isBinaryOperator()) {
                if(depth < 2) {
                    return -1;
                }
                depth--;
            } else {
                return -1;
            }
        }
        return depth;
    }
}
