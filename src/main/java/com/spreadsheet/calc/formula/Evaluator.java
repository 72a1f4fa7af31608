package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.exceptions.EvaluationException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

import java.util.Locale;

/**
 * Computes the value of an expression tree.
 * Other cells are read through a {@link CellValueResolver}; the evaluator never
 * decides evaluation order, that is the recalculation scheduler's job.
 */
public class Evaluator {

    private final FunctionRegistry functions;

    public Evaluator() {
        this(FunctionRegistry.standard());
    }

    public Evaluator(FunctionRegistry functions) {
        this.functions = functions;
    }

    /**
     * Evaluates a cell formula. Failures come back as ERROR values, never as exceptions.
     * A formula whose result is an empty cell yields 0.
     */
    public CellValue evaluate(ExprNode root, CellValueResolver resolver) {
        try {
            CellValue result = eval(root, resolver);
            return result.isEmpty() ? CellValue.number(0) : result;
        } catch (EvaluationException e) {
            return CellValue.error(e.getError());
        } catch (ArithmeticException | NumberFormatException e) {
            return CellValue.error(ErrorKind.INVALID_NUMBER, "Numeric failure: " + e.getMessage());
        }
    }

    private CellValue eval(ExprNode node, CellValueResolver resolver) {
        switch (node.getKind()) {
            case LITERAL: {
                CellValue value = ((LiteralNode) node).getValue();
                // A number token such as 1e400 overflows to infinity
                return value.isNumber() ? Coercions.checkedNumber(value.getNumber()) : value;
            }
            case REFERENCE:
                return resolveReference(((ReferenceNode) node).getAddress(), resolver);
            case RANGE:
                throw new EvaluationException(ErrorKind.TYPE_MISMATCH,
                        "Range " + node + " can only be used as a function argument");
            case UNARY_OP:
                return evalUnary((UnaryOpNode) node, resolver);
            case BINARY_OP:
                return evalBinary((BinaryOpNode) node, resolver);
            case CALL:
                return evalCall((CallNode) node, resolver);
            default:
                throw new IllegalStateException("Unhandled node kind " + node.getKind());
        }
    }

    private static CellValue resolveReference(CellAddress address, CellValueResolver resolver) {
        CellValue value = resolver.resolve(address);
        if (value == null) {
            return CellValue.empty();
        }
        if (value.isError()) {
            throw new EvaluationException(CellError.propagated(value.getError(), address));
        }
        return value;
    }

    private CellValue evalUnary(UnaryOpNode node, CellValueResolver resolver) {
        double operand = Coercions.toNumber(eval(node.getOperand(), resolver));
        switch (node.getOperator()) {
            case NEGATE:
                return CellValue.number(-operand);
            case UNARY_PLUS:
                return CellValue.number(operand);
            default:
                throw new IllegalStateException("Not a unary operator: " + node.getOperator());
        }
    }

    private CellValue evalBinary(BinaryOpNode node, CellValueResolver resolver) {
        CellValue left = eval(node.getLeft(), resolver);
        CellValue right = eval(node.getRight(), resolver);
        switch (node.getOperator()) {
            case ADD:
                return Coercions.checkedNumber(Coercions.toNumber(left) + Coercions.toNumber(right));
            case SUBTRACT:
                return Coercions.checkedNumber(Coercions.toNumber(left) - Coercions.toNumber(right));
            case MULTIPLY:
                return Coercions.checkedNumber(Coercions.toNumber(left) * Coercions.toNumber(right));
            case DIVIDE: {
                double dividend = Coercions.toNumber(left);
                double divisor = Coercions.toNumber(right);
                if (divisor == 0) {
                    throw new EvaluationException(ErrorKind.DIVIDE_BY_ZERO, "Division by zero");
                }
                return Coercions.checkedNumber(dividend / divisor);
            }
            case POWER:
                return Coercions.checkedNumber(Math.pow(Coercions.toNumber(left), Coercions.toNumber(right)));
            case CONCAT:
                return CellValue.text(Coercions.toText(left) + Coercions.toText(right));
            case EQUAL:
                return CellValue.bool(compare(left, right) == 0);
            case NOT_EQUAL:
                return CellValue.bool(compare(left, right) != 0);
            case LESS:
                return CellValue.bool(compare(left, right) < 0);
            case GREATER:
                return CellValue.bool(compare(left, right) > 0);
            case LESS_OR_EQUAL:
                return CellValue.bool(compare(left, right) <= 0);
            case GREATER_OR_EQUAL:
                return CellValue.bool(compare(left, right) >= 0);
            default:
                throw new IllegalStateException("Not a binary operator: " + node.getOperator());
        }
    }

    /**
     * Text compares with text case-insensitively, everything else numerically.
     * An empty cell matches whichever side it is compared with.
     */
    private static int compare(CellValue left, CellValue right) {
        if (left.isText() || right.isText()) {
            if ((left.isText() || left.isEmpty()) && (right.isText() || right.isEmpty())) {
                String a = Coercions.toText(left).toLowerCase(Locale.ROOT);
                String b = Coercions.toText(right).toLowerCase(Locale.ROOT);
                return Integer.signum(a.compareTo(b));
            }
            throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "Cannot compare text with a number");
        }
        double a = Coercions.toNumber(left);
        double b = Coercions.toNumber(right);
        return a < b ? -1 : (a > b ? 1 : 0);
    }

    private CellValue evalCall(CallNode call, CellValueResolver resolver) {
        FormulaFunction function = functions.find(call.getName());
        if (function == null) {
            throw new EvaluationException(ErrorKind.UNKNOWN_FUNCTION, "Unknown function " + call.getName());
        }
        int count = call.getArguments().size();
        if (!function.acceptsArgumentCount(count)) {
            throw new EvaluationException(ErrorKind.ARGUMENT_COUNT, function.getName() + " expects "
                    + function.describeArity() + " argument(s), got " + count);
        }

        FunctionArguments arguments = new FunctionArguments();
        for (ExprNode argument : call.getArguments()) {
            if (argument.getKind() == NodeKind.RANGE) {
                if (!function.acceptsRanges()) {
                    throw new EvaluationException(ErrorKind.TYPE_MISMATCH,
                            function.getName() + " does not accept a range argument");
                }
                for (CellAddress address : ((RangeNode) argument).cells()) {
                    arguments.add(resolveReference(address, resolver), true);
                }
            } else {
                arguments.add(eval(argument, resolver), false);
            }
        }
        return function.apply(arguments);
    }
}
