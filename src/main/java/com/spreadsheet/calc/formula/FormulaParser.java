package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.config.SpreadsheetProperties;
import com.spreadsheet.calc.exceptions.FormulaSyntaxException;
import com.spreadsheet.calc.exceptions.InvalidCellAddressException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Turns cell content into either a literal value or an expression tree.
 * Formulas are parsed with two stacks (operands and pending operators),
 * the precedence-climbing form of the shunting-yard algorithm.
 */
public class FormulaParser {

    public static final char FORMULA_MARKER = '=';

    private static final Pattern NUMBER_LITERAL =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final int maxRangeCells;

    public FormulaParser() {
        this(SpreadsheetProperties.DEFAULT_MAX_RANGE_CELLS);
    }

    public FormulaParser(int maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    /**
     * Classifies raw cell text. Text starting with "=" is parsed as a formula;
     * positions in syntax errors then refer to the raw text, marker included.
     * Anything else is a literal: blank is empty, a number when it reads as one, text otherwise.
     */
    public ParsedContent parseContent(String rawValue) {
        if (rawValue == null || rawValue.trim().isEmpty()) {
            return ParsedContent.literal(CellValue.empty());
        }
        if (rawValue.charAt(0) == FORMULA_MARKER) {
            List<Token> tokens = Tokenizer.tokenize(rawValue, 1);
            return ParsedContent.formula(parse(tokens, rawValue.length()));
        }
        return ParsedContent.literal(parseLiteral(rawValue));
    }

    public static CellValue parseLiteral(String rawValue) {
        String trimmed = rawValue.trim();
        if (trimmed.isEmpty()) {
            return CellValue.empty();
        }
        if (NUMBER_LITERAL.matcher(trimmed).matches()) {
            double number = Double.parseDouble(trimmed);
            // Too large for a double, e.g. "1e400": kept as typed
            if (!Double.isInfinite(number)) {
                return CellValue.number(number);
            }
        }
        return CellValue.text(rawValue);
    }

    /**
     * Parses a formula body, i.e. the text after the "=" marker.
     */
    public ExprNode parse(String formulaBody) {
        return parse(Tokenizer.tokenize(formulaBody), formulaBody.length());
    }

    /**
     * @param endPosition offset reported when the input ends too early
     */
    public ExprNode parse(List<Token> tokens, int endPosition) {
        if (tokens.isEmpty()) {
            throw new FormulaSyntaxException(ErrorKind.EMPTY_EXPRESSION, endPosition,
                    "Formula has no expression after '='");
        }
        Deque<ExprNode> operands = new ArrayDeque<>();
        Deque<Pending> pending = new ArrayDeque<>();
        boolean expectOperand = true;

        for (Token token : tokens) {
            switch (token.getType()) {
                case NUMBER:
                    requireOperandSlot(token, expectOperand);
                    operands.push(new LiteralNode(CellValue.number(Double.parseDouble(token.getText())),
                            token.getPosition()));
                    expectOperand = false;
                    break;
                case STRING:
                    requireOperandSlot(token, expectOperand);
                    operands.push(new LiteralNode(CellValue.text(token.getText()), token.getPosition()));
                    expectOperand = false;
                    break;
                case BOOLEAN:
                    requireOperandSlot(token, expectOperand);
                    operands.push(new LiteralNode(CellValue.bool("TRUE".equals(token.getText())),
                            token.getPosition()));
                    expectOperand = false;
                    break;
                case REFERENCE:
                    requireOperandSlot(token, expectOperand);
                    operands.push(new ReferenceNode(toAddress(token.getText(), token), token.getPosition()));
                    expectOperand = false;
                    break;
                case RANGE:
                    requireOperandSlot(token, expectOperand);
                    operands.push(toRange(token));
                    expectOperand = false;
                    break;
                case IDENTIFIER:
                    throw new FormulaSyntaxException(ErrorKind.UNEXPECTED_TOKEN, token.getPosition(),
                            "Unknown name '" + token.getText() + "'");
                case FUNCTION:
                    requireOperandSlot(token, expectOperand);
                    pending.push(Pending.call(token, operands.size()));
                    expectOperand = true;
                    break;
                case LEFT_PAREN:
                    if (!pending.isEmpty() && pending.peek().awaitsOpenParen) {
                        pending.peek().awaitsOpenParen = false;
                        pending.peek().open = token;
                        break;
                    }
                    requireOperandSlot(token, expectOperand);
                    pending.push(Pending.group(token));
                    expectOperand = true;
                    break;
                case COMMA:
                    if (expectOperand) {
                        throw new FormulaSyntaxException(ErrorKind.UNEXPECTED_TOKEN, token.getPosition(),
                                "Missing argument before ','");
                    }
                    applyUntilFrame(operands, pending);
                    if (pending.isEmpty() || pending.peek().functionName == null) {
                        throw new FormulaSyntaxException(ErrorKind.UNEXPECTED_TOKEN, token.getPosition(),
                                "',' is only allowed between function arguments");
                    }
                    pending.peek().argumentCount++;
                    expectOperand = true;
                    break;
                case RIGHT_PAREN:
                    closeFrame(token, operands, pending, expectOperand);
                    expectOperand = false;
                    break;
                case OPERATOR:
                    if (expectOperand) {
                        Operator unary = Operator.unary(token.getText());
                        if (unary == null) {
                            throw new FormulaSyntaxException(ErrorKind.UNEXPECTED_TOKEN, token.getPosition(),
                                    "Missing operand before '" + token.getText() + "'");
                        }
                        // Prefix operators have no left operand, so nothing is reduced yet
                        pending.push(Pending.operator(unary, token));
                    } else {
                        Operator binary = Operator.binary(token.getText());
                        while (!pending.isEmpty() && pending.peek().operator != null
                                && pending.peek().operator.appliesBefore(binary)) {
                            apply(pending.pop(), operands);
                        }
                        pending.push(Pending.operator(binary, token));
                        expectOperand = true;
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled token type " + token.getType());
            }
        }

        // An unclosed bracket outranks a missing operand, so "=(1+" is unbalanced
        for (Pending entry : pending) {
            if (entry.operator == null) {
                Token bracket = entry.open != null ? entry.open : entry.token;
                throw new FormulaSyntaxException(ErrorKind.UNBALANCED_PARENS, bracket.getPosition(),
                        "Bracket '" + bracket.getText() + "' is never closed");
            }
        }
        if (expectOperand) {
            throw new FormulaSyntaxException(ErrorKind.UNEXPECTED_TOKEN, endPosition,
                    "Formula ends where an operand is expected");
        }
        while (!pending.isEmpty()) {
            apply(pending.pop(), operands);
        }
        return operands.pop();
    }

    private void closeFrame(Token close, Deque<ExprNode> operands, Deque<Pending> pending, boolean expectOperand) {
        if (expectOperand) {
            Pending top = pending.peek();
            // "NAME()" is the only place a ")" may directly follow an opening bracket
            boolean emptyCall = top != null && top.functionName != null
                    && top.argumentCount == 0 && operands.size() == top.operandBase;
            if (!emptyCall) {
                throw new FormulaSyntaxException(ErrorKind.UNEXPECTED_TOKEN, close.getPosition(),
                        "Missing operand before '" + close.getText() + "'");
            }
            pending.pop();
            checkPair(top.open, close);
            operands.push(new CallNode(top.functionName, new ArrayList<>(), top.token.getPosition()));
            return;
        }
        applyUntilFrame(operands, pending);
        if (pending.isEmpty()) {
            throw new FormulaSyntaxException(ErrorKind.UNBALANCED_PARENS, close.getPosition(),
                    "'" + close.getText() + "' has no matching opening bracket");
        }
        Pending frame = pending.pop();
        checkPair(frame.open, close);
        if (frame.functionName != null) {
            int count = frame.argumentCount + 1;
            LinkedList<ExprNode> arguments = new LinkedList<>();
            for (int i = 0; i < count; i++) {
                arguments.addFirst(operands.pop());
            }
            operands.push(new CallNode(frame.functionName, new ArrayList<>(arguments), frame.token.getPosition()));
        }
    }

    private void applyUntilFrame(Deque<ExprNode> operands, Deque<Pending> pending) {
        while (!pending.isEmpty() && pending.peek().operator != null) {
            apply(pending.pop(), operands);
        }
    }

    private void apply(Pending entry, Deque<ExprNode> operands) {
        Operator op = entry.operator;
        int position = entry.token.getPosition();
        if (op.isUnary()) {
            operands.push(new UnaryOpNode(op, operands.pop(), position));
        } else {
            ExprNode right = operands.pop();
            ExprNode left = operands.pop();
            operands.push(new BinaryOpNode(op, left, right, position));
        }
    }

    private static void checkPair(Token open, Token close) {
        String pair = open.getText() + close.getText();
        if (!"()".equals(pair) && !"[]".equals(pair) && !"{}".equals(pair)) {
            throw new FormulaSyntaxException(ErrorKind.UNBALANCED_PARENS, close.getPosition(),
                    "'" + close.getText() + "' does not match '" + open.getText() + "'");
        }
    }

    private static void requireOperandSlot(Token token, boolean expectOperand) {
        if (!expectOperand) {
            throw new FormulaSyntaxException(ErrorKind.UNEXPECTED_TOKEN, token.getPosition(),
                    "Unexpected '" + token.getText() + "', an operator is missing");
        }
    }

    private static CellAddress toAddress(String text, Token token) {
        try {
            return CellAddress.parse(text);
        } catch (InvalidCellAddressException e) {
            throw new FormulaSyntaxException(ErrorKind.INVALID_REFERENCE, token.getPosition(), e.getMessage());
        }
    }

    private RangeNode toRange(Token token) {
        String[] corners = token.getText().split(":");
        RangeNode range = new RangeNode(toAddress(corners[0], token), toAddress(corners[1], token),
                token.getPosition());
        if (range.size() > maxRangeCells) {
            throw new FormulaSyntaxException(ErrorKind.INVALID_REFERENCE, token.getPosition(),
                    "Range " + range + " spans " + range.size() + " cells, the limit is " + maxRangeCells);
        }
        return range;
    }

    /**
     * Entry of the operator stack: a pending operator, an open group bracket,
     * or an open function call collecting arguments.
     */
    private static final class Pending {
        private Operator operator;
        private String functionName;
        private Token token;
        private Token open;
        private boolean awaitsOpenParen;
        private int argumentCount;
        private int operandBase;

        static Pending operator(Operator operator, Token token) {
            Pending p = new Pending();
            p.operator = operator;
            p.token = token;
            return p;
        }

        static Pending group(Token open) {
            Pending p = new Pending();
            p.token = open;
            p.open = open;
            return p;
        }

        static Pending call(Token name, int operandBase) {
            Pending p = new Pending();
            p.functionName = name.getText();
            p.token = name;
            p.awaitsOpenParen = true;
            p.operandBase = operandBase;
            return p;
        }
    }
}
