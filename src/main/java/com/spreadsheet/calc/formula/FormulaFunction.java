package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellValue;

/**
 * A named spreadsheet function with a fixed or open-ended arity.
 */
public final class FormulaFunction {

    public static final int VARIADIC = Integer.MAX_VALUE;

    @FunctionalInterface
    public interface Implementation {
        CellValue apply(FunctionArguments arguments);
    }

    private final String name;
    private final int minArguments;
    private final int maxArguments;
    private final boolean acceptsRanges;
    private final Implementation implementation;

    public FormulaFunction(String name, int minArguments, int maxArguments, boolean acceptsRanges,
                           Implementation implementation) {
        this.name = name;
        this.minArguments = minArguments;
        this.maxArguments = maxArguments;
        this.acceptsRanges = acceptsRanges;
        this.implementation = implementation;
    }

    public String getName() {
        return name;
    }

    public int getMinArguments() {
        return minArguments;
    }

    public int getMaxArguments() {
        return maxArguments;
    }

    public boolean acceptsRanges() {
        return acceptsRanges;
    }

    public boolean acceptsArgumentCount(int count) {
        return count >= minArguments && count <= maxArguments;
    }

    public String describeArity() {
        if (maxArguments == VARIADIC) {
            return "at least " + minArguments;
        }
        if (minArguments == maxArguments) {
            return String.valueOf(minArguments);
        }
        return minArguments + " to " + maxArguments;
    }

    public CellValue apply(FunctionArguments arguments) {
        return implementation.apply(arguments);
    }
}
