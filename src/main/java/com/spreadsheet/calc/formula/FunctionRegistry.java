package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.exceptions.EvaluationException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.function.DoubleUnaryOperator;

/**
 * Name -> function lookup used by the evaluator. Names are case-insensitive.
 */
public class FunctionRegistry {

    private final Map<String, FormulaFunction> functions = new HashMap<>();

    /**
     * Registry with the built-in trigonometric, exponential, aggregate, logical and text functions.
     */
    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();

        // Trigonometry
        registry.unary("SIN", Math::sin);
        registry.unary("COS", Math::cos);
        registry.unary("TAN", Math::tan);
        registry.unary("ASIN", Math::asin);
        registry.unary("ACOS", Math::acos);
        registry.unary("ATAN", Math::atan);
        registry.register(new FormulaFunction("PI", 0, 0, false, args -> CellValue.number(Math.PI)));

        // Exponential and rounding
        registry.unary("EXP", Math::exp);
        registry.unary("LN", Math::log);
        registry.unary("LOG10", Math::log10);
        registry.unary("SQRT", Math::sqrt);
        registry.unary("ABS", Math::abs);
        registry.register(new FormulaFunction("LOG", 1, 2, false, FunctionRegistry::log));
        registry.register(new FormulaFunction("POWER", 2, 2, false,
                args -> Coercions.checkedNumber(Math.pow(args.number(0), args.number(1)))));
        registry.register(new FormulaFunction("ROUND", 1, 2, false, FunctionRegistry::round));

        // Aggregates
        registry.register(new FormulaFunction("SUM", 1, FormulaFunction.VARIADIC, true,
                args -> Coercions.checkedNumber(sum(args.numbers()))));
        registry.register(new FormulaFunction("AVERAGE", 1, FormulaFunction.VARIADIC, true,
                FunctionRegistry::average));
        registry.register(new FormulaFunction("MIN", 1, FormulaFunction.VARIADIC, true,
                args -> CellValue.number(args.numbers().stream().mapToDouble(Double::doubleValue).min().orElse(0))));
        registry.register(new FormulaFunction("MAX", 1, FormulaFunction.VARIADIC, true,
                args -> CellValue.number(args.numbers().stream().mapToDouble(Double::doubleValue).max().orElse(0))));
        registry.register(new FormulaFunction("COUNT", 1, FormulaFunction.VARIADIC, true,
                args -> CellValue.number(args.values().stream().filter(CellValue::isNumber).count())));

        // Logic
        registry.register(new FormulaFunction("IF", 2, 3, false,
                args -> args.bool(0) ? args.get(1) : (args.size() > 2 ? args.get(2) : CellValue.bool(false))));
        registry.register(new FormulaFunction("AND", 1, FormulaFunction.VARIADIC, true,
                args -> CellValue.bool(args.booleans().stream().allMatch(Boolean::booleanValue))));
        registry.register(new FormulaFunction("OR", 1, FormulaFunction.VARIADIC, true,
                args -> CellValue.bool(args.booleans().stream().anyMatch(Boolean::booleanValue))));
        registry.register(new FormulaFunction("NOT", 1, 1, false, args -> CellValue.bool(!args.bool(0))));

        // Text
        registry.register(new FormulaFunction("CONCAT", 1, FormulaFunction.VARIADIC, true, args -> {
            StringBuilder sb = new StringBuilder();
            for (CellValue value : args.values()) {
                sb.append(Coercions.toText(value));
            }
            return CellValue.text(sb.toString());
        }));
        registry.register(new FormulaFunction("LEN", 1, 1, false, args -> CellValue.number(args.text(0).length())));
        registry.register(new FormulaFunction("UPPER", 1, 1, false,
                args -> CellValue.text(args.text(0).toUpperCase(Locale.ROOT))));
        registry.register(new FormulaFunction("LOWER", 1, 1, false,
                args -> CellValue.text(args.text(0).toLowerCase(Locale.ROOT))));

        return registry;
    }

    public void register(FormulaFunction function) {
        functions.put(function.getName().toUpperCase(Locale.ROOT), function);
    }

    public FormulaFunction find(String name) {
        return functions.get(name.toUpperCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    private void unary(String name, DoubleUnaryOperator operator) {
        register(new FormulaFunction(name, 1, 1, false,
                args -> Coercions.checkedNumber(operator.applyAsDouble(args.number(0)))));
    }

    private static double sum(List<Double> numbers) {
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return total;
    }

    private static CellValue average(FunctionArguments args) {
        List<Double> numbers = args.numbers();
        if (numbers.isEmpty()) {
            throw new EvaluationException(ErrorKind.DIVIDE_BY_ZERO, "AVERAGE has no numbers to average");
        }
        return Coercions.checkedNumber(sum(numbers) / numbers.size());
    }

    private static CellValue log(FunctionArguments args) {
        double value = args.number(0);
        double base = args.size() > 1 ? args.number(1) : 10;
        if (base == 1) {
            throw new EvaluationException(ErrorKind.DIVIDE_BY_ZERO, "LOG base cannot be 1");
        }
        return Coercions.checkedNumber(Math.log(value) / Math.log(base));
    }

    private static CellValue round(FunctionArguments args) {
        double value = Coercions.checkedNumber(args.number(0)).getNumber();
        // Digits past double precision change nothing
        int digits = args.size() > 1 ? (int) Math.max(-308, Math.min(17, args.number(1))) : 0;
        // HALF_UP on BigDecimal rounds halves away from zero
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP);
        return CellValue.number(rounded.doubleValue());
    }
}
