package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellAddress;

import java.util.Set;
import java.util.TreeSet;

/**
 * Gathers every cell address an expression reads, with ranges expanded.
 */
public final class ReferenceCollector {

    private ReferenceCollector() {
    }

    public static Set<CellAddress> collect(ExprNode root) {
        Set<CellAddress> references = new TreeSet<>();
        if (root != null) {
            collect(root, references);
        }
        return references;
    }

    private static void collect(ExprNode node, Set<CellAddress> out) {
        switch (node.getKind()) {
            case LITERAL:
                break;
            case REFERENCE:
                out.add(((ReferenceNode) node).getAddress());
                break;
            case RANGE:
                out.addAll(((RangeNode) node).cells());
                break;
            case UNARY_OP:
                collect(((UnaryOpNode) node).getOperand(), out);
                break;
            case BINARY_OP:
                collect(((BinaryOpNode) node).getLeft(), out);
                collect(((BinaryOpNode) node).getRight(), out);
                break;
            case CALL:
                for (ExprNode argument : ((CallNode) node).getArguments()) {
                    collect(argument, out);
                }
                break;
            default:
                throw new IllegalStateException("Unhandled node kind " + node.getKind());
        }
    }
}
