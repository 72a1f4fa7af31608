package com.spreadsheet.calc.formula;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A function call. The name is stored upper-case and is not checked
 * against the registry until evaluation.
 */
public final class CallNode extends ExprNode {
    private final String name;
    private final List<ExprNode> arguments;

    public CallNode(String name, List<ExprNode> arguments, int position) {
        super(position);
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CALL;
    }

    public String getName() {
        return name;
    }

    public List<ExprNode> getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
