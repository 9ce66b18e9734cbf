package com.pseudocode.transpiler.model;

import java.util.List;

import com.pseudocode.transpiler.parser.token.MethodName;

import lombok.NonNull;
import lombok.Value;

/**
 * A method call. Valid both inside an expression and as a statement of its own.
 */
@Value
public class MethodCallNode implements Expression, Statement {
    MethodName methodName;
    List<Expression> arguments;

    public MethodCallNode(@NonNull MethodName methodName, List<Expression> arguments) {
        this.methodName = methodName;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
