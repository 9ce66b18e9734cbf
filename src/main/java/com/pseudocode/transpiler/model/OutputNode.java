package com.pseudocode.transpiler.model;

import java.util.List;

import lombok.Value;

/**
 * {@code output a, b, ...}
 */
@Value
public class OutputNode implements Statement {
    List<Expression> expressions;

    public OutputNode(List<Expression> expressions) {
        this.expressions = List.copyOf(expressions);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
