package com.pseudocode.transpiler.model;

import java.util.List;

import lombok.Value;

/**
 * {@code [a, b, c]}
 */
@Value
public class ArrayLiteralNode implements Expression {
    List<Expression> elements;

    public ArrayLiteralNode(List<Expression> elements) {
        this.elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
