package com.pseudocode.transpiler.model;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code target = value}
 */
@Value
public class AssignmentNode implements Statement {
    @NonNull
    LeftSide target;
    @NonNull
    Expression value;

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
