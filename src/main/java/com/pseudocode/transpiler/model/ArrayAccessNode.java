package com.pseudocode.transpiler.model;

import com.pseudocode.transpiler.parser.token.VariableName;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code NAME[index]}
 */
@Value
public class ArrayAccessNode implements LeftSide {
    @NonNull
    VariableName arrayName;
    @NonNull
    Expression index;

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
