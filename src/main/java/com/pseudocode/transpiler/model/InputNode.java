package com.pseudocode.transpiler.model;

import com.pseudocode.transpiler.parser.token.VariableName;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code input NAME}
 */
@Value
public class InputNode implements Statement {
    @NonNull
    VariableName variableName;

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
