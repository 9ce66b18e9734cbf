package com.pseudocode.transpiler.model;

import com.pseudocode.transpiler.parser.token.DefinedToken;

import lombok.NonNull;
import lombok.Value;

@Value
public class BinaryOperationNode implements Expression {
    @NonNull
    DefinedToken operator;
    @NonNull
    Expression left;
    @NonNull
    Expression right;

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
