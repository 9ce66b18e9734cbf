package com.pseudocode.transpiler.model;

import com.pseudocode.transpiler.parser.token.BoolLiteral;
import com.pseudocode.transpiler.parser.token.ValueToken;
import com.pseudocode.transpiler.parser.token.VariableName;

import lombok.NonNull;
import lombok.Value;

/**
 * A literal or a variable reference.
 */
@Value
public class ValueNode implements LeftSide {
    @NonNull
    ValueToken value;

    /**
     * The condition stored for an {@code else} branch.
     */
    public static ValueNode alwaysTrue() {
        return new ValueNode(BoolLiteral.of(true));
    }

    public boolean isVariable() {
        return value instanceof VariableName;
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
