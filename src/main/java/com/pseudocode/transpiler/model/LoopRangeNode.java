package com.pseudocode.transpiler.model;

import java.util.List;

import com.pseudocode.transpiler.parser.token.VariableName;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code loop I from start to end}
 */
@Value
public class LoopRangeNode implements Statement {
    VariableName loopVariable;
    Expression start;
    Expression end;
    List<Statement> body;

    public LoopRangeNode(@NonNull VariableName loopVariable, @NonNull Expression start, @NonNull Expression end,
                         List<Statement> body) {
        this.loopVariable = loopVariable;
        this.start = start;
        this.end = end;
        this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
