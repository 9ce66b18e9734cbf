package com.pseudocode.transpiler.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

@Value
public class LoopWhileNode implements Statement {
    Expression condition;
    List<Statement> body;

    public LoopWhileNode(@NonNull Expression condition, List<Statement> body) {
        this.condition = condition;
        this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
