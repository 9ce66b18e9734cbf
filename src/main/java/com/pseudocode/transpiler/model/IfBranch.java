package com.pseudocode.transpiler.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * One condition/body pair of an {@link IfNode}.
 */
@Value
public class IfBranch {
    Expression condition;
    List<Statement> body;

    public IfBranch(@NonNull Expression condition, List<Statement> body) {
        this.condition = condition;
        this.body = List.copyOf(body);
    }
}
