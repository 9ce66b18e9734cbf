package com.pseudocode.transpiler.model;

import java.util.List;

import lombok.Value;

/**
 * An {@code if / else if / else} chain.
 * <p>
 * Branches are kept in source order. An {@code else} is stored as a branch whose condition is
 * {@link ValueNode#alwaysTrue()}, so every branch can be handled the same way.
 */
@Value
public class IfNode implements Statement {
    List<IfBranch> branches;

    public IfNode(List<IfBranch> branches) {
        this.branches = List.copyOf(branches);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
