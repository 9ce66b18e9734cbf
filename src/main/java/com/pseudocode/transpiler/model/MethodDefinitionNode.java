package com.pseudocode.transpiler.model;

import java.util.List;

import com.pseudocode.transpiler.parser.token.MethodName;
import com.pseudocode.transpiler.parser.token.VariableName;

import lombok.NonNull;
import lombok.Value;

@Value
public class MethodDefinitionNode implements Statement {
    MethodName methodName;
    List<VariableName> parameters;
    List<Statement> body;

    public MethodDefinitionNode(@NonNull MethodName methodName, List<VariableName> parameters,
                                List<Statement> body) {
        this.methodName = methodName;
        this.parameters = List.copyOf(parameters);
        this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(AstNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
