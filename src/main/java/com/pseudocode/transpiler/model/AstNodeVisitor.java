package com.pseudocode.transpiler.model;

/**
 * Visitor pattern interface for traversing the syntax tree.
 */
public interface AstNodeVisitor<R> {
    R visit(ValueNode value);
    R visit(ArrayLiteralNode arrayLiteral);
    R visit(UnaryOperationNode unaryOperation);
    R visit(BinaryOperationNode binaryOperation);
    R visit(ArrayAccessNode arrayAccess);
    R visit(MethodCallNode methodCall);
    R visit(OutputNode output);
    R visit(InputNode input);
    R visit(IfNode ifNode);
    R visit(LoopWhileNode loopWhile);
    R visit(LoopUntilNode loopUntil);
    R visit(LoopRangeNode loopRange);
    R visit(MethodDefinitionNode methodDefinition);
    R visit(AssignmentNode assignment);
}
