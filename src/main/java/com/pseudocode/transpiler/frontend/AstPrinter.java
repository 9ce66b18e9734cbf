package com.pseudocode.transpiler.frontend;

import java.util.List;
import java.util.stream.Collectors;

import com.pseudocode.transpiler.model.ArrayAccessNode;
import com.pseudocode.transpiler.model.ArrayLiteralNode;
import com.pseudocode.transpiler.model.AssignmentNode;
import com.pseudocode.transpiler.model.AstNode;
import com.pseudocode.transpiler.model.AstNodeVisitor;
import com.pseudocode.transpiler.model.BinaryOperationNode;
import com.pseudocode.transpiler.model.IfBranch;
import com.pseudocode.transpiler.model.IfNode;
import com.pseudocode.transpiler.model.InputNode;
import com.pseudocode.transpiler.model.LoopRangeNode;
import com.pseudocode.transpiler.model.LoopUntilNode;
import com.pseudocode.transpiler.model.LoopWhileNode;
import com.pseudocode.transpiler.model.MethodCallNode;
import com.pseudocode.transpiler.model.MethodDefinitionNode;
import com.pseudocode.transpiler.model.OutputNode;
import com.pseudocode.transpiler.model.UnaryOperationNode;
import com.pseudocode.transpiler.model.ValueNode;
import com.pseudocode.transpiler.parser.token.VariableName;

/**
 * Renders a syntax tree as indented text, one node per line.
 * <pre>
 * Assignment
 *   ArrayAccess A
 *     Value 1
 *   Value 2
 * </pre>
 */
public class AstPrinter implements AstNodeVisitor<Void> {
    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    public String print(List<? extends AstNode> nodes) {
        out.setLength(0);
        depth = 0;
        nodes.forEach(this::child);
        return out.toString();
    }

    public String print(AstNode node) {
        return print(List.of(node));
    }

    @Override
    public Void visit(ValueNode value) {
        line("Value " + value.getValue().describe());
        return null;
    }

    @Override
    public Void visit(ArrayLiteralNode arrayLiteral) {
        line("ArrayLiteral");
        children(arrayLiteral.getElements());
        return null;
    }

    @Override
    public Void visit(UnaryOperationNode unaryOperation) {
        line("UnaryOperation " + unaryOperation.getOperator().describe());
        children(List.of(unaryOperation.getOperand()));
        return null;
    }

    @Override
    public Void visit(BinaryOperationNode binaryOperation) {
        line("BinaryOperation " + binaryOperation.getOperator().describe());
        children(List.of(binaryOperation.getLeft(), binaryOperation.getRight()));
        return null;
    }

    @Override
    public Void visit(ArrayAccessNode arrayAccess) {
        line("ArrayAccess " + arrayAccess.getArrayName().getName());
        children(List.of(arrayAccess.getIndex()));
        return null;
    }

    @Override
    public Void visit(MethodCallNode methodCall) {
        line("MethodCall " + methodCall.getMethodName().getName());
        children(methodCall.getArguments());
        return null;
    }

    @Override
    public Void visit(OutputNode output) {
        line("Output");
        children(output.getExpressions());
        return null;
    }

    @Override
    public Void visit(InputNode input) {
        line("Input " + input.getVariableName().getName());
        return null;
    }

    @Override
    public Void visit(IfNode ifNode) {
        line("If");
        depth++;
        for (IfBranch branch : ifNode.getBranches()) {
            section("Condition", List.of(branch.getCondition()));
            section("Then", branch.getBody());
        }
        depth--;
        return null;
    }

    @Override
    public Void visit(LoopWhileNode loopWhile) {
        line("LoopWhile");
        depth++;
        section("Condition", List.of(loopWhile.getCondition()));
        section("Body", loopWhile.getBody());
        depth--;
        return null;
    }

    @Override
    public Void visit(LoopUntilNode loopUntil) {
        line("LoopUntil");
        depth++;
        section("Condition", List.of(loopUntil.getCondition()));
        section("Body", loopUntil.getBody());
        depth--;
        return null;
    }

    @Override
    public Void visit(LoopRangeNode loopRange) {
        line("LoopRange " + loopRange.getLoopVariable().getName());
        depth++;
        section("From", List.of(loopRange.getStart()));
        section("To", List.of(loopRange.getEnd()));
        section("Body", loopRange.getBody());
        depth--;
        return null;
    }

    @Override
    public Void visit(MethodDefinitionNode methodDefinition) {
        String parameters = methodDefinition.getParameters().stream()
                .map(VariableName::getName)
                .collect(Collectors.joining(", "));
        line("MethodDefinition " + methodDefinition.getMethodName().getName() + "(" + parameters + ")");
        children(methodDefinition.getBody());
        return null;
    }

    @Override
    public Void visit(AssignmentNode assignment) {
        line("Assignment");
        children(List.of(assignment.getTarget(), assignment.getValue()));
        return null;
    }

    private void section(String label, List<? extends AstNode> nodes) {
        line(label);
        children(nodes);
    }

    private void children(List<? extends AstNode> nodes) {
        depth++;
        nodes.forEach(this::child);
        depth--;
    }

    private void child(AstNode node) {
        node.accept(this);
    }

    private void line(String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
