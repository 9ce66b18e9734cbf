package com.pseudocode.transpiler.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pseudocode.transpiler.model.ArrayAccessNode;
import com.pseudocode.transpiler.model.ArrayLiteralNode;
import com.pseudocode.transpiler.model.AssignmentNode;
import com.pseudocode.transpiler.model.BinaryOperationNode;
import com.pseudocode.transpiler.model.Expression;
import com.pseudocode.transpiler.model.IfBranch;
import com.pseudocode.transpiler.model.IfNode;
import com.pseudocode.transpiler.model.InputNode;
import com.pseudocode.transpiler.model.LeftSide;
import com.pseudocode.transpiler.model.LoopRangeNode;
import com.pseudocode.transpiler.model.LoopUntilNode;
import com.pseudocode.transpiler.model.LoopWhileNode;
import com.pseudocode.transpiler.model.MethodCallNode;
import com.pseudocode.transpiler.model.MethodDefinitionNode;
import com.pseudocode.transpiler.model.OutputNode;
import com.pseudocode.transpiler.model.Statement;
import com.pseudocode.transpiler.model.UnaryOperationNode;
import com.pseudocode.transpiler.model.ValueNode;
import com.pseudocode.transpiler.parser.token.DefinedToken;
import com.pseudocode.transpiler.parser.token.MethodName;
import com.pseudocode.transpiler.parser.token.PositionedToken;
import com.pseudocode.transpiler.parser.token.Token;
import com.pseudocode.transpiler.parser.token.ValueToken;
import com.pseudocode.transpiler.parser.token.VariableName;

/**
 * Recursive descent parser with backtracking.
 * Converts a token sequence into a list of statements.
 *
 * Every rule runs inside {@link #attempt(Rule)}: on failure the token index is put back where the
 * rule started, so the next alternative sees the same input. Choice points go through
 * {@link #firstOf(List)}, which tries its candidates in list order and keeps the first success.
 * The grammar is ambiguous enough that this order decides what is accepted.
 *
 * Binary expressions are built by precedence climbing; every precedence tier is left-associative.
 *
 * Operands and statement blocks may nest at most {@link #MAX_NESTING_DEPTH} levels deep. Deeper
 * input is rejected like any other syntax error.
 */
public class PseudocodeParser {
    private static final Logger log = LoggerFactory.getLogger(PseudocodeParser.class);

    /**
     * A grammar rule. Implementations may move the token index freely; {@link #attempt(Rule)} restores it.
     */
    @FunctionalInterface
    interface Rule<T> {
        ParseResult<? extends T> apply();
    }

    /**
     * Deepest allowed nesting of operands (parentheses, unary operators, array literals, indexes,
     * call arguments) and statement blocks, counted together.
     */
    public static final int MAX_NESTING_DEPTH = 256;

    private final List<PositionedToken> tokens;
    private int pos = 0;
    private int furthestFailure = 0;
    private int depth = 0;

    private final List<Rule<Statement>> statementRules;
    private final List<Rule<Expression>> operandRules;
    private final List<Rule<LeftSide>> leftSideRules;
    private final List<Rule<IfBranch>> elseRules;
    private final List<Rule<Statement>> loopRules;
    private final Map<DefinedToken, Rule<Statement>> commands = new EnumMap<>(DefinedToken.class);

    public PseudocodeParser(List<PositionedToken> tokens) {
        this.tokens = List.copyOf(tokens);

        this.statementRules = List.of(
                this::methodCall,
                this::command,
                this::assignment);

        this.operandRules = List.of(
                this::methodCall,
                this::arrayAccess,
                this::unaryOperation,
                this::arrayLiteral,
                this::value,
                this::parenthesized);

        this.leftSideRules = List.of(
                this::arrayAccess,
                this::variable);

        this.elseRules = List.of(
                this::elseIfBranch,
                this::elseBranch);

        this.loopRules = List.of(
                this::loopWhile,
                this::loopUntil,
                this::loopRange);

        commands.put(DefinedToken.OUTPUT, this::outputCommand);
        commands.put(DefinedToken.INPUT, this::inputCommand);
        commands.put(DefinedToken.IF, this::ifCommand);
        commands.put(DefinedToken.LOOP, this::loopCommand);
        commands.put(DefinedToken.METHOD, this::methodDefinition);
    }

    public PseudocodeParser(LexicalAnalysis lexicalAnalysis) {
        this(lexicalAnalysis.getTokens());
    }

    /**
     * Parse the whole token sequence as a statement sequence.
     *
     * @return the statements, or empty if the tokens are not a valid program
     */
    public Optional<List<Statement>> parse() {
        reset();
        ParseResult<List<Statement>> result = attempt(() -> {
            ParseResult<List<Statement>> statements = statements();
            if (!atEnd()) {
                return fail();
            }
            return statements;
        });

        if (result.isFailure()) {
            log.debug("Parse failed; furthest failure at token index {} of {}", furthestFailure, tokens.size());
        } else {
            log.debug("Parsed {} top-level statements", result.getValue().size());
        }
        return result.toOptional();
    }

    /**
     * Parse the whole token sequence as a single expression.
     */
    public Optional<Expression> parseExpression() {
        reset();
        ParseResult<Expression> result = attempt(() -> {
            ParseResult<Expression> expression = expression();
            if (expression.isFailure() || !atEnd()) {
                return fail();
            }
            return expression;
        });
        return result.toOptional();
    }

    /**
     * Index of the furthest token any rule failed at during the last parse. Only meaningful after a failed parse.
     */
    public int getFurthestFailureIndex() {
        return furthestFailure;
    }

    /**
     * The token at {@link #getFurthestFailureIndex()}, or empty when the failure was at end of input.
     */
    public Optional<PositionedToken> getFurthestFailureToken() {
        return furthestFailure < tokens.size() ? Optional.of(tokens.get(furthestFailure)) : Optional.empty();
    }

    // ------------------------------------------------------------------ combinators

    private <T> ParseResult<T> attempt(Rule<T> rule) {
        int start = pos;
        ParseResult<T> result = ParseResult.widen(rule.apply());
        if (result.isFailure()) {
            pos = start;
        }
        return result;
    }

    private <T> ParseResult<T> firstOf(List<Rule<T>> candidates) {
        for (Rule<T> candidate : candidates) {
            ParseResult<T> result = attempt(candidate);
            if (result.isSuccess()) {
                return result;
            }
        }
        return fail();
    }

    private <T> ParseResult<T> fail() {
        furthestFailure = Math.max(furthestFailure, pos);
        return ParseResult.failure();
    }

    // ------------------------------------------------------------------ statements

    /**
     * Zero or more statements, each terminated by one or more newlines (or by the end of input).
     * Leading newlines are skipped. Fails only when blocks nest deeper than {@link #MAX_NESTING_DEPTH}.
     */
    private ParseResult<List<Statement>> statements() {
        if (depth >= MAX_NESTING_DEPTH) {
            return fail();
        }
        depth++;
        try {
            return statementSequence();
        } finally {
            depth--;
        }
    }

    private ParseResult<List<Statement>> statementSequence() {
        List<Statement> statements = new ArrayList<>();
        skipNewlines();

        while (!atEnd()) {
            int start = pos;
            ParseResult<Statement> statement = firstOf(statementRules);
            if (statement.isFailure()) {
                break;
            }
            if (!atEnd() && !check(DefinedToken.NEWLINE)) {
                fail();
                pos = start;
                break;
            }
            statements.add(statement.getValue());
            skipNewlines();
        }
        return ParseResult.success(statements);
    }

    private ParseResult<Statement> command() {
        Token token = peek();
        if (!(token instanceof DefinedToken keyword) || !keyword.isCommandStart()) {
            return fail();
        }
        Rule<Statement> handler = commands.get(keyword);
        if (handler == null) {
            return fail();
        }
        advance();
        return attempt(handler);
    }

    private ParseResult<OutputNode> outputCommand() {
        return expressionList().map(OutputNode::new);
    }

    private ParseResult<InputNode> inputCommand() {
        return expect(VariableName.class).map(InputNode::new);
    }

    /**
     * {@code if cond then NEWLINE stmts (else (if cond then NEWLINE stmts | NEWLINE stmts))* end [if]}.
     * The leading {@code if} has been consumed by {@link #command()}.
     */
    private ParseResult<IfNode> ifCommand() {
        List<IfBranch> branches = new ArrayList<>();

        ParseResult<IfBranch> first = conditionalBranch();
        if (first.isFailure()) {
            return fail();
        }
        branches.add(first.getValue());

        while (true) {
            ParseResult<IfBranch> next = attempt(this::elseClause);
            if (next.isFailure()) {
                break;
            }
            branches.add(next.getValue());
        }

        if (!consume(DefinedToken.END)) {
            return fail();
        }
        accept(DefinedToken.IF);
        return ParseResult.success(new IfNode(branches));
    }

    private ParseResult<IfBranch> conditionalBranch() {
        ParseResult<Expression> condition = expression();
        if (condition.isFailure() || !consume(DefinedToken.THEN)) {
            return fail();
        }
        return block().map(body -> new IfBranch(condition.getValue(), body));
    }

    private ParseResult<IfBranch> elseClause() {
        if (!consume(DefinedToken.ELSE)) {
            return fail();
        }
        return firstOf(elseRules);
    }

    private ParseResult<IfBranch> elseIfBranch() {
        if (!consume(DefinedToken.IF)) {
            return fail();
        }
        return conditionalBranch();
    }

    private ParseResult<IfBranch> elseBranch() {
        return block().map(body -> new IfBranch(ValueNode.alwaysTrue(), body));
    }

    /**
     * {@code loop (while cond | until cond | VAR from expr to expr) NEWLINE stmts end [loop]}.
     */
    private ParseResult<Statement> loopCommand() {
        ParseResult<Statement> loop = firstOf(loopRules);
        if (loop.isFailure() || !consume(DefinedToken.END)) {
            return fail();
        }
        accept(DefinedToken.LOOP);
        return loop;
    }

    private ParseResult<LoopWhileNode> loopWhile() {
        if (!consume(DefinedToken.WHILE)) {
            return fail();
        }
        ParseResult<Expression> condition = expression();
        if (condition.isFailure()) {
            return fail();
        }
        return block().map(body -> new LoopWhileNode(condition.getValue(), body));
    }

    private ParseResult<LoopUntilNode> loopUntil() {
        if (!consume(DefinedToken.UNTIL)) {
            return fail();
        }
        ParseResult<Expression> condition = expression();
        if (condition.isFailure()) {
            return fail();
        }
        return block().map(body -> new LoopUntilNode(condition.getValue(), body));
    }

    private ParseResult<LoopRangeNode> loopRange() {
        ParseResult<VariableName> variable = expect(VariableName.class);
        if (variable.isFailure() || !consume(DefinedToken.FROM)) {
            return fail();
        }
        ParseResult<Expression> start = expression();
        if (start.isFailure() || !consume(DefinedToken.TO)) {
            return fail();
        }
        ParseResult<Expression> end = expression();
        if (end.isFailure()) {
            return fail();
        }
        return block().map(body -> new LoopRangeNode(variable.getValue(), start.getValue(), end.getValue(), body));
    }

    /**
     * {@code method name(PARAM, ...) NEWLINE stmts end [method]}.
     */
    private ParseResult<MethodDefinitionNode> methodDefinition() {
        ParseResult<MethodName> name = expect(MethodName.class);
        if (name.isFailure() || !consume(DefinedToken.LEFT_PAREN)) {
            return fail();
        }
        List<VariableName> parameters = parameterList();
        if (!consume(DefinedToken.RIGHT_PAREN)) {
            return fail();
        }
        ParseResult<List<Statement>> body = block();
        if (body.isFailure() || !consume(DefinedToken.END)) {
            return fail();
        }
        accept(DefinedToken.METHOD);
        return ParseResult.success(new MethodDefinitionNode(name.getValue(), parameters, body.getValue()));
    }

    /**
     * {@code NEWLINE stmts}: the body of a block command.
     */
    private ParseResult<List<Statement>> block() {
        if (!consume(DefinedToken.NEWLINE)) {
            return fail();
        }
        return statements();
    }

    private ParseResult<AssignmentNode> assignment() {
        ParseResult<LeftSide> target = firstOf(leftSideRules);
        if (target.isFailure() || !consume(DefinedToken.EQUAL)) {
            return fail();
        }
        ParseResult<Expression> value = expression();
        if (value.isFailure()) {
            return fail();
        }
        return ParseResult.success(new AssignmentNode(target.getValue(), value.getValue()));
    }

    // ------------------------------------------------------------------ expressions

    /**
     * Precedence climbing over an operator stack and an operand stack. Before pushing an operator,
     * the top of the stacks is collapsed while the new operator does not bind strictly tighter than
     * the operator on top, which makes every tier left-associative.
     */
    private ParseResult<Expression> expression() {
        return attempt(() -> {
            ParseResult<Expression> first = operand();
            if (first.isFailure()) {
                return fail();
            }

            Deque<Expression> operands = new ArrayDeque<>();
            Deque<DefinedToken> operators = new ArrayDeque<>();
            operands.push(first.getValue());

            while (peek() instanceof DefinedToken operator && operator.isBinaryOperator()) {
                int beforeOperator = pos;
                advance();
                ParseResult<Expression> right = operand();
                if (right.isFailure()) {
                    // Leave the dangling operator for the caller to reject
                    pos = beforeOperator;
                    break;
                }
                while (!operators.isEmpty()
                        && OperatorPrecedence.of(operator) <= OperatorPrecedence.of(operators.peek())) {
                    collapse(operands, operators);
                }
                operators.push(operator);
                operands.push(right.getValue());
            }

            while (!operators.isEmpty()) {
                collapse(operands, operators);
            }
            return ParseResult.success(operands.pop());
        });
    }

    private static void collapse(Deque<Expression> operands, Deque<DefinedToken> operators) {
        Expression right = operands.pop();
        Expression left = operands.pop();
        operands.push(new BinaryOperationNode(operators.pop(), left, right));
    }

    private ParseResult<Expression> operand() {
        if (depth >= MAX_NESTING_DEPTH) {
            return fail();
        }
        depth++;
        try {
            return firstOf(operandRules);
        } finally {
            depth--;
        }
    }

    private ParseResult<MethodCallNode> methodCall() {
        ParseResult<MethodName> name = expect(MethodName.class);
        if (name.isFailure() || !consume(DefinedToken.LEFT_PAREN)) {
            return fail();
        }
        ParseResult<List<Expression>> arguments = expressionList();
        if (!consume(DefinedToken.RIGHT_PAREN)) {
            return fail();
        }
        return ParseResult.success(new MethodCallNode(name.getValue(), arguments.getValue()));
    }

    private ParseResult<ArrayAccessNode> arrayAccess() {
        ParseResult<VariableName> array = expect(VariableName.class);
        if (array.isFailure() || !consume(DefinedToken.LEFT_BRACKET)) {
            return fail();
        }
        ParseResult<Expression> index = expression();
        if (index.isFailure() || !consume(DefinedToken.RIGHT_BRACKET)) {
            return fail();
        }
        return ParseResult.success(new ArrayAccessNode(array.getValue(), index.getValue()));
    }

    /**
     * Only tokens classified as unary operators are accepted here; {@code * 2} is rejected at parse time.
     */
    private ParseResult<UnaryOperationNode> unaryOperation() {
        if (!(peek() instanceof DefinedToken operator) || !operator.isUnaryOperator()) {
            return fail();
        }
        advance();
        ParseResult<Expression> operand = operand();
        if (operand.isFailure()) {
            return fail();
        }
        return ParseResult.success(new UnaryOperationNode(operator, operand.getValue()));
    }

    private ParseResult<ArrayLiteralNode> arrayLiteral() {
        if (!consume(DefinedToken.LEFT_BRACKET)) {
            return fail();
        }
        ParseResult<List<Expression>> elements = expressionList();
        if (!consume(DefinedToken.RIGHT_BRACKET)) {
            return fail();
        }
        return elements.map(ArrayLiteralNode::new);
    }

    private ParseResult<ValueNode> value() {
        return expect(ValueToken.class).map(ValueNode::new);
    }

    private ParseResult<ValueNode> variable() {
        return expect(VariableName.class).map(ValueNode::new);
    }

    private ParseResult<Expression> parenthesized() {
        if (!consume(DefinedToken.LEFT_PAREN)) {
            return fail();
        }
        ParseResult<Expression> inner = expression();
        if (inner.isFailure() || !consume(DefinedToken.RIGHT_PAREN)) {
            return fail();
        }
        return inner;
    }

    /**
     * Zero or more comma separated expressions. A trailing comma is left unconsumed. Never fails.
     */
    private ParseResult<List<Expression>> expressionList() {
        List<Expression> expressions = new ArrayList<>();
        ParseResult<Expression> first = expression();
        if (first.isFailure()) {
            return ParseResult.success(expressions);
        }
        expressions.add(first.getValue());

        while (true) {
            int beforeComma = pos;
            if (!accept(DefinedToken.COMMA)) {
                break;
            }
            ParseResult<Expression> next = expression();
            if (next.isFailure()) {
                pos = beforeComma;
                break;
            }
            expressions.add(next.getValue());
        }
        return ParseResult.success(expressions);
    }

    /**
     * Zero or more comma separated variable names.
     */
    private List<VariableName> parameterList() {
        List<VariableName> parameters = new ArrayList<>();
        ParseResult<VariableName> first = expect(VariableName.class);
        if (first.isFailure()) {
            return parameters;
        }
        parameters.add(first.getValue());

        while (true) {
            int beforeComma = pos;
            if (!accept(DefinedToken.COMMA)) {
                break;
            }
            ParseResult<VariableName> next = expect(VariableName.class);
            if (next.isFailure()) {
                pos = beforeComma;
                break;
            }
            parameters.add(next.getValue());
        }
        return parameters;
    }

    // ------------------------------------------------------------------ token access

    private void reset() {
        pos = 0;
        furthestFailure = 0;
        depth = 0;
    }

    private boolean atEnd() {
        return pos >= tokens.size();
    }

    private Token peek() {
        return atEnd() ? null : tokens.get(pos).getToken();
    }

    private void advance() {
        if (!atEnd()) {
            pos++;
        }
    }

    private boolean check(DefinedToken expected) {
        return peek() == expected;
    }

    /**
     * Consumes {@code expected} if it is the next token.
     */
    private boolean accept(DefinedToken expected) {
        if (check(expected)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Like {@link #accept(DefinedToken)}, but a missing token counts as a failure of the current rule.
     */
    private boolean consume(DefinedToken expected) {
        if (accept(expected)) {
            return true;
        }
        fail();
        return false;
    }

    private <T extends Token> ParseResult<T> expect(Class<T> type) {
        Token token = peek();
        if (type.isInstance(token)) {
            advance();
            return ParseResult.success(type.cast(token));
        }
        return fail();
    }

    private void skipNewlines() {
        while (check(DefinedToken.NEWLINE)) {
            advance();
        }
    }
}
