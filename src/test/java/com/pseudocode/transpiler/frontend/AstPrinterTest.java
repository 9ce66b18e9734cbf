package com.pseudocode.transpiler.frontend;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.pseudocode.transpiler.model.Statement;
import com.pseudocode.transpiler.model.UnaryOperationNode;
import com.pseudocode.transpiler.model.ValueNode;
import com.pseudocode.transpiler.parser.token.DefinedToken;
import com.pseudocode.transpiler.parser.token.StringLiteral;

import static org.assertj.core.api.Assertions.*;

class AstPrinterTest {

    @Test
    void testPrintAssignment() {
        assertThat(print("A[1] = 2 * B")).isEqualTo("""
                Assignment
                  ArrayAccess A
                    Value 1
                  BinaryOperation *
                    Value 2
                    Value B
                """);
    }

    @Test
    void testPrintIfChain() {
        String source = """
                if A then
                    output "yes"
                else
                    input B
                end if
                """;

        assertThat(print(source)).isEqualTo("""
                If
                  Condition
                    Value A
                  Then
                    Output
                      Value "yes"
                  Condition
                    Value true
                  Then
                    Input B
                """);
    }

    @Test
    void testPrintLoopsAndMethods() {
        String source = """
                method show(X)
                    loop I from 1 to X
                        output I
                    end loop
                    loop while NOT DONE
                        DONE = check(I)
                    end loop
                end method
                """;

        assertThat(print(source)).isEqualTo("""
                MethodDefinition show(X)
                  LoopRange I
                    From
                      Value 1
                    To
                      Value X
                    Body
                      Output
                        Value I
                  LoopWhile
                    Condition
                      UnaryOperation NOT
                        Value DONE
                    Body
                      Assignment
                        Value DONE
                        MethodCall check
                          Value I
                """);
    }

    @Test
    void testPrintSingleNode() {
        String printed = new AstPrinter().print(
                new UnaryOperationNode(DefinedToken.MINUS, new ValueNode(new StringLiteral("x"))));

        assertThat(printed).isEqualTo("UnaryOperation -\n  Value \"x\"\n");
    }

    @Test
    void testPrinterCanBeReused() {
        AstPrinter printer = new AstPrinter();
        List<Statement> program = parse("A = []");

        assertThat(printer.print(program)).isEqualTo(printer.print(program));
        assertThat(printer.print(program)).isEqualTo("Assignment\n  Value A\n  ArrayLiteral\n");
    }

    private String print(String source) {
        return new AstPrinter().print(parse(source));
    }

    private List<Statement> parse(String source) {
        FrontEndResult result = new PseudocodeFrontEnd().parse(source);
        assertThat(result.isSuccess()).as("parsing %s", source).isTrue();
        return result.getStatements();
    }
}
