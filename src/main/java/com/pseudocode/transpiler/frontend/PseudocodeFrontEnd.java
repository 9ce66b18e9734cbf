package com.pseudocode.transpiler.frontend;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pseudocode.transpiler.model.Statement;
import com.pseudocode.transpiler.parser.LexicalAnalysis;
import com.pseudocode.transpiler.parser.PseudocodeLexer;
import com.pseudocode.transpiler.parser.PseudocodeParser;
import com.pseudocode.transpiler.parser.token.PositionedToken;

/**
 * Runs the lexer and then the parser, turning their silent failure signals into diagnostics.
 * Bad input never throws.
 */
public class PseudocodeFrontEnd {
    private static final Logger log = LoggerFactory.getLogger(PseudocodeFrontEnd.class);

    private final FrontEndConfig config;

    public PseudocodeFrontEnd() {
        this(FrontEndConfig.defaults());
    }

    public PseudocodeFrontEnd(FrontEndConfig config) {
        this.config = config;
    }

    public FrontEndResult parse(String source) {
        FrontEndDiagnostics diagnostics = new FrontEndDiagnostics();

        LexicalAnalysis lexicalAnalysis = new PseudocodeLexer(source).tokenize();
        diagnostics.getWarnings().addAll(lexicalAnalysis.getWarnings());
        if (config.isTraceTokens()) {
            for (PositionedToken token : lexicalAnalysis.getTokens()) {
                log.debug("{} @ {}", token.getToken(), SourcePosition.of(source, token.getOffset()));
            }
        }

        if (!lexicalAnalysis.isSuccessful()) {
            SourcePosition position = SourcePosition.of(source, lexicalAnalysis.getFirstInvalidOffset());
            diagnostics.getErrors().add("Unrecognized input at " + position);
            return FrontEndResult.builder()
                    .lexicalAnalysis(lexicalAnalysis)
                    .diagnostics(diagnostics)
                    .build();
        }

        PseudocodeParser parser = new PseudocodeParser(lexicalAnalysis);
        Optional<List<Statement>> program = parser.parse();

        if (program.isEmpty()) {
            diagnostics.getErrors().add(describeSyntaxError(source, parser.getFurthestFailureToken()));
        } else if (config.isTraceAst()) {
            log.debug("Syntax tree:\n{}", new AstPrinter().print(program.get()));
        }

        return FrontEndResult.builder()
                .lexicalAnalysis(lexicalAnalysis)
                .statements(program.orElse(null))
                .diagnostics(diagnostics)
                .build();
    }

    private static String describeSyntaxError(String source, Optional<PositionedToken> failureToken) {
        if (failureToken.isEmpty()) {
            return "Syntax error at end of input";
        }
        PositionedToken token = failureToken.get();
        return "Syntax error at " + SourcePosition.of(source, token.getOffset())
                + " near '" + token.getToken().describe() + "'";
    }
}
