package com.lognog.query.parser;

import com.lognog.query.ast.Pipeline;
import com.lognog.query.expr.ExpressionParser;
import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.lexer.Token;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Recursive-descent parser from tokens to a {@link Pipeline}.
 *
 * Stops at the first grammar violation with a {@link ParseException}
 * carrying the offending token's position; there is no error recovery.
 */
@Component
public class DslParser {

    private final ExpressionParser expressionParser;

    public DslParser(FunctionRegistry functionRegistry) {
        this.expressionParser = new ExpressionParser(functionRegistry);
    }

    public Pipeline parse(List<Token> tokens) {
        return new PipelineParser(new TokenCursor(tokens), expressionParser).parse();
    }
}
