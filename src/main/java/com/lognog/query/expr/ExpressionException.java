package com.lognog.query.expr;

import com.lognog.query.CompileException;
import com.lognog.query.CompilePhase;

/**
 * Unknown function, arity mismatch or argument type mismatch.
 */
public class ExpressionException extends CompileException {

    public ExpressionException(String reason) {
        super(CompilePhase.EXPR, reason);
    }

    public ExpressionException(String reason, Integer position) {
        super(CompilePhase.EXPR, reason, position);
    }
}
