package com.lognog.query.resolve;

import com.lognog.query.CompileException;
import com.lognog.query.CompilePhase;

/**
 * Unknown field, invalid severity name or an illegal value coercion.
 */
public class ResolveException extends CompileException {

    public ResolveException(String reason) {
        super(CompilePhase.RESOLVE, reason);
    }

    public ResolveException(String reason, Integer position) {
        super(CompilePhase.RESOLVE, reason, position);
    }
}
