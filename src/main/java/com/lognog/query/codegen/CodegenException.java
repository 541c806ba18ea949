package com.lognog.query.codegen;

import com.lognog.query.CompileException;
import com.lognog.query.CompilePhase;

/**
 * Internal shape inconsistency or a construct the target dialect cannot express.
 */
public class CodegenException extends CompileException {

    public CodegenException(String reason) {
        super(CompilePhase.CODEGEN, reason);
    }

    public CodegenException(String reason, Integer position) {
        super(CompilePhase.CODEGEN, reason, position);
    }
}
