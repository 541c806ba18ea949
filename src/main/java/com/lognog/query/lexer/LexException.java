package com.lognog.query.lexer;

import com.lognog.query.CompileException;
import com.lognog.query.CompilePhase;

/**
 * Malformed token: unterminated string or illegal character.
 */
public class LexException extends CompileException {

    public LexException(String reason) {
        super(CompilePhase.LEX, reason);
    }

    public LexException(String reason, Integer position) {
        super(CompilePhase.LEX, reason, position);
    }
}
