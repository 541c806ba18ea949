package com.lognog.query.parser;

import com.lognog.query.CompileException;
import com.lognog.query.CompilePhase;

/**
 * Grammar violation. Reported with the offending token's position and a hint
 * of what was expected there.
 */
public class ParseException extends CompileException {

    public ParseException(String reason) {
        super(CompilePhase.PARSE, reason);
    }

    public ParseException(String reason, Integer position) {
        super(CompilePhase.PARSE, reason, position);
    }
}
