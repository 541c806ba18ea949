package com.lognog.query;

/**
 * Base exception for every compiler failure.
 * Carries the phase that failed and, when known, the character offset in the
 * query text. Compilation stops at the first one thrown.
 */
public class CompileException extends RuntimeException {

    private final CompilePhase stage;
    private final Integer position;
    private final String reason;

    public CompileException(CompilePhase stage, String reason) {
        this(stage, reason, null);
    }

    public CompileException(CompilePhase stage, String reason, Integer position) {
        super(reason);
        this.stage = stage;
        this.reason = reason;
        this.position = position;
    }

    public CompileException(CompilePhase stage, String reason, Integer position, Throwable cause) {
        super(reason, cause);
        this.stage = stage;
        this.reason = reason;
        this.position = position;
    }

    public CompilePhase getStage() {
        return stage;
    }

    /**
     * Character offset of the offending token, or null when the error is not
     * tied to a single token.
     */
    public Integer getPosition() {
        return position;
    }

    /**
     * The message without phase and position decoration.
     */
    public String getReason() {
        return reason;
    }

    public CompileError toError() {
        return new CompileError(stage, position, reason);
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        sb.append(" [Stage: ").append(stage.getValue()).append("]");
        if (position != null) {
            sb.append(" [Position: ").append(position).append("]");
        }
        return sb.toString();
    }
}
