package com.lognog.query.ast;

/**
 * {@code limit}, {@code head} (same meaning) or {@code tail} (last rows).
 */
public final class LimitStage extends AbstractStage {

    public static final int DEFAULT_COUNT = 10;

    public enum Kind {
        LIMIT("limit"),
        HEAD("head"),
        TAIL("tail");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final Kind kind;
    private final long count;

    public LimitStage(Kind kind, long count, int position) {
        super(position);
        if (count <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + count);
        }
        this.kind = kind;
        this.count = count;
    }

    public Kind getKind() {
        return kind;
    }

    public long getCount() {
        return count;
    }

    public boolean isTail() {
        return kind == Kind.TAIL;
    }

    @Override
    public String getCommand() {
        return kind.getKeyword();
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitLimit(this);
    }
}
