package com.lognog.query.ast;

abstract class AbstractStage implements Stage {

    private final int position;

    protected AbstractStage(int position) {
        this.position = position;
    }

    @Override
    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return getCommand() + "@" + position;
    }
}
