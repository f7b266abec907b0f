package com.kmg.pageocr.model;

/**
 * Text artifact of one page as seen by an aggregation pass.
 */
public record PageText(int pageIndex, State state, String content, String detail) {

    public enum State {
        RECOGNIZED,
        MISSING,
        FAILURE_MARKED,
        UNREADABLE
    }

    public boolean usable() {
        return state == State.RECOGNIZED;
    }
}
