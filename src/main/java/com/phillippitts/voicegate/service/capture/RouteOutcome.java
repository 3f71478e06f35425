package com.phillippitts.voicegate.service.capture;

/**
 * What the router did with one event.
 */
public enum RouteOutcome {
    /** Final transcript became a turn. */
    TURN_LOGGED(true),
    /** Start/end event folded into timing metadata. */
    TIMING_RECORDED(true),
    /** Partial transcript; superseded by the final one. */
    PARTIAL_IGNORED(true),
    /** Missing or invalid fields. */
    DROPPED_MALFORMED(false),
    /** Session already finalized. */
    DROPPED_CLOSED(false);

    private final boolean accepted;

    RouteOutcome(boolean accepted) {
        this.accepted = accepted;
    }

    public boolean accepted() {
        return accepted;
    }
}
