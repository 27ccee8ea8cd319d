package com.bko.ensemble.orchestration.model;

public enum ResultKind {
    /** Produced by a designated instance from other instances' output. */
    SYNTHESIS,
    /** One participant's answer picked by vote, judging, similarity or routing. */
    SELECTION,
    /** A participant's answer returned as is. */
    DIRECT,
    /** One of several labelled outputs (audience level, parameter variation). */
    VARIANT
}
