package ai.svcs.llm;

/**
 * States of one interpretive-layer run:
 * {@code IDLE -> GATE_CHECK -> SKIP | INVOKE}, {@code INVOKE -> CALLING -> SUCCESS | TIMEOUT | ERROR | CANCELLED},
 * {@code SUCCESS -> PARSE_RESPONSE -> EMIT | DISCARD}, and every terminal state returns to {@code IDLE}.
 */
public enum GateState {
    IDLE,
    GATE_CHECK,
    SKIP,
    INVOKE,
    CALLING,
    SUCCESS,
    TIMEOUT,
    ERROR,
    CANCELLED,
    PARSE_RESPONSE,
    EMIT,
    DISCARD;

    /** Whether {@code next} is a legal successor of this state. */
    public boolean canMoveTo(GateState next) {
        return switch (this) {
            case IDLE -> next == GATE_CHECK;
            case GATE_CHECK -> next == SKIP || next == INVOKE;
            case INVOKE -> next == CALLING;
            case CALLING -> next == SUCCESS || next == TIMEOUT || next == ERROR || next == CANCELLED;
            case SUCCESS -> next == PARSE_RESPONSE;
            case PARSE_RESPONSE -> next == EMIT || next == DISCARD;
            case SKIP, TIMEOUT, ERROR, CANCELLED, EMIT, DISCARD -> next == IDLE;
        };
    }
}
