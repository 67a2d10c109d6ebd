package ai.svcs.analyzer;

/** Construct kinds recorded, in source order, in a node's control-flow fingerprint. */
public enum ControlFlowKind {
    LOOP,
    CONDITIONAL,
    SWITCH,
    TRY,
    CONTEXT_MANAGER
}
