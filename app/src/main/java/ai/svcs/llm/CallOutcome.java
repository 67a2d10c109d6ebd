package ai.svcs.llm;

/** Result of sending one prompt through the {@link ProviderChain}. */
public sealed interface CallOutcome {

    record Success(String provider, String reply) implements CallOutcome {}

    /** Every attempt that was made ran out of time. */
    record Timeout(String detail) implements CallOutcome {}

    record Failure(String detail) implements CallOutcome {}

    /** The shared call budget was spent before any attempt could be made. */
    record BudgetExhausted() implements CallOutcome {}

    /** The run was cancelled before a reply arrived. */
    record Cancelled() implements CallOutcome {}
}
