package io.docflow.core.execution.result;

/// Status of one recorded node outcome.
///
/// @see NodeOutcome
public enum OutcomeStatus {

    /// Node returned normally; its data is available to dependents.
    SUCCESS("success"),

    /// Node raised from its top-level execute call; the run halts.
    ERROR("error");

    private final String wireName;

    OutcomeStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
