package com.arbor.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.arbor.tree.Leaf;

import java.util.List;

/**
 * Result of evaluating a decision tree.
 * Serializes as {@code {"decision", "reason", "path_taken"}}.
 *
 * @param decision  Decision label, or {@value #ERROR_DECISION}
 * @param reason    Justification, or the reason the evaluation could not finish
 * @param pathTaken One entry per check performed, in order
 */
public record EvaluationResult(
        @JsonProperty("decision") String decision,
        @JsonProperty("reason") String reason,
        @JsonProperty("path_taken") List<String> pathTaken
) {
    public static final String ERROR_DECISION = "Error";

    public EvaluationResult {
        pathTaken = pathTaken == null ? List.of() : List.copyOf(pathTaken);
    }

    /**
     * Create a result for a reached leaf.
     */
    public static EvaluationResult decided(Leaf leaf, List<String> pathTaken) {
        return new EvaluationResult(leaf.decision(), leaf.reason(), pathTaken);
    }

    /**
     * Create a result for an evaluation stopped by the supplied inputs.
     */
    public static EvaluationResult error(String reason, List<String> pathTaken) {
        return new EvaluationResult(ERROR_DECISION, reason, pathTaken);
    }

    /**
     * Check if the inputs could not carry the evaluation to a leaf.
     * Callers treat this as a cue to ask for clarification.
     */
    @JsonIgnore
    public boolean isError() {
        return ERROR_DECISION.equals(decision);
    }
}
