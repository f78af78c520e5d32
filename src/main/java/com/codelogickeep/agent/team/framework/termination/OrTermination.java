package com.codelogickeep.agent.team.framework.termination;

import com.codelogickeep.agent.team.framework.model.Transcript;

import java.util.Objects;
import java.util.Optional;

/**
 * True when either child is true. The right child is not evaluated once the left one holds.
 */
public final class OrTermination implements TerminationCondition {

    private final TerminationCondition left;
    private final TerminationCondition right;

    public OrTermination(TerminationCondition left, TerminationCondition right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public Optional<String> check(Transcript transcript) {
        Optional<String> reason = left.check(transcript);
        if (reason.isPresent()) {
            return reason;
        }
        return right.check(transcript);
    }

    @Override
    public String toString() {
        return "(" + left + " OR " + right + ")";
    }
}
