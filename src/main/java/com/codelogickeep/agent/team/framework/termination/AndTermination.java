package com.codelogickeep.agent.team.framework.termination;

import com.codelogickeep.agent.team.framework.model.Transcript;

import java.util.Objects;
import java.util.Optional;

/**
 * True when both children are true. The right child is not evaluated while the left one is false.
 */
public final class AndTermination implements TerminationCondition {

    private final TerminationCondition left;
    private final TerminationCondition right;

    public AndTermination(TerminationCondition left, TerminationCondition right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public Optional<String> check(Transcript transcript) {
        Optional<String> leftReason = left.check(transcript);
        if (leftReason.isEmpty()) {
            return Optional.empty();
        }
        return right.check(transcript).map(rightReason -> leftReason.get() + "; " + rightReason);
    }

    @Override
    public String toString() {
        return "(" + left + " AND " + right + ")";
    }
}
