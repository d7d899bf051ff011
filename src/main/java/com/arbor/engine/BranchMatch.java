package com.arbor.engine;

import com.arbor.tree.Branch;

import java.util.Optional;

/**
 * Outcome of matching one question node's branches. An unmatched outcome is a normal
 * result, reported so the engine can turn it into an Error decision.
 *
 * @param branch      Selected branch, or null when nothing matched
 * @param branchIndex 1-based position of the selected branch, 0 when nothing matched
 */
public record BranchMatch(Branch branch, int branchIndex) {

    private static final BranchMatch NONE = new BranchMatch(null, 0);

    public static BranchMatch of(Branch branch, int branchIndex) {
        return new BranchMatch(branch, branchIndex);
    }

    public static BranchMatch none() {
        return NONE;
    }

    public boolean isMatched() {
        return branch != null;
    }

    public Optional<Branch> selected() {
        return Optional.ofNullable(branch);
    }
}
