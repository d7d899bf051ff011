package com.arbor.engine;

import com.arbor.exception.AuthoringException;
import com.arbor.input.ResolvedInput;
import com.arbor.operator.DefaultOperatorRegistry;
import com.arbor.tree.Branch;
import com.arbor.tree.BranchKeyClassifier;
import com.arbor.tree.IntRange;
import com.arbor.tree.Leaf;
import com.arbor.tree.PredicateKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BranchMatcherTest {

    private BranchMatcher matcher;
    private Trace trace;

    @BeforeEach
    void setUp() {
        matcher = new BranchMatcher(new DefaultOperatorRegistry());
        trace = new Trace();
    }

    private static Branch branch(Object rawKey, String leaf) {
        return new Branch(BranchKeyClassifier.classify(rawKey), Leaf.parse(leaf));
    }

    private static ResolvedInput input(String name, Object value) {
        return new ResolvedInput(name, name.replace('_', ' '), value);
    }

    @Test
    @DisplayName("Stops at the first accepting branch")
    void stopsAtFirstMatch() {
        List<Branch> branches = List.of(
                branch(List.of("<", 10), "Low"),
                branch(List.of("<", 100), "Medium"),
                branch(List.of("<", 1000), "High"));

        BranchMatch match = matcher.match(branches, input("level", 50), trace);

        assertTrue(match.isMatched());
        assertEquals(2, match.branchIndex());
        assertEquals("Medium", ((Leaf) match.branch().target()).decision());
        assertEquals(List.of(
                "Checked level: 50 < 10 -> no match",
                "Checked level: 50 < 100 -> matched"), trace.entries());
    }

    @Test
    @DisplayName("Reports no match after trying every branch")
    void noMatch() {
        List<Branch> branches = List.of(branch("US", "Domestic"), branch("Canada", "Neighbour"));

        BranchMatch match = matcher.match(branches, input("country", "France"), trace);

        assertFalse(match.isMatched());
        assertTrue(match.selected().isEmpty());
        assertEquals(0, match.branchIndex());
        assertEquals(List.of(
                "Checked country: 'France' == 'US' -> no match",
                "Checked country: 'France' == 'Canada' -> no match"), trace.entries());
    }

    @Test
    @DisplayName("Renders membership references in trace entries")
    void rendersMembershipReferences() {
        matcher.match(List.of(branch(List.of("in", List.of("US", "Canada")), "Domestic")),
                input("country", "US"), trace);
        matcher.match(List.of(branch(List.of("in", IntRange.of(130, 140)), "Stage 1")),
                input("systolic_blood_pressure", 135), trace);

        assertEquals(List.of(
                "Checked country: 'US' in ['US', 'Canada'] -> matched",
                "Checked systolic blood pressure: 135 in [130..140) -> matched"), trace.entries());
    }

    @Test
    @DisplayName("Predicate entries name the predicate instead of a comparison")
    void predicateEntries() {
        matcher.match(List.of(new Branch(PredicateKey.of("positive", v -> ((Integer) v) > 0), Leaf.parse("Yes"))),
                input("x", 4), trace);

        assertEquals(List.of("Checked x: predicate positive -> matched"), trace.entries());
    }

    @Test
    @DisplayName("Unknown operator symbols raise when the branch is tried")
    void unknownOperator() {
        List<Branch> branches = List.of(branch(List.of("~=", 1), "Close"));

        AuthoringException ex = assertThrows(AuthoringException.class,
                () -> matcher.match(branches, input("x", 1), trace));
        assertTrue(ex.getMessage().contains("~="));
    }

    @Test
    @DisplayName("Incomparable values propagate the operator's exception")
    void incomparableValues() {
        List<Branch> branches = List.of(branch(List.of("<", 640), "Low"));

        assertThrows(IllegalArgumentException.class,
                () -> matcher.match(branches, input("credit_score", List.of(1)), trace));
    }
}
