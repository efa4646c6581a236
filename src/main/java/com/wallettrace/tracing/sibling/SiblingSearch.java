package com.wallettrace.tracing.sibling;

import com.wallettrace.domain.SiblingCandidate;

import java.util.List;

/**
 * Outcome of one sibling search: the members found and how many candidates were sent to the oracle.
 */
public record SiblingSearch(List<SiblingCandidate> siblings, int candidatesChecked) {

    public static final SiblingSearch EMPTY = new SiblingSearch(List.of(), 0);

    public SiblingSearch {
        siblings = List.copyOf(siblings);
    }
}
