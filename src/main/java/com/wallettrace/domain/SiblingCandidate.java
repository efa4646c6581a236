package com.wallettrace.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Another address paid by one or more of the target's funders. Accumulated with insert-or-merge while the
 * funders' outgoing transfers are scanned; {@code member} stays null until membership is resolved.
 */
@Getter
public class SiblingCandidate {

    private final String address;
    private BigDecimal totalReceived = BigDecimal.ZERO;
    private final Set<String> sharedFunders = new LinkedHashSet<>();
    @JsonIgnore
    private final List<Transfer> transfers = new ArrayList<>();
    @Setter
    private Boolean member;

    public SiblingCandidate(String address) {
        this.address = address;
    }

    /** Merges one funder's transfers to this candidate. */
    public void merge(String funder, List<Transfer> funderTransfers) {
        sharedFunders.add(funder);
        for (Transfer t : funderTransfers) {
            transfers.add(t);
            totalReceived = totalReceived.add(t.amount());
        }
    }

    public Set<String> getSharedFunders() {
        return Collections.unmodifiableSet(sharedFunders);
    }

    public List<Transfer> getTransfers() {
        return Collections.unmodifiableList(transfers);
    }

    @JsonIgnore
    public boolean isMember() {
        return Boolean.TRUE.equals(member);
    }
}
