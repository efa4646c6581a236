package com.wallettrace.tracing.sibling;

import com.wallettrace.config.TraceEngineConfig;
import com.wallettrace.domain.AddressCategory;
import com.wallettrace.domain.SiblingCandidate;
import com.wallettrace.domain.Transfer;
import com.wallettrace.provider.LedgerProvider;
import com.wallettrace.provider.MembershipOracle;
import com.wallettrace.registry.AddressRegistry;
import com.wallettrace.tracing.lookup.BoundedLookupExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds other platform members paid by the target's funders. Bridges and protocol contracts are skipped as
 * funders because they pay nearly everyone.
 */
@Component
@Slf4j
public class SiblingDetector {

    private final LedgerProvider ledgerProvider;
    private final MembershipOracle membershipOracle;
    private final AddressRegistry addressRegistry;
    private final BoundedLookupExecutor membershipLookup;

    public SiblingDetector(LedgerProvider ledgerProvider,
                           MembershipOracle membershipOracle,
                           AddressRegistry addressRegistry,
                           @Qualifier(TraceEngineConfig.MEMBERSHIP_LOOKUP) BoundedLookupExecutor membershipLookup) {
        this.ledgerProvider = ledgerProvider;
        this.membershipOracle = membershipOracle;
        this.addressRegistry = addressRegistry;
        this.membershipLookup = membershipLookup;
    }

    /**
     * Members among the first {@code cap} candidates, in discovery order.
     */
    public SiblingSearch findSiblings(List<String> funders, String target, int cap) {
        List<SiblingCandidate> candidates = collectCandidates(funders, target);
        List<SiblingCandidate> checked = candidates.subList(0, Math.min(Math.max(0, cap), candidates.size()));
        if (candidates.size() > checked.size()) {
            log.debug("Sibling candidates for {} capped at {} of {}", target, checked.size(), candidates.size());
        }

        Map<String, Boolean> membership = membershipLookup.lookupAll(
                checked.stream().map(SiblingCandidate::getAddress).toList(),
                membershipOracle::isMember);

        List<SiblingCandidate> members = new ArrayList<>();
        for (SiblingCandidate candidate : checked) {
            candidate.setMember(membership.get(candidate.getAddress()));
            if (candidate.isMember()) {
                members.add(candidate);
            }
        }
        log.info("Sibling check for {}: {} candidate(s) checked, {} member(s)", target, checked.size(), members.size());
        return new SiblingSearch(members, checked.size());
    }

    /**
     * Merges the recipients of every eligible funder into one candidate per address, in discovery order.
     * A funder whose outgoing lookup fails contributes nothing.
     */
    public List<SiblingCandidate> collectCandidates(List<String> funders, String target) {
        Map<String, SiblingCandidate> byAddress = new LinkedHashMap<>();
        for (String funder : funders) {
            AddressCategory category = addressRegistry.classify(funder).category();
            if (category == AddressCategory.BRIDGE || category == AddressCategory.PROTOCOL) {
                continue;
            }
            List<Transfer> outgoing;
            try {
                outgoing = ledgerProvider.outgoingTransfers(funder);
            } catch (RuntimeException e) {
                log.warn("Outgoing lookup failed for funder {}: {}", funder, e.getMessage());
                continue;
            }

            Map<String, List<Transfer>> byRecipient = new LinkedHashMap<>();
            for (Transfer t : outgoing) {
                String recipient = t.to();
                if (!funder.equals(t.from()) || recipient.equals(target) || recipient.equals(funder)) {
                    continue;
                }
                if (addressRegistry.isProtocolContract(recipient)) {
                    continue;
                }
                byRecipient.computeIfAbsent(recipient, k -> new ArrayList<>()).add(t);
            }
            byRecipient.forEach((recipient, transfers) ->
                    byAddress.computeIfAbsent(recipient, SiblingCandidate::new).merge(funder, transfers));
        }
        return new ArrayList<>(byAddress.values());
    }
}
