package com.wallettrace.tracing.sibling;

import com.wallettrace.config.AddressRegistryProperties;
import com.wallettrace.config.LookupProperties;
import com.wallettrace.domain.SiblingCandidate;
import com.wallettrace.provider.LedgerProvider;
import com.wallettrace.provider.MembershipOracle;
import com.wallettrace.provider.ProviderException;
import com.wallettrace.registry.DefaultAddressRegistry;
import com.wallettrace.tracing.lookup.BoundedLookupExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.wallettrace.TransferFixtures.addr;
import static com.wallettrace.TransferFixtures.transfer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SiblingDetectorTest {

    private static final String TARGET = addr('a');
    private static final String B = addr('b');
    private static final String C = addr('c');
    private static final String X = addr('1');
    private static final String Y = addr('2');
    private static final String Z = addr('3');
    private static final String USDC = "0x3c499c542cef5e3811e1192ce70d8cc03d5c3359";
    private static final String RELAY = "0x0000000000a39bb272e79075ade125fd351887ac";

    @Mock
    private LedgerProvider ledgerProvider;
    @Mock
    private MembershipOracle membershipOracle;

    private SiblingDetector detector;

    @BeforeEach
    void setUp() {
        BoundedLookupExecutor lookup = BoundedLookupExecutor.create("membership", Runnable::run,
                new LookupProperties.Pool(5, 1));
        detector = new SiblingDetector(ledgerProvider, membershipOracle,
                new DefaultAddressRegistry(new AddressRegistryProperties()), lookup);
    }

    private void stubTwoFunders() {
        when(ledgerProvider.outgoingTransfers(B)).thenReturn(List.of(
                transfer(B, TARGET, "500", 1),
                transfer(B, X, "200", 2),
                transfer(B, Y, "300", 3)));
        when(ledgerProvider.outgoingTransfers(C)).thenReturn(List.of(
                transfer(C, TARGET, "500", 4),
                transfer(C, Y, "100", 5),
                transfer(C, Z, "50", 6)));
    }

    @Test
    @DisplayName("members paid by the target's funders are siblings; shared funders are merged")
    void findsSiblings() {
        stubTwoFunders();
        when(membershipOracle.isMember(X)).thenReturn(true);
        when(membershipOracle.isMember(Y)).thenReturn(true);
        when(membershipOracle.isMember(Z)).thenReturn(false);

        SiblingSearch search = detector.findSiblings(List.of(B, C), TARGET, 20);

        assertThat(search.candidatesChecked()).isEqualTo(3);
        assertThat(search.siblings()).extracting(SiblingCandidate::getAddress).containsExactly(X, Y);
        SiblingCandidate y = search.siblings().get(1);
        assertThat(y.getSharedFunders()).containsExactly(B, C);
        assertThat(y.getTotalReceived()).isEqualByComparingTo("400");
        assertThat(y.getTransfers()).hasSize(2);
    }

    @Test
    @DisplayName("both recipients of a shared funder are candidates; only the member is a sibling")
    void sharedFunderScenario() {
        when(ledgerProvider.outgoingTransfers(B)).thenReturn(List.of(
                transfer(B, TARGET, "200", 1),
                transfer(B, X, "5000", 2),
                transfer(B, Y, "5000", 3)));
        when(membershipOracle.isMember(X)).thenReturn(true);
        when(membershipOracle.isMember(Y)).thenReturn(false);

        List<SiblingCandidate> candidates = detector.collectCandidates(List.of(B), TARGET);
        SiblingSearch search = detector.findSiblings(List.of(B), TARGET, 20);

        assertThat(candidates).extracting(SiblingCandidate::getAddress).containsExactly(X, Y);
        assertThat(candidates).allSatisfy(c -> assertThat(c.getSharedFunders()).containsExactly(B));
        assertThat(search.siblings()).extracting(SiblingCandidate::getAddress).containsExactly(X);
    }

    @Test
    @DisplayName("target, funder itself and protocol contracts are never candidates")
    void exclusions() {
        when(ledgerProvider.outgoingTransfers(B)).thenReturn(List.of(
                transfer(B, TARGET, "500", 1),
                transfer(B, B, "10", 2),
                transfer(B, USDC, "1000", 3),
                transfer(C, X, "1000", 4),
                transfer(B, X, "20", 5)));

        List<SiblingCandidate> candidates = detector.collectCandidates(List.of(B), TARGET);

        assertThat(candidates).extracting(SiblingCandidate::getAddress).containsExactly(X);
        assertThat(candidates.get(0).getTotalReceived()).isEqualByComparingTo("20");
    }

    @Test
    @DisplayName("bridge and protocol funders are skipped without a lookup")
    void bridgeFunderSkipped() {
        List<SiblingCandidate> candidates = detector.collectCandidates(List.of(RELAY, USDC), TARGET);

        assertThat(candidates).isEmpty();
        verify(ledgerProvider, never()).outgoingTransfers(anyString());
    }

    @Test
    @DisplayName("only the first cap candidates in discovery order are checked")
    void capRespected() {
        stubTwoFunders();
        when(membershipOracle.isMember(X)).thenReturn(false);
        when(membershipOracle.isMember(Y)).thenReturn(true);

        SiblingSearch search = detector.findSiblings(List.of(B, C), TARGET, 2);

        assertThat(search.candidatesChecked()).isEqualTo(2);
        assertThat(search.siblings()).extracting(SiblingCandidate::getAddress).containsExactly(Y);
        verify(membershipOracle, never()).isMember(Z);
    }

    @Test
    @DisplayName("failing funder lookup contributes nothing; other funders still count")
    void funderFailureIsolated() {
        when(ledgerProvider.outgoingTransfers(B)).thenThrow(new ProviderException("HTTP 429"));
        when(ledgerProvider.outgoingTransfers(C)).thenReturn(List.of(transfer(C, Z, "50", 1)));
        when(membershipOracle.isMember(Z)).thenReturn(true);

        SiblingSearch search = detector.findSiblings(List.of(B, C), TARGET, 20);

        assertThat(search.siblings()).extracting(SiblingCandidate::getAddress).containsExactly(Z);
    }

    @Test
    @DisplayName("unresolved membership is not a sibling")
    void unresolvedMembership() {
        stubTwoFunders();
        when(membershipOracle.isMember(X)).thenThrow(new ProviderException("timeout"));
        when(membershipOracle.isMember(Y)).thenReturn(true);
        when(membershipOracle.isMember(Z)).thenReturn(false);

        SiblingSearch search = detector.findSiblings(List.of(B, C), TARGET, 20);

        assertThat(search.siblings()).extracting(SiblingCandidate::getAddress).containsExactly(Y);
        assertThat(search.candidatesChecked()).isEqualTo(3);
    }
}
