package com.wallettrace.tracing.outbound;

import com.wallettrace.config.AddressRegistryProperties;
import com.wallettrace.config.LookupProperties;
import com.wallettrace.config.TraceProperties;
import com.wallettrace.domain.FundedAccount;
import com.wallettrace.provider.LedgerProvider;
import com.wallettrace.provider.MembershipOracle;
import com.wallettrace.provider.ProviderException;
import com.wallettrace.registry.DefaultAddressRegistry;
import com.wallettrace.tracing.graph.FundingGraphBuilder;
import com.wallettrace.tracing.lookup.BoundedLookupExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

import static com.wallettrace.TransferFixtures.addr;
import static com.wallettrace.TransferFixtures.transfer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboundAnalyzerTest {

    private static final String TARGET = addr('a');
    private static final BigDecimal DUST = new BigDecimal("10");

    @Mock
    private LedgerProvider ledgerProvider;
    @Mock
    private MembershipOracle membershipOracle;

    private OutboundAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        DefaultAddressRegistry registry = new DefaultAddressRegistry(new AddressRegistryProperties());
        FundingGraphBuilder graphBuilder = new FundingGraphBuilder(registry, ledgerProvider, new TraceProperties(),
                Clock.systemUTC());
        BoundedLookupExecutor lookup = BoundedLookupExecutor.create("membership", Runnable::run,
                new LookupProperties.Pool(5, 1));
        analyzer = new OutboundAnalyzer(ledgerProvider, membershipOracle, graphBuilder, lookup);
    }

    @Test
    @DisplayName("recipients sorted by total sent, dust dropped, members flagged")
    void fundedAccounts() {
        when(ledgerProvider.outgoingTransfers(TARGET)).thenReturn(List.of(
                transfer(TARGET, addr('b'), "100", 1),
                transfer(TARGET, addr('c'), "700", 2),
                transfer(TARGET, addr('d'), "5", 3),
                transfer(TARGET, addr('b'), "150", 4)));
        when(membershipOracle.isMember(addr('c'))).thenReturn(true);
        when(membershipOracle.isMember(addr('b'))).thenReturn(false);

        List<FundedAccount> funded = analyzer.findFunded(TARGET, DUST, 20);

        assertThat(funded).extracting(FundedAccount::address).containsExactly(addr('c'), addr('b'));
        assertThat(funded.get(0).isMember()).isTrue();
        assertThat(funded.get(1).member()).isFalse();
        assertThat(funded.get(1).totalSent()).isEqualByComparingTo("250");
        assertThat(funded.get(1).transferCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("membership is checked only for the largest recipients up to the cap")
    void capAppliesAfterSorting() {
        when(ledgerProvider.outgoingTransfers(TARGET)).thenReturn(List.of(
                transfer(TARGET, addr('b'), "20", 1),
                transfer(TARGET, addr('c'), "900", 2),
                transfer(TARGET, addr('d'), "300", 3)));
        when(membershipOracle.isMember(addr('c'))).thenReturn(true);

        List<FundedAccount> funded = analyzer.findFunded(TARGET, DUST, 1);

        assertThat(funded).hasSize(3);
        assertThat(funded.get(0).member()).isTrue();
        assertThat(funded.get(1).member()).isNull();
        assertThat(funded.get(2).member()).isNull();
        verify(membershipOracle, never()).isMember(addr('b'));
    }

    @Test
    @DisplayName("outgoing lookup failure yields an empty list")
    void lookupFailure() {
        when(ledgerProvider.outgoingTransfers(TARGET)).thenThrow(new ProviderException("HTTP 500"));

        assertThat(analyzer.findFunded(TARGET, DUST, 20)).isEmpty();
        verify(membershipOracle, never()).isMember(anyString());
    }
}
