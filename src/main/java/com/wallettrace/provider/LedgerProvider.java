package com.wallettrace.provider;

import com.wallettrace.domain.Transfer;
import com.wallettrace.domain.WalletHistory;

import java.util.List;
import java.util.Optional;

/**
 * Source of on-chain transfers for the tracked tokens (USDC and USDC.e on Polygon).
 * Implementations own their HTTP client, timeouts and retries; a failure is reported by throwing
 * (conventionally {@link ProviderException}).
 */
public interface LedgerProvider {

    /**
     * Transfers received by {@code address}, ascending by timestamp, addresses lower-cased,
     * amounts scaled by the token's decimals.
     */
    List<Transfer> incomingTransfers(String address);

    /**
     * Transfers sent by {@code address}, same ordering and normalization as {@link #incomingTransfers}.
     */
    List<Transfer> outgoingTransfers(String address);

    /**
     * Prior transaction history of {@code address}. Empty when the provider cannot tell.
     */
    default Optional<WalletHistory> walletHistory(String address) {
        return Optional.empty();
    }
}
