package com.wallettrace.registry;

import com.wallettrace.config.AddressRegistryProperties;
import com.wallettrace.domain.AddressCategory;
import com.wallettrace.domain.AddressInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-based registry of well-known Polygon addresses, extended or overridden by {@link AddressRegistryProperties}.
 */
@Component
@Slf4j
public class DefaultAddressRegistry implements AddressRegistry {

    private final Map<String, AddressInfo> infoByAddress = new ConcurrentHashMap<>();

    public DefaultAddressRegistry(AddressRegistryProperties properties) {
        if (properties.isBuiltInEntries()) {
            registerBuiltIns();
        }
        properties.getEntries().forEach((address, entry) -> {
            if (entry == null || entry.getCategory() == null) {
                return;
            }
            if (entry.getCategory() == AddressCategory.FRESH_WALLET) {
                throw new IllegalStateException("Registry entry " + address
                        + " cannot use category FRESH_WALLET; it is derived from wallet history");
            }
            register(address, entry.getCategory(), entry.getLabel());
        });
        log.debug("Address registry loaded with {} entries", infoByAddress.size());
    }

    @Override
    public AddressInfo classify(String address) {
        if (address == null || address.isBlank()) {
            return AddressInfo.unknown(address);
        }
        String key = normalize(address);
        AddressInfo info = infoByAddress.get(key);
        return info != null ? info : AddressInfo.unknown(key);
    }

    private void registerBuiltIns() {
        // Token contracts and platform settlement contracts: they pay out on trades and redemptions,
        // so nearly every platform user "receives" from them.
        register("0x3c499c542cEF5E3811e1192ce70d8cC03d5c3359", AddressCategory.PROTOCOL, "USDC (Polygon)");
        register("0x2791Bca1f2de4661ED88A30C99A7a9449Aa84174", AddressCategory.PROTOCOL, "USDC.e (Polygon)");
        register("0x4bFb41d5B3570DeFd03C39a9A4D8dE6Bd8B8982E", AddressCategory.PROTOCOL, "Polymarket CTF Exchange");
        register("0xC5d563A36AE78145C45a50134d48A1215220f80a", AddressCategory.PROTOCOL, "Polymarket Neg Risk CTF Exchange");
        register("0xd91E80cF2E7be2e162c6513ceD06f1dD0dA35296", AddressCategory.PROTOCOL, "Polymarket Neg Risk Adapter");
        register("0x4D97DCd97eC945f40cF65F87097ACe5EA0476045", AddressCategory.PROTOCOL, "Conditional Tokens");
        register("0x0000000000000000000000000000000000000000", AddressCategory.PROTOCOL, "Mint/Burn");

        // Bridges
        register("0x0000000000A39bb272e79075ade125fd351887Ac", AddressCategory.BRIDGE, "Relay.link");
        register("0xf70da97812CB96acDF810712Aa562db8dfA3dbEF", AddressCategory.BRIDGE, "Relay.link Executor");
        register("0x9295ee1d8C5b022Be115A2AD3c30C72E34e7F096", AddressCategory.BRIDGE, "Across SpokePool");
        register("0x1231DEB6f5749EF6cE6943a275A1D3E7486F4EaE", AddressCategory.BRIDGE, "LI.FI Diamond");

        // Centralized exchanges (hot wallets)
        register("0xF977814e90dA44bFA03b6295A0616a897441aceC", AddressCategory.EXCHANGE, "Binance");
        register("0xe7804c37c13166fF0b37F5aE0BB07A3aEbb6e245", AddressCategory.EXCHANGE, "Binance");
        register("0x21a31Ee1afC51d94C2eFcCAa2092aD1028285549", AddressCategory.EXCHANGE, "Binance");
        register("0xA9D1e08C7793af67e9d92fe308d5697FB81d3E43", AddressCategory.EXCHANGE, "Coinbase");
        register("0x2B5634C42055806a59e9107ED44D43c426E58258", AddressCategory.EXCHANGE, "KuCoin");
        register("0x0D0707963952f2fBA59dD06f2b425ace40b492Fe", AddressCategory.EXCHANGE, "Gate.io");
        register("0xf89d7b9c864f589bbF53a82105107622B35EaA40", AddressCategory.EXCHANGE, "Bybit");

        // Swap routers
        register("0x1111111254EEB25477B68fb85Ed929f73A960582", AddressCategory.SWAP, "1inch Router");
        register("0xDef1C0ded9bec7F1a1670819833240f027b25EfF", AddressCategory.SWAP, "0x Exchange Proxy");
        register("0xDEF171Fe48CF0115B1d80b88dc8eAB59176FEe57", AddressCategory.SWAP, "ParaSwap");
        register("0xec7BE89e9d109e7e3Fec59c222CF297125FEFda2", AddressCategory.SWAP, "Uniswap Universal Router");
    }

    private void register(String address, AddressCategory category, String label) {
        String key = normalize(address);
        infoByAddress.put(key, new AddressInfo(key, label, category));
    }

    private static String normalize(String address) {
        return address.strip().toLowerCase(Locale.ROOT);
    }
}
