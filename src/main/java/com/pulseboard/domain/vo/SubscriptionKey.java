package com.pulseboard.domain.vo;

import java.util.Locale;
import java.util.Map;
import lombok.Value;

/**
 * Identity of a streamable pair: pair address, token address and numeric chain id.
 *
 * <p>The admission controller treats keys as opaque strings. This value object is the one
 * place where those strings are built, so that the panes, the detail view and the wire
 * layer agree on a single format:
 * <ul>
 *   <li>pair key: {@code pair|token|chain} (pair-stats updates)</li>
 *   <li>tick key: {@code token|chain} (price ticks)</li>
 * </ul>
 *
 * <p>Addresses are lower-cased. Chains are normalised to numeric ids: ETH, BSC, BASE and SOL
 * map to 1, 56, 8453 and 900; numeric strings pass through; anything else falls back to 1.
 */
@Value
public class SubscriptionKey {

    static final String SEPARATOR = "|";
    static final String DEFAULT_CHAIN_ID = "1";

    private static final Map<String, String> CHAIN_IDS = Map.of(
            "ETH", "1",
            "BSC", "56",
            "BASE", "8453",
            "SOL", "900");

    String pairAddress;
    String tokenAddress;
    String chainId;

    public static SubscriptionKey of(String pairAddress, String tokenAddress, String chain) {
        return new SubscriptionKey(
                pairAddress.toLowerCase(Locale.ROOT), tokenAddress.toLowerCase(Locale.ROOT), toChainId(chain));
    }

    /**
     * Parses a {@code pair|token|chain} key. Returns null if the string does not have
     * exactly three non-empty segments.
     */
    public static SubscriptionKey parse(String key) {
        if (key == null) {
            return null;
        }
        String[] parts = key.split("\\|", -1);
        if (parts.length != 3) {
            return null;
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                return null;
            }
        }
        return of(parts[0], parts[1], parts[2]);
    }

    public static String toChainId(String chain) {
        if (chain == null) {
            return DEFAULT_CHAIN_ID;
        }
        String normalized = chain.trim().toUpperCase(Locale.ROOT);
        String known = CHAIN_IDS.get(normalized);
        if (known != null) {
            return known;
        }
        try {
            return Long.toString(Long.parseLong(normalized));
        } catch (NumberFormatException e) {
            return DEFAULT_CHAIN_ID;
        }
    }

    public String pairKey() {
        return pairAddress + SEPARATOR + tokenAddress + SEPARATOR + chainId;
    }

    public String tickKey() {
        return tokenAddress + SEPARATOR + chainId;
    }

    @Override
    public String toString() {
        return pairKey();
    }
}
