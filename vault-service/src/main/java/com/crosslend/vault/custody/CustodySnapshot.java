package com.crosslend.vault.custody;

import java.math.BigInteger;
import java.util.Map;

/**
 * Frozen copy of every balance, keyed by asset then account.
 */
public record CustodySnapshot(Map<String, Map<String, BigInteger>> balances) {

    public CustodySnapshot {
        balances = Map.copyOf(balances);
    }
}
