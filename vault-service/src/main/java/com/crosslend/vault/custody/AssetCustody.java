package com.crosslend.vault.custody;

import java.math.BigInteger;

/**
 * Token balances on this chain. The vault's own holdings are the balance of its custody account.
 */
public interface AssetCustody {

    BigInteger balanceOf(String asset, String account);

    /**
     * @throws com.crosslend.core.error.LendingException InsufficientBalance when {@code from} is short
     */
    void transfer(String asset, String from, String to, BigInteger amount);

    /**
     * Credits funds arriving from outside this chain (bridge releases, faucet in PAPER mode).
     */
    void mint(String asset, String to, BigInteger amount);

    /**
     * Debits funds leaving this chain.
     */
    void burn(String asset, String from, BigInteger amount);

    CustodySnapshot snapshot();

    void restore(CustodySnapshot snapshot);
}
