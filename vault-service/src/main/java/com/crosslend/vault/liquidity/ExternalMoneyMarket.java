package com.crosslend.vault.liquidity;

import java.math.BigInteger;

/**
 * A third-party lending pool the vault can borrow from on behalf of its users.
 */
public interface ExternalMoneyMarket {

    String name();

    String address();

    long chainId();

    BigInteger availableLiquidity(String asset);

    long annualRateBps(String asset);

    long settlementSeconds();

    void borrow(String asset, BigInteger amount, String recipient);

    void repay(String asset, BigInteger amount, String payer);
}
