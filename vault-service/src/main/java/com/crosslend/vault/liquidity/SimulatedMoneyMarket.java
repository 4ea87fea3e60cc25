package com.crosslend.vault.liquidity;

import com.crosslend.vault.custody.AssetCustody;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;

/**
 * PAPER-mode market whose liquidity is simply its custody balance. The rate is flat.
 */
@RequiredArgsConstructor
public class SimulatedMoneyMarket implements ExternalMoneyMarket {

    private final @NonNull String name;
    private final @NonNull String address;
    private final long chainId;
    private final long annualRateBps;
    private final long settlementSeconds;
    private final @NonNull AssetCustody custody;

    @Override
    public String name() {
        return name;
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public long chainId() {
        return chainId;
    }

    @Override
    public BigInteger availableLiquidity(String asset) {
        return custody.balanceOf(asset, address);
    }

    @Override
    public long annualRateBps(String asset) {
        return annualRateBps;
    }

    @Override
    public long settlementSeconds() {
        return settlementSeconds;
    }

    @Override
    public void borrow(String asset, BigInteger amount, String recipient) {
        custody.transfer(asset, address, recipient, amount);
    }

    @Override
    public void repay(String asset, BigInteger amount, String payer) {
        custody.transfer(asset, payer, address, amount);
    }
}
