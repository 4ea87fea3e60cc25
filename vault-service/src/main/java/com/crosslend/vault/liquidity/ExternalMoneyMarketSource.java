package com.crosslend.vault.liquidity;

import com.crosslend.core.domain.LiquidityQuote;
import com.crosslend.core.domain.LiquiditySourceType;
import com.crosslend.vault.ledger.AssetRegistry;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;

/**
 * Borrows from an external market. No upfront fee, but the market's own rate counts against it.
 */
@RequiredArgsConstructor
public class ExternalMoneyMarketSource implements LiquiditySource {

    private final @NonNull ExternalMoneyMarket market;
    private final @NonNull AssetRegistry assets;
    private final @NonNull String vaultAddress;

    @Override
    public String id() {
        return "market:" + market.name();
    }

    @Override
    public LiquiditySourceType type() {
        return LiquiditySourceType.EXTERNAL_MONEY_MARKET;
    }

    @Override
    public BigInteger availableLiquidity(String asset) {
        return market.availableLiquidity(asset).max(BigInteger.ZERO);
    }

    @Override
    public LiquidityQuote quote(String asset, BigInteger amount) {
        return new LiquidityQuote(id(), type(), market.address(), market.chainId(), asset, amount,
                availableLiquidity(asset).min(amount), 0L, market.settlementSeconds(), market.annualRateBps(asset));
    }

    @Override
    public BorrowOutcome borrow(String asset, BigInteger amount, String recipient, BorrowContext context) {
        market.borrow(asset, amount, recipient);
        return BorrowOutcome.settled();
    }

    @Override
    public void repay(String asset, BigInteger amount) {
        market.repay(asset, amount, vaultAddress);
    }

    @Override
    public boolean supportsAsset(String asset) {
        return assets.isSupported(asset);
    }

    @Override
    public boolean isAsynchronous() {
        return false;
    }
}
