package com.crosslend.vault.liquidity;

import com.crosslend.core.domain.LiquidityQuote;
import com.crosslend.core.domain.LiquiditySourceType;
import com.crosslend.vault.custody.AssetCustody;
import com.crosslend.vault.ledger.AssetRegistry;
import com.crosslend.vault.ledger.CollateralLedger;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;

/**
 * The vault's own pool: free, instant, and never lends past {@code totalDeposited - totalBorrowed}.
 */
@RequiredArgsConstructor
public class LocalVaultSource implements LiquiditySource {

    private final @NonNull CollateralLedger ledger;
    private final @NonNull AssetCustody custody;
    private final @NonNull AssetRegistry assets;
    private final @NonNull String vaultAddress;
    private final long chainId;

    @Override
    public String id() {
        return CollateralLedger.LOCAL_SOURCE;
    }

    @Override
    public LiquiditySourceType type() {
        return LiquiditySourceType.LOCAL_VAULT;
    }

    @Override
    public BigInteger availableLiquidity(String asset) {
        return ledger.pool(asset).available().min(custody.balanceOf(asset, vaultAddress));
    }

    @Override
    public LiquidityQuote quote(String asset, BigInteger amount) {
        BigInteger available = availableLiquidity(asset).min(amount);
        return new LiquidityQuote(id(), type(), vaultAddress, chainId, asset, amount, available, 0L, 0L, 0L);
    }

    @Override
    public BorrowOutcome borrow(String asset, BigInteger amount, String recipient, BorrowContext context) {
        ledger.lendLocal(asset, amount);
        try {
            custody.transfer(asset, vaultAddress, recipient, amount);
        } catch (RuntimeException e) {
            ledger.returnLocal(asset, amount);
            throw e;
        }
        return BorrowOutcome.settled();
    }

    @Override
    public void repay(String asset, BigInteger amount) {
        ledger.returnLocal(asset, amount);
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
