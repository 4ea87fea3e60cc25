package com.crosslend.vault.liquidity;

import com.crosslend.bridge.adapter.BridgeAdapter;
import com.crosslend.bridge.payload.LiquidityInstruction;
import com.crosslend.bridge.payload.LiquidityInstructionCodec;
import com.crosslend.core.domain.Assets;
import com.crosslend.vault.custody.AssetCustody;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * LIVE-mode market: borrow and repay go to the pool contract through the money-market adapter.
 * Liquidity is tracked from configuration and adjusted as we draw on it; the local custody book
 * mirrors the on-chain movement.
 */
@Slf4j
public class AdapterMoneyMarket implements ExternalMoneyMarket {

    private final String name;
    private final BridgeAdapter adapter;
    private final String chainName;
    private final String poolAddress;
    private final long chainId;
    private final long annualRateBps;
    private final long settlementSeconds;
    private final AssetCustody custody;
    private final Map<String, BigInteger> liquidity = new ConcurrentHashMap<>();
    // keeps repeated identical instructions from collapsing into one message id
    private final AtomicLong nonce = new AtomicLong();

    public AdapterMoneyMarket(
            @NonNull String name,
            @NonNull BridgeAdapter adapter,
            @NonNull String chainName,
            @NonNull String poolAddress,
            long chainId,
            long annualRateBps,
            long settlementSeconds,
            @NonNull AssetCustody custody,
            @NonNull Map<String, BigInteger> initialLiquidity
    ) {
        this.name = name;
        this.adapter = adapter;
        this.chainName = chainName;
        this.poolAddress = Assets.normalize(poolAddress);
        this.chainId = chainId;
        this.annualRateBps = annualRateBps;
        this.settlementSeconds = settlementSeconds;
        this.custody = custody;
        this.liquidity.putAll(initialLiquidity);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String address() {
        return poolAddress;
    }

    @Override
    public long chainId() {
        return chainId;
    }

    @Override
    public BigInteger availableLiquidity(String asset) {
        return liquidity.getOrDefault(asset, BigInteger.ZERO);
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
        send(LiquidityInstruction.Action.RELEASE, recipient, asset, amount);
        liquidity.merge(asset, amount.negate(), BigInteger::add);
        custody.mint(asset, recipient, amount);
    }

    @Override
    public void repay(String asset, BigInteger amount, String payer) {
        send(LiquidityInstruction.Action.REPAY, payer, asset, amount);
        custody.burn(asset, payer, amount);
        liquidity.merge(asset, amount, BigInteger::add);
    }

    private void send(LiquidityInstruction.Action action, String account, String asset, BigInteger amount) {
        String ref = Numeric.toHexStringWithPrefixZeroPadded(BigInteger.valueOf(nonce.incrementAndGet()), 64);
        byte[] payload = LiquidityInstructionCodec.encode(new LiquidityInstruction(action, ref, account, asset, amount));
        String messageId = adapter.sendMessage(chainName, poolAddress, payload, Assets.NATIVE);
        log.info("money market {} {} asset={} amount={} account={} messageId={}", name, action, asset, amount, account, messageId);
    }
}
