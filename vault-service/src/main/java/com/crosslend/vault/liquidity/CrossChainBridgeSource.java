package com.crosslend.vault.liquidity;

import com.crosslend.bridge.BridgeManager;
import com.crosslend.bridge.payload.LiquidityInstruction;
import com.crosslend.bridge.payload.LiquidityInstructionCodec;
import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.domain.Assets;
import com.crosslend.core.domain.LiquidityQuote;
import com.crosslend.core.domain.LiquiditySourceType;
import com.crosslend.core.domain.TransferStatus;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import com.crosslend.vault.custody.AssetCustody;
import com.crosslend.vault.ledger.AssetRegistry;
import com.crosslend.vault.transfer.LiquidityTransferRequest;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Liquidity held by our vault on another chain. A borrow reserves the remote amount and asks the
 * remote vault to release it; the funds show up here only once the transfer completes.
 * <p>
 * Remote liquidity is our last known view of the remote vault, updated by our own reservations and
 * by SYNC reports.
 */
@Slf4j
public class CrossChainBridgeSource implements LiquiditySource {

    private final LendingProperties.RemoteChain remote;
    private final BridgeManager bridge;
    private final AssetCustody custody;
    private final AssetRegistry assets;
    private final String vaultAddress;
    private final String remoteVault;
    private final Map<String, BigInteger> remoteLiquidity = new ConcurrentHashMap<>();
    private final AtomicLong repayNonce = new AtomicLong();

    public CrossChainBridgeSource(
            @NonNull LendingProperties.RemoteChain remote,
            @NonNull BridgeManager bridge,
            @NonNull AssetCustody custody,
            @NonNull AssetRegistry assets,
            @NonNull String vaultAddress
    ) {
        this.remote = remote;
        this.bridge = bridge;
        this.custody = custody;
        this.assets = assets;
        this.vaultAddress = Assets.normalize(vaultAddress);
        this.remoteVault = Assets.normalize(remote.vaultAddress());
        remote.liquidity().forEach((symbol, amount) -> {
            String address = assets.addressOf(symbol)
                    .orElseThrow(() -> new LendingException(ErrorCode.UNSUPPORTED_ASSET,
                            "remote chain " + remote.name() + " reports liquidity in unlisted asset " + symbol));
            remoteLiquidity.put(address, amount);
        });
    }

    @Override
    public String id() {
        return "bridge:" + remote.name();
    }

    @Override
    public LiquiditySourceType type() {
        return LiquiditySourceType.CROSS_CHAIN_BRIDGE;
    }

    public String chainName() {
        return remote.name();
    }

    public long chainId() {
        return remote.chainId();
    }

    public String remoteVault() {
        return remoteVault;
    }

    public BigInteger remoteLiquidity(String asset) {
        return remoteLiquidity.getOrDefault(asset, BigInteger.ZERO);
    }

    /**
     * Replaces our view with what the remote vault reported.
     */
    public void updateRemoteLiquidity(String asset, BigInteger amount) {
        BigInteger previous = remoteLiquidity.put(assets.require(asset), amount.max(BigInteger.ZERO));
        log.info("remote liquidity synced chain={} asset={} {} -> {}", remote.name(), asset, previous, amount);
    }

    @Override
    public BigInteger availableLiquidity(String asset) {
        return remoteLiquidity(asset);
    }

    @Override
    public LiquidityQuote quote(String asset, BigInteger amount) {
        return new LiquidityQuote(id(), type(), remoteVault, remote.chainId(), asset, amount,
                availableLiquidity(asset).min(amount), remote.feeBps(), remote.settlementSeconds(), remote.annualRateBps());
    }

    @Override
    public BorrowOutcome borrow(String asset, BigInteger amount, String recipient, BorrowContext context) {
        reserve(asset, amount);
        LiquidityInstruction release = new LiquidityInstruction(
                LiquidityInstruction.Action.RELEASE, context.requestId(), recipient, asset, amount);
        try {
            BridgeManager.Dispatch dispatch = bridge.send(remote.name(), remoteVault, LiquidityInstructionCodec.encode(release), Assets.NATIVE);
            log.info("release requested chain={} requestId={} protocol={} messageId={}",
                    remote.name(), context.requestId(), dispatch.protocolName(), dispatch.messageId());
            return new BorrowOutcome(true, context.requestId(), dispatch.protocolName(), dispatch.messageId());
        } catch (RuntimeException e) {
            restore(asset, amount);
            throw e;
        }
    }

    @Override
    public void onTransferResolved(LiquidityTransferRequest request) {
        if (request.status() == TransferStatus.COMPLETED) {
            custody.mint(request.asset(), request.recipient(), request.amount());
        } else if (request.status() == TransferStatus.FAILED) {
            restore(request.asset(), request.amount());
            log.info("remote liquidity restored chain={} requestId={} asset={} amount={}",
                    remote.name(), request.requestId(), request.asset(), request.amount());
        }
    }

    /**
     * Sends repaid principal back to the remote vault. The vault's local balance leaves this chain.
     */
    @Override
    public void repay(String asset, BigInteger amount) {
        String ref = Numeric.toHexStringWithPrefixZeroPadded(BigInteger.valueOf(repayNonce.incrementAndGet()), 64);
        LiquidityInstruction instruction = new LiquidityInstruction(
                LiquidityInstruction.Action.REPAY, ref, vaultAddress, asset, amount);
        bridge.send(remote.name(), remoteVault, LiquidityInstructionCodec.encode(instruction), Assets.NATIVE);
        custody.burn(asset, vaultAddress, amount);
        remoteLiquidity.merge(asset, amount, BigInteger::add);
    }

    @Override
    public boolean supportsAsset(String asset) {
        return assets.isSupported(asset) && remoteLiquidity.containsKey(asset);
    }

    @Override
    public boolean isAsynchronous() {
        return true;
    }

    private void reserve(String asset, BigInteger amount) {
        BigInteger[] after = new BigInteger[1];
        remoteLiquidity.compute(asset, (a, current) -> {
            BigInteger have = current == null ? BigInteger.ZERO : current;
            if (have.compareTo(amount) < 0) {
                throw new LendingException(ErrorCode.INSUFFICIENT_REMOTE_LIQUIDITY,
                        remote.name() + " has " + have + " of " + asset + ", asked " + amount);
            }
            after[0] = have.subtract(amount);
            return after[0];
        });
        log.debug("remote liquidity reserved chain={} asset={} amount={} left={}", remote.name(), asset, amount, after[0]);
    }

    private void restore(String asset, BigInteger amount) {
        remoteLiquidity.merge(asset, amount, BigInteger::add);
    }
}
