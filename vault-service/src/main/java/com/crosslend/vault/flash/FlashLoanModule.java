package com.crosslend.vault.flash;

import com.crosslend.core.config.LendingProperties;
import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import com.crosslend.core.rate.RateMath;
import com.crosslend.vault.custody.AssetCustody;
import com.crosslend.vault.custody.CustodySnapshot;
import com.crosslend.vault.ledger.CollateralLedger;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Same-call borrow and repay. Custody is snapshotted before the loan goes out and restored wholesale
 * if the receiver does not pay back principal plus fee.
 */
@Slf4j
@RequiredArgsConstructor
public class FlashLoanModule {

    private final @NonNull AssetCustody custody;
    private final @NonNull CollateralLedger ledger;
    private final @NonNull LendingProperties.FlashLoan settings;
    private final @NonNull String vaultAddress;

    public BigInteger feeFor(BigInteger amount) {
        return RateMath.bps(amount, settings.feeBps());
    }

    /**
     * @return fee collected
     */
    public BigInteger execute(String initiator, FlashLoanReceiver receiver, String asset, BigInteger amount, byte[] data) {
        if (!settings.enabled()) {
            throw new LendingException(ErrorCode.FLASH_LOANS_DISABLED, "flash loans are switched off");
        }
        BigInteger before = custody.balanceOf(asset, vaultAddress);
        if (before.compareTo(amount) < 0) {
            throw new LendingException(ErrorCode.INSUFFICIENT_LIQUIDITY,
                    "vault holds " + before + " of " + asset + ", flash loan asked " + amount);
        }
        BigInteger fee = feeFor(amount);
        FlashLoanReceiver.Loan loan = new FlashLoanReceiver.Loan(asset, amount, fee, initiator, vaultAddress,
                data == null ? new byte[0] : data.clone());

        CustodySnapshot snapshot = custody.snapshot();
        custody.transfer(asset, vaultAddress, receiver.address(), amount);
        boolean ok;
        try {
            ok = receiver.executeOperation(loan, custody);
        } catch (RuntimeException e) {
            custody.restore(snapshot);
            throw new LendingException(ErrorCode.FLASH_LOAN_NOT_REPAID, "receiver " + receiver.address() + " threw", e);
        }
        BigInteger gained = custody.balanceOf(asset, vaultAddress).subtract(before);
        if (!ok || gained.compareTo(fee) < 0) {
            custody.restore(snapshot);
            throw new LendingException(ErrorCode.FLASH_LOAN_NOT_REPAID,
                    "expected +" + fee + " of " + asset + ", vault moved by " + gained + (ok ? "" : " (receiver aborted)"));
        }
        ledger.addReserves(asset, gained);
        log.info("flash loan repaid initiator={} receiver={} asset={} amount={} fee={}",
                initiator, receiver.address(), asset, amount, gained);
        return gained;
    }
}
