package com.crosslend.vault.flash;

import com.crosslend.core.error.ErrorCode;
import com.crosslend.core.error.LendingException;
import com.crosslend.core.events.LendingEventTypes;
import com.crosslend.vault.VaultFixture;
import com.crosslend.vault.custody.AssetCustody;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.crosslend.vault.VaultFixture.ALICE;
import static com.crosslend.vault.VaultFixture.BOB;
import static com.crosslend.vault.VaultFixture.ETH;
import static com.crosslend.vault.VaultFixture.VAULT;
import static com.crosslend.vault.VaultFixture.eth;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlashLoanModuleTest {

    private static final String RECEIVER = "0x00000000000000000000000000000000000f1a54";

    private final VaultFixture f = new VaultFixture();

    @Test
    void repaidLoanAddsTheFeeToReserves() {
        f.deposit(ALICE, ETH, eth(100));
        f.fund(RECEIVER, ETH, eth(1));

        BigInteger fee = f.vault.flashLoan(BOB, repaying(BigInteger.ZERO), ETH, eth(100), new byte[]{1, 2});

        // 9 bps of 100 ETH
        assertThat(fee).isEqualTo(new BigInteger("90000000000000000"));
        assertThat(f.custody.balanceOf(ETH, VAULT)).isEqualTo(eth(100).add(fee));
        assertThat(f.ledger.pool(ETH).getReserves()).isEqualTo(fee);
        assertThat(f.eventTypes).contains(LendingEventTypes.FLASH_LOAN);
    }

    @Test
    void shortRepaymentUnwindsEverything() {
        f.deposit(ALICE, ETH, eth(100));
        f.fund(RECEIVER, ETH, eth(1));
        var before = f.custody.snapshot();

        assertThatThrownBy(() -> f.vault.flashLoan(BOB, repaying(BigInteger.ONE.negate()), ETH, eth(100), null))
                .isInstanceOf(LendingException.class)
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.FLASH_LOAN_NOT_REPAID));

        assertThat(f.custody.snapshot()).isEqualTo(before);
        assertThat(f.ledger.pool(ETH).getReserves()).isZero();
    }

    @Test
    void abortingReceiverUnwindsEverything() {
        f.deposit(ALICE, ETH, eth(10));
        FlashLoanReceiver aborting = receiver((loan, custody) -> false);

        assertThatThrownBy(() -> f.vault.flashLoan(BOB, aborting, ETH, eth(10), null))
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.FLASH_LOAN_NOT_REPAID));
        assertThat(f.custody.balanceOf(ETH, VAULT)).isEqualTo(eth(10));
        assertThat(f.custody.balanceOf(ETH, RECEIVER)).isZero();
    }

    @Test
    void receiverCannotReenterTheVault() {
        f.deposit(ALICE, ETH, eth(10));
        AtomicReference<LendingException> seen = new AtomicReference<>();
        FlashLoanReceiver reentrant = receiver((loan, custody) -> {
            try {
                f.vault.deposit(RECEIVER, ETH, loan.amount());
            } catch (LendingException e) {
                seen.set(e);
            }
            custody.transfer(loan.asset(), RECEIVER, loan.vault(), loan.amount());
            return true;
        });

        assertThatThrownBy(() -> f.vault.flashLoan(BOB, reentrant, ETH, eth(10), null))
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.FLASH_LOAN_NOT_REPAID));
        assertThat(seen.get()).isNotNull();
        assertThat(seen.get().code()).isEqualTo(ErrorCode.REENTRANT_CALL);
        assertThat(f.ledger.deposited(RECEIVER, ETH)).isZero();
    }

    @Test
    void refusesLoansLargerThanTheVaultHolds() {
        f.deposit(ALICE, ETH, eth(1));

        assertThatThrownBy(() -> f.vault.flashLoan(BOB, repaying(BigInteger.ZERO), ETH, eth(2), null))
                .satisfies(e -> assertThat(((LendingException) e).code()).isEqualTo(ErrorCode.INSUFFICIENT_LIQUIDITY));
    }

    private FlashLoanReceiver repaying(BigInteger extra) {
        return receiver((loan, custody) -> {
            custody.transfer(loan.asset(), RECEIVER, loan.vault(), loan.amountOwed().add(extra));
            return true;
        });
    }

    private static FlashLoanReceiver receiver(Operation operation) {
        return new FlashLoanReceiver() {
            @Override
            public String address() {
                return RECEIVER;
            }

            @Override
            public boolean executeOperation(Loan loan, AssetCustody custody) {
                return operation.run(loan, custody);
            }
        };
    }

    @FunctionalInterface
    private interface Operation {
        boolean run(FlashLoanReceiver.Loan loan, AssetCustody custody);
    }
}
