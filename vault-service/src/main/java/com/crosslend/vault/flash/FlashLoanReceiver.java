package com.crosslend.vault.flash;

import com.crosslend.vault.custody.AssetCustody;

import java.math.BigInteger;

/**
 * Borrower side of a flash loan. The loan is already credited to {@link #address()} when
 * {@link #executeOperation} runs; before returning, the receiver must move {@code amount + fee} back
 * to {@code loan.vault()}.
 */
public interface FlashLoanReceiver {

    String address();

    /**
     * @return false to abort; the loan is then unwound
     */
    boolean executeOperation(Loan loan, AssetCustody custody);

    record Loan(String asset, BigInteger amount, BigInteger fee, String initiator, String vault, byte[] data) {

        public BigInteger amountOwed() {
            return amount.add(fee);
        }
    }
}
