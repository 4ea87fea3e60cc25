package com.crosslend.vault.liquidity;

import com.crosslend.core.domain.LiquidityQuote;
import com.crosslend.core.domain.LiquiditySourceType;
import com.crosslend.vault.transfer.LiquidityTransferRequest;

import java.math.BigInteger;

/**
 * Somewhere a borrow can be funded from. Quotes are side-effect free; {@code borrow} moves funds (or,
 * for asynchronous sources, reserves them and starts the transfer).
 */
public interface LiquiditySource {

    /**
     * Stable key inside the router; also the key debt principal is booked under.
     */
    String id();

    LiquiditySourceType type();

    BigInteger availableLiquidity(String asset);

    LiquidityQuote quote(String asset, BigInteger amount);

    BorrowOutcome borrow(String asset, BigInteger amount, String recipient, BorrowContext context);

    /**
     * Hands repaid principal, already held by the vault, back to this source.
     */
    void repay(String asset, BigInteger amount);

    boolean supportsAsset(String asset);

    boolean isAsynchronous();

    /**
     * Called once an asynchronous transfer this source started reaches COMPLETED or FAILED.
     */
    default void onTransferResolved(LiquidityTransferRequest request) {
    }

    /**
     * @param borrower  account that will carry the debt
     * @param requestId transfer request id, set only for asynchronous sources
     */
    record BorrowContext(String borrower, String requestId) {
    }

    /**
     * @param requestId empty for synchronous sources
     */
    record BorrowOutcome(boolean success, String requestId, String protocol, String messageId) {

        public static BorrowOutcome settled() {
            return new BorrowOutcome(true, "", null, null);
        }
    }
}
